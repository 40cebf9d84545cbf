package org.rttrail.global.rest;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Identifier generated by {@link HttpFilter} for each request, available as an exchange attribute
 * and in the Reactor context of the request pipeline.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RequestId {

	public static final String KEY = "rttrail.requestId";
	public static final String HEADER = "X-Request-Id";
	
	private static final String UNKNOWN = "-";
	
	public static Mono<String> current() {
		return Mono.deferContextual(ctx -> Mono.just(ctx.getOrDefault(KEY, UNKNOWN)));
	}
	
}
