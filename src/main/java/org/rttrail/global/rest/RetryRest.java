package org.rttrail.global.rest;

import java.time.Duration;

import org.apache.commons.lang3.RandomUtils;
import org.springframework.r2dbc.UncategorizedR2dbcException;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Retries read pipelines on transient R2DBC failures. Domain errors go through untouched. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RetryRest {

	private static final int MAX_RETRIES = 2;

	public static boolean isRetryable(Throwable t) {
		return t instanceof UncategorizedR2dbcException;
	}

	public static <T> Mono<T> retry(Mono<T> pipeline) {
		return retry(pipeline, 0);
	}
	
	private static <T> Mono<T> retry(Mono<T> pipeline, int numRetry) {
		if (numRetry == MAX_RETRIES) return pipeline;
		return pipeline.onErrorResume(RetryRest::isRetryable, error -> delay(numRetry).then(retry(pipeline, numRetry + 1)));
	}
	
	public static <T> Flux<T> retry(Flux<T> pipeline) {
		return retry(pipeline, 0);
	}
	
	private static <T> Flux<T> retry(Flux<T> pipeline, int numRetry) {
		if (numRetry == MAX_RETRIES) return pipeline;
		return pipeline.onErrorResume(RetryRest::isRetryable, error -> delay(numRetry).thenMany(retry(pipeline, numRetry + 1)));
	}
	
	private static Mono<Long> delay(int numRetry) {
		long min = numRetry == 0 ? 10 : numRetry * 10L;
		long max = numRetry == 0 ? 200 : numRetry * 200L;
		return Mono.delay(Duration.ofMillis(RandomUtils.insecure().randomLong(min, max)));
	}
	
}
