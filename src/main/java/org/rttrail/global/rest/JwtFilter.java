package org.rttrail.global.rest;

import java.util.Optional;

import org.rttrail.global.RttrailUtils;
import org.rttrail.global.exceptions.InvalidTokenException;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContextImpl;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Decodes the bearer token if any. A rejected token does not stop the request: the failure is kept
 * as an exchange attribute and reported by the handlers that require authentication.
 */
@RequiredArgsConstructor
@Slf4j(topic = RttrailUtils.LOG_ACCESS)
public class JwtFilter implements WebFilter {

	public static final String TOKEN_ERROR_ATTRIBUTE = "rttrail.tokenError";
	
	private static final String BEARER = "Bearer ";

	private final ReactiveAuthenticationManager authManager;
	
	@Override
	public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
		return Mono.justOrEmpty(exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION))
		.filter(authHeader -> authHeader.regionMatches(true, 0, BEARER, 0, BEARER.length()))
		.map(authHeader -> authHeader.substring(BEARER.length()).trim())
		.flatMap(token -> authManager.authenticate(new UsernamePasswordAuthenticationToken(null, token)))
		.map(Optional::of)
		.onErrorResume(InvalidTokenException.class, error -> {
			log.info("Token rejected ({}): {} ({})", error.getKind(), error.getDetail(), exchange.<String>getAttribute(RequestId.KEY));
			exchange.getAttributes().put(TOKEN_ERROR_ATTRIBUTE, error);
			return Mono.just(Optional.<Authentication>empty());
		})
		.switchIfEmpty(Mono.just(Optional.<Authentication>empty()))
		.flatMap(auth -> {
			if (auth.isEmpty()) return chain.filter(exchange);
			SecurityContextImpl securityContext = new SecurityContextImpl(auth.get());
			return chain.filter(exchange)
				.contextWrite(ReactiveSecurityContextHolder.withSecurityContext(Mono.just(securityContext)));
		});
	}
	
}
