package org.rttrail.auth.rest;

import org.rttrail.auth.AccessGate;
import org.rttrail.auth.Authenticated;
import org.rttrail.auth.ScopePolicy;
import org.rttrail.global.exceptions.InvalidTokenException;
import org.rttrail.global.exceptions.UnauthorizedException;
import org.rttrail.global.rest.JwtFilter;
import org.rttrail.global.rest.TokenAuthentication;
import org.springframework.core.MethodParameter;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.BindingContext;
import org.springframework.web.reactive.result.method.HandlerMethodArgumentResolver;
import org.springframework.web.server.ServerWebExchange;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/** Resolves {@link Authenticated} parameters. */
@Component
@RequiredArgsConstructor
public class AuthenticatedUserArgumentResolver implements HandlerMethodArgumentResolver {

	private final AccessGate gate;
	
	@Override
	public boolean supportsParameter(MethodParameter parameter) {
		return parameter.hasParameterAnnotation(Authenticated.class);
	}

	@Override
	public Mono<Object> resolveArgument(MethodParameter parameter, BindingContext bindingContext, ServerWebExchange exchange) {
		Authenticated annotation = parameter.getParameterAnnotation(Authenticated.class);
		ScopePolicy policy = ScopePolicy.of(annotation.scopes());
		return ReactiveSecurityContextHolder.getContext()
			.map(SecurityContext::getAuthentication)
			.filter(TokenAuthentication.class::isInstance)
			.cast(TokenAuthentication.class)
			.switchIfEmpty(Mono.error(() -> {
				InvalidTokenException tokenError = exchange.getAttribute(JwtFilter.TOKEN_ERROR_ATTRIBUTE);
				return tokenError != null ? tokenError : new UnauthorizedException();
			}))
			.flatMap(auth -> gate.authorize(auth.getTokenData(), policy, annotation.accountType()))
			.cast(Object.class);
	}
	
}
