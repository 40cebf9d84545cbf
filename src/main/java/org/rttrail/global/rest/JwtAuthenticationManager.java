package org.rttrail.global.rest;

import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Turns the raw bearer token into a {@link TokenAuthentication}.
 * Fails with {@link org.rttrail.global.exceptions.InvalidTokenException} when the token is rejected.
 */
@Component
@RequiredArgsConstructor
public class JwtAuthenticationManager implements ReactiveAuthenticationManager {

	private final JwtCodec codec;
	
	@Override
	public Mono<Authentication> authenticate(Authentication authentication) {
		return Mono.fromCallable(() -> {
			String token = authentication.getCredentials().toString();
			return new TokenAuthentication(codec.decode(token), token);
		});
	}
	
}
