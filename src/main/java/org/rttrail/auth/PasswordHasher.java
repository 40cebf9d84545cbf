package org.rttrail.auth;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** One-way password hashing. Hashing is CPU bound, so it runs off the event loop. */
@Component
@RequiredArgsConstructor
public class PasswordHasher {

	private final PasswordEncoder encoder;
	
	public Mono<String> hash(String password) {
		return Mono.fromCallable(() -> encoder.encode(password))
			.subscribeOn(Schedulers.boundedElastic()).publishOn(Schedulers.parallel());
	}
	
	public Mono<Boolean> matches(String password, String hash) {
		if (password == null || hash == null) return Mono.just(false);
		return Mono.fromCallable(() -> encoder.matches(password, hash))
			.subscribeOn(Schedulers.boundedElastic()).publishOn(Schedulers.parallel());
	}
	
}
