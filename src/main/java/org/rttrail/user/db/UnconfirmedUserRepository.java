package org.rttrail.user.db;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface UnconfirmedUserRepository extends ReactiveCrudRepository<UnconfirmedUserEntity, UUID> {

	Mono<UnconfirmedUserEntity> findByActivationToken(String activationToken);
	
	Flux<UnconfirmedUserEntity> findAllByEmail(String email);
	
	Mono<Void> deleteAllByEmail(String email);
	
	Mono<Long> deleteAllByExpireOnLessThan(long time);

}
