package org.rttrail.user.db;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import reactor.core.publisher.Mono;

public interface UserRepository extends ReactiveCrudRepository<UserEntity, UUID> {

	Mono<UserEntity> findByEmail(String email);
	
	Mono<Boolean> existsByEmail(String email);

}
