package org.rttrail.flappybird.db;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import reactor.core.publisher.Mono;

public interface FlappyBirdScoreRepository extends ReactiveCrudRepository<FlappyBirdScoreEntity, UUID> {

	Mono<Long> deleteAllByUserId(UUID userId);
	
}
