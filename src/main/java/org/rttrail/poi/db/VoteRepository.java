package org.rttrail.poi.db;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import reactor.core.publisher.Mono;

public interface VoteRepository extends ReactiveCrudRepository<VoteEntity, UUID> {

	Mono<VoteEntity> findByPoiIdAndUserId(UUID poiId, UUID userId);
	
	Mono<Long> deleteAllByPoiIdAndUserId(UUID poiId, UUID userId);
	
	Mono<Long> deleteAllByPoiId(UUID poiId);
	
}
