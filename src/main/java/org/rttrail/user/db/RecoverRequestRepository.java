package org.rttrail.user.db;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface RecoverRequestRepository extends ReactiveCrudRepository<RecoverRequestEntity, String> {

	Flux<RecoverRequestEntity> findAllByEmail(String email);
	
	Mono<Void> deleteAllByEmail(String email);
	
	Mono<Long> deleteAllByExpireOnLessThan(long time);

}
