package org.rttrail.user.db;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import reactor.core.publisher.Flux;

public interface EmailMigrationCodeRepository extends ReactiveCrudRepository<EmailMigrationCodeEntity, String> {

	Flux<EmailMigrationCodeEntity> findAllByUserId(UUID userId);

}
