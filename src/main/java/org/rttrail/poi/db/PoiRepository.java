package org.rttrail.poi.db;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

public interface PoiRepository extends ReactiveCrudRepository<PoiEntity, UUID> {

}
