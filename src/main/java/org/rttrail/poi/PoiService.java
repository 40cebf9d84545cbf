package org.rttrail.poi;

import java.util.UUID;

import org.rttrail.global.RttrailUtils;
import org.rttrail.global.exceptions.BadRequestException;
import org.rttrail.global.exceptions.ForbiddenException;
import org.rttrail.global.exceptions.NotFoundException;
import org.rttrail.global.exceptions.ValidationUtils;
import org.rttrail.poi.db.PoiEntity;
import org.rttrail.poi.db.PoiRepository;
import org.rttrail.poi.db.VoteRepository;
import org.rttrail.poi.dto.Poi;
import org.rttrail.poi.dto.PoiCreate;
import org.rttrail.poi.dto.PoiUpdate;
import org.rttrail.poi.dto.VoteRequest;
import org.rttrail.user.AccountType;
import org.rttrail.user.db.UserEntity;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
public class PoiService {

	public static final String NOT_OWNER = "not-owner";
	
	public static final int TITLE_MAX_LENGTH = 100;
	public static final int DESCRIPTION_MAX_LENGTH = 2000;
	public static final int IMAGE_URL_MAX_LENGTH = 2000;
	
	private final PoiRepository poiRepo;
	private final VoteRepository voteRepo;
	private final R2dbcEntityTemplate r2dbc;
	
	public static Poi toDto(PoiEntity entity) {
		return new Poi(
			entity.getId(), entity.getUserId(), entity.getCreationTime(),
			entity.getTitle(), entity.getType(), entity.getDescription(),
			entity.getLatitude(), entity.getLongitude(), entity.getImageUrl(),
			entity.getVoteScore()
		);
	}
	
	public Mono<Poi> create(PoiCreate request, UserEntity author) {
		String title = RttrailUtils.trimToNull(request.getTitle());
		String description = RttrailUtils.trimToNull(request.getDescription());
		String imageUrl = RttrailUtils.trimToNull(request.getImageUrl());
		ValidationUtils.field("title", title).notBlank().maxLength(TITLE_MAX_LENGTH);
		ValidationUtils.field("type", request.getType()).notNull();
		ValidationUtils.field("description", description).nullable().maxLength(DESCRIPTION_MAX_LENGTH);
		ValidationUtils.field("imageUrl", imageUrl).nullable().maxLength(IMAGE_URL_MAX_LENGTH);
		ValidationUtils.field("latitude", request.getLatitude()).notNull().between(-90, 90);
		ValidationUtils.field("longitude", request.getLongitude()).notNull().between(-180, 180);
		PoiEntity entity = new PoiEntity(
			UUID.randomUUID(), author.getId(), System.currentTimeMillis(),
			title, request.getType(), description,
			request.getLatitude(), request.getLongitude(), imageUrl,
			0
		);
		return r2dbc.insert(entity).map(PoiService::toDto);
	}
	
	public Mono<Poi> get(UUID id) {
		return findPoi(id).map(PoiService::toDto);
	}
	
	public Flux<Poi> getInBox(Double minLat, Double maxLat, Double minLng, Double maxLng) {
		ValidationUtils.field("minLat", minLat).notNull().between(-90, 90);
		ValidationUtils.field("maxLat", maxLat).notNull().between(-90, 90);
		ValidationUtils.field("minLng", minLng).notNull().between(-180, 180);
		ValidationUtils.field("maxLng", maxLng).notNull().between(-180, 180);
		if (minLat > maxLat || minLng > maxLng) throw new BadRequestException("invalid-box", "The minimum coordinates must not exceed the maximum ones");
		return r2dbc.select(PoiEntity.class)
			.matching(Query.query(
				Criteria.where("latitude").between(minLat, maxLat)
				.and("longitude").between(minLng, maxLng)
			).sort(Sort.by("creationTime")))
			.all()
			.map(PoiService::toDto);
	}
	
	public Mono<Poi> update(UUID id, PoiUpdate update, UserEntity user) {
		String title = RttrailUtils.trimToNull(update.getTitle());
		String description = RttrailUtils.trimToNull(update.getDescription());
		String imageUrl = RttrailUtils.trimToNull(update.getImageUrl());
		ValidationUtils.field("title", title).nullable().maxLength(TITLE_MAX_LENGTH);
		ValidationUtils.field("description", description).nullable().maxLength(DESCRIPTION_MAX_LENGTH);
		ValidationUtils.field("imageUrl", imageUrl).nullable().maxLength(IMAGE_URL_MAX_LENGTH);
		return findPoi(id)
		.doOnNext(poi -> checkCanModify(poi, user))
		.flatMap(poi -> {
			if (title != null) poi.setTitle(title);
			if (update.getType() != null) poi.setType(update.getType());
			if (description != null) poi.setDescription(description);
			if (imageUrl != null) poi.setImageUrl(imageUrl);
			return poiRepo.save(poi);
		})
		.map(PoiService::toDto);
	}
	
	@Transactional
	public Mono<Void> delete(UUID id, UserEntity user) {
		return findPoi(id)
		.doOnNext(poi -> checkCanModify(poi, user))
		.flatMap(poi -> voteRepo.deleteAllByPoiId(poi.getId()).then(poiRepo.delete(poi)));
	}
	
	@Transactional
	public Mono<Poi> vote(UUID id, VoteRequest request, UserEntity user) {
		ValidationUtils.field("value", request.getValue()).notNull();
		return findPoi(id)
		.flatMap(poi -> r2dbc.getDatabaseClient().sql(
				"INSERT INTO poi_vote (id, poi_id, user_id, value, creation_time) VALUES ($1, $2, $3, $4, $5)" +
				" ON CONFLICT (poi_id, user_id) DO UPDATE SET value = EXCLUDED.value, creation_time = EXCLUDED.creation_time"
			)
			.bind(0, UUID.randomUUID())
			.bind(1, poi.getId())
			.bind(2, user.getId())
			.bind(3, request.getValue().getWeight())
			.bind(4, System.currentTimeMillis())
			.then()
		)
		.then(updateVoteScore(id));
	}
	
	@Transactional
	public Mono<Poi> removeVote(UUID id, UserEntity user) {
		return findPoi(id)
		.flatMap(poi -> voteRepo.deleteAllByPoiIdAndUserId(poi.getId(), user.getId()))
		.then(updateVoteScore(id));
	}
	
	private Mono<Poi> updateVoteScore(UUID id) {
		return r2dbc.getDatabaseClient().sql("UPDATE poi SET vote_score = COALESCE((SELECT SUM(v.value) FROM poi_vote v WHERE v.poi_id = $1), 0) WHERE id = $1")
			.bind(0, id)
			.then()
			.then(Mono.defer(() -> get(id)));
	}
	
	private Mono<PoiEntity> findPoi(UUID id) {
		return poiRepo.findById(id).switchIfEmpty(Mono.error(() -> new NotFoundException("poi", id.toString())));
	}
	
	static void checkCanModify(PoiEntity poi, UserEntity user) {
		if (poi.getUserId().equals(user.getId())) return;
		if (user.getAccountType().isAtLeast(AccountType.MODERATOR)) return;
		throw new ForbiddenException(NOT_OWNER, "Only the author or a moderator can modify this point of interest");
	}
	
}
