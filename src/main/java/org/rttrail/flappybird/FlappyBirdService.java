package org.rttrail.flappybird;

import java.util.UUID;

import org.rttrail.flappybird.db.FlappyBirdScoreEntity;
import org.rttrail.flappybird.db.FlappyBirdScoreRepository;
import org.rttrail.flappybird.dto.FlappyBirdScore;
import org.rttrail.flappybird.dto.FlappyBirdScoreCreate;
import org.rttrail.flappybird.dto.RankedScore;
import org.rttrail.global.RttrailUtils;
import org.rttrail.global.exceptions.BadRequestException;
import org.rttrail.global.exceptions.NotFoundException;
import org.rttrail.global.exceptions.ValidationUtils;
import org.rttrail.global.rest.RequestId;
import org.rttrail.user.UserService;
import org.rttrail.user.db.UserEntity;
import org.rttrail.user.dto.UserSimple;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Service;

import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
@Slf4j(topic = RttrailUtils.LOG_SECURITY)
public class FlappyBirdService {

	public static final int DEFAULT_LIMIT = 10;
	public static final int MAX_LIMIT = 100;
	
	/** Best score of each user, the earliest one on equal values. */
	private static final String BEST_SCORES =
		"SELECT b.user_id, b.value, b.creation_time, u.name FROM (" +
		"SELECT DISTINCT ON (user_id) user_id, value, creation_time FROM flappybird_score ORDER BY user_id, value DESC, creation_time ASC" +
		") b JOIN core_user u ON u.id = b.user_id";
	
	private final FlappyBirdScoreRepository repo;
	private final R2dbcEntityTemplate r2dbc;
	
	public Mono<FlappyBirdScore> addScore(FlappyBirdScoreCreate request, UserEntity user) {
		ValidationUtils.field("value", request.getValue()).notNull();
		if (request.getValue() < 0) throw new BadRequestException(ValidationUtils.INVALID_PREFIX + "value", "value cannot be negative");
		FlappyBirdScoreEntity entity = new FlappyBirdScoreEntity(UUID.randomUUID(), user.getId(), request.getValue(), System.currentTimeMillis());
		return r2dbc.insert(entity)
			.map(score -> new FlappyBirdScore(UserService.toSimpleDto(user), score.getValue(), score.getCreationTime()));
	}
	
	public Flux<RankedScore> getLeaderboard(Integer limit) {
		int max = limit == null ? DEFAULT_LIMIT : limit;
		if (max < 1 || max > MAX_LIMIT) throw new BadRequestException(ValidationUtils.INVALID_PREFIX + "limit", "limit must be between 1 and " + MAX_LIMIT);
		return r2dbc.getDatabaseClient().sql(BEST_SCORES + " ORDER BY b.value DESC, b.creation_time ASC LIMIT $1")
			.bind(0, max)
			.map(FlappyBirdService::toScore)
			.all()
			.index()
			.map(indexed -> ranked(indexed.getT1().intValue() + 1, indexed.getT2()));
	}
	
	public Mono<RankedScore> getMyBestScore(UserEntity user) {
		return r2dbc.getDatabaseClient().sql(BEST_SCORES + " WHERE b.user_id = $1")
			.bind(0, user.getId())
			.map(FlappyBirdService::toScore)
			.one()
			.switchIfEmpty(Mono.error(() -> new NotFoundException("score", user.getId().toString())))
			.flatMap(best -> r2dbc.getDatabaseClient().sql(
					"SELECT COUNT(*) FROM (" + BEST_SCORES + ") r WHERE r.value > $1 OR (r.value = $1 AND r.creation_time < $2)"
				)
				.bind(0, best.getValue())
				.bind(1, best.getCreationTime())
				.map((row, meta) -> row.get(0, Long.class))
				.one()
				.map(better -> ranked(better.intValue() + 1, best))
			);
	}
	
	public Mono<Void> deleteScores(UUID userId, UserEntity admin) {
		return RequestId.current().flatMap(requestId ->
			repo.deleteAllByUserId(userId)
			.doOnNext(nb -> log.info("Administrator {} removed {} flappy bird scores of user {} ({})", admin.getId(), nb, userId, requestId))
			.then()
		);
	}
	
	private static FlappyBirdScore toScore(Readable row) {
		return new FlappyBirdScore(
			new UserSimple(row.get("user_id", UUID.class), row.get("name", String.class)),
			row.get("value", Integer.class),
			row.get("creation_time", Long.class)
		);
	}
	
	private static RankedScore ranked(int position, FlappyBirdScore score) {
		return new RankedScore(position, score.getUser(), score.getValue(), score.getCreationTime());
	}
	
}
