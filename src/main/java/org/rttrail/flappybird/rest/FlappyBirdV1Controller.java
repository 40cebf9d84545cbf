package org.rttrail.flappybird.rest;

import java.util.UUID;

import org.rttrail.auth.Authenticated;
import org.rttrail.flappybird.FlappyBirdService;
import org.rttrail.flappybird.dto.FlappyBirdScore;
import org.rttrail.flappybird.dto.FlappyBirdScoreCreate;
import org.rttrail.flappybird.dto.RankedScore;
import org.rttrail.global.rest.RetryRest;
import org.rttrail.user.AccountType;
import org.rttrail.user.db.UserEntity;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/flappybird/v1")
@RequiredArgsConstructor
public class FlappyBirdV1Controller {

	private final FlappyBirdService service;
	
	@PostMapping("/scores")
	@ResponseStatus(HttpStatus.CREATED)
	public Mono<FlappyBirdScore> addScore(@RequestBody FlappyBirdScoreCreate request, @Authenticated UserEntity user) {
		return service.addScore(request, user);
	}
	
	@GetMapping("/scores")
	public Flux<RankedScore> getLeaderboard(@RequestParam(name = "limit", required = false) Integer limit, @Authenticated UserEntity user) {
		return RetryRest.retry(service.getLeaderboard(limit));
	}
	
	@GetMapping("/scores/me")
	public Mono<RankedScore> getMyBestScore(@Authenticated UserEntity user) {
		return RetryRest.retry(service.getMyBestScore(user));
	}
	
	@DeleteMapping("/scores/{userId}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public Mono<Void> deleteScores(@PathVariable("userId") UUID userId, @Authenticated(accountType = AccountType.ADMIN) UserEntity admin) {
		return service.deleteScores(userId, admin);
	}
	
}
