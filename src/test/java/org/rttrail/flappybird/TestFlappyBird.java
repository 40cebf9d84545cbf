package org.rttrail.flappybird;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.rttrail.auth.AccessGate;
import org.rttrail.flappybird.dto.FlappyBirdScore;
import org.rttrail.flappybird.dto.FlappyBirdScoreCreate;
import org.rttrail.flappybird.dto.RankedScore;
import org.rttrail.test.AbstractTest;
import org.rttrail.test.TestService.TestUserLoggedIn;
import org.rttrail.test.TestUtils;
import org.rttrail.user.AccountType;

class TestFlappyBird extends AbstractTest {

	// far above the scores of the other tests so these users lead the board
	private static final int TOP = 1_500_000_000;
	
	private static FlappyBirdScore addScore(TestUserLoggedIn user, int value) {
		var response = user.post("/api/flappybird/v1/scores", new FlappyBirdScoreCreate(value));
		assertThat(response.statusCode()).isEqualTo(201);
		return response.getBody().as(FlappyBirdScore.class);
	}
	
	@Test
	void testLeaderboard() {
		var user1 = test.createUserAndLogin();
		var user2 = test.createUserAndLogin();
		var user3 = test.createUserAndLogin();
		
		var score = addScore(user1, TOP + 5);
		assertThat(score.getUser().getId()).isEqualTo(user1.getId());
		assertThat(score.getUser().getName()).isEqualTo(user1.getName());
		assertThat(score.getValue()).isEqualTo(TOP + 5);
		addScore(user1, TOP + 50);
		addScore(user2, TOP + 30);
		addScore(user3, TOP + 40);
		addScore(user3, TOP + 10);
		
		var response = user1.get("/api/flappybird/v1/scores");
		assertThat(response.statusCode()).isEqualTo(200);
		var board = response.getBody().as(RankedScore[].class);
		assertThat(board).hasSizeLessThanOrEqualTo(FlappyBirdService.DEFAULT_LIMIT).hasSizeGreaterThanOrEqualTo(3);
		assertThat(Arrays.copyOf(board, 3)).extracting(RankedScore::getPosition).containsExactly(1, 2, 3);
		assertThat(Arrays.copyOf(board, 3)).extracting(s -> s.getUser().getId()).containsExactly(user1.getId(), user3.getId(), user2.getId());
		assertThat(Arrays.copyOf(board, 3)).extracting(RankedScore::getValue).containsExactly(TOP + 50, TOP + 40, TOP + 30);
		
		response = user1.request().queryParam("limit", 2).get("/api/flappybird/v1/scores");
		assertThat(response.getBody().as(RankedScore[].class)).hasSize(2);
		
		response = user2.get("/api/flappybird/v1/scores/me");
		assertThat(response.statusCode()).isEqualTo(200);
		var mine = response.getBody().as(RankedScore.class);
		assertThat(mine.getPosition()).isEqualTo(3);
		assertThat(mine.getValue()).isEqualTo(TOP + 30);
		assertThat(mine.getUser().getId()).isEqualTo(user2.getId());
	}
	
	@Test
	void testMyBestScore() {
		var user = test.createUserAndLogin();
		TestUtils.expectError(user.get("/api/flappybird/v1/scores/me"), 404, "score-not-found");
		addScore(user, 3);
		addScore(user, 12);
		addScore(user, 7);
		var response = user.get("/api/flappybird/v1/scores/me");
		assertThat(response.statusCode()).isEqualTo(200);
		var mine = response.getBody().as(RankedScore.class);
		assertThat(mine.getValue()).isEqualTo(12);
		assertThat(mine.getPosition()).isPositive();
	}
	
	@Test
	void testInvalidRequests() {
		var user = test.createUserAndLogin();
		TestUtils.expectError(user.post("/api/flappybird/v1/scores", new FlappyBirdScoreCreate(-1)), 400, "invalid-value");
		TestUtils.expectError(user.post("/api/flappybird/v1/scores", new FlappyBirdScoreCreate(null)), 400, "missing-value");
		TestUtils.expectError(user.request().queryParam("limit", 0).get("/api/flappybird/v1/scores"), 400, "invalid-limit");
		TestUtils.expectError(user.request().queryParam("limit", FlappyBirdService.MAX_LIMIT + 1).get("/api/flappybird/v1/scores"), 400, "invalid-limit");
		TestUtils.expectError(user.request().queryParam("limit", "abc").get("/api/flappybird/v1/scores"), 400, "invalid-limit");
	}
	
	@Test
	void testAdminDeletesScores() {
		var user = test.createUserAndLogin();
		addScore(user, 1);
		TestUtils.expectError(user.delete("/api/flappybird/v1/scores/{userId}", user.getId()), 403, AccessGate.INSUFFICIENT_PRIVILEGE);
		
		var admin = test.createUserAndLogin(AccountType.ADMIN);
		assertThat(admin.delete("/api/flappybird/v1/scores/{userId}", user.getId()).statusCode()).isEqualTo(204);
		TestUtils.expectError(user.get("/api/flappybird/v1/scores/me"), 404, "score-not-found");
	}
	
}
