package org.rttrail.user;

import static org.assertj.core.api.Assertions.assertThat;

import org.apache.commons.lang3.RandomStringUtils;
import org.junit.jupiter.api.Test;
import org.rttrail.test.AbstractTest;
import org.rttrail.test.TestUtils;
import org.rttrail.user.dto.User;
import org.rttrail.user.dto.UserSimple;
import org.rttrail.user.dto.UserUpdate;

import io.restassured.RestAssured;

class TestMe extends AbstractTest {

	@Test
	void testGetAndUpdateMe() {
		var user = test.createUserAndLogin();
		var response = user.get("/api/user/v1/me");
		assertThat(response.statusCode()).isEqualTo(200);
		var me = response.getBody().as(User.class);
		assertThat(me.getId()).isEqualTo(user.getId());
		assertThat(me.getEmail()).isEqualTo(user.getEmail());
		assertThat(me.getName()).isEqualTo(user.getName());
		assertThat(me.getAccountType()).isEqualTo(AccountType.USER);
		assertThat(me.isActive()).isTrue();
		
		response = user.patch("/api/user/v1/me", new UserUpdate("  New name "));
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.getBody().as(User.class).getName()).isEqualTo("New name");
		assertThat(user.get("/api/user/v1/me").getBody().as(User.class).getName()).isEqualTo("New name");
		
		// nothing to update
		response = user.patch("/api/user/v1/me", new UserUpdate(null));
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.getBody().as(User.class).getName()).isEqualTo("New name");
	}
	
	@Test
	void testNameTooLong() {
		var user = test.createUserAndLogin();
		var response = user.patch("/api/user/v1/me", new UserUpdate(RandomStringUtils.insecure().nextAlphabetic(101)));
		TestUtils.expectError(response, 400, "invalid-name-too-long");
	}
	
	@Test
	void testAskDeletion() {
		var user = test.createUserAndLogin();
		assertThat(user.request().post("/api/user/v1/me/ask-deletion").statusCode()).isEqualTo(204);
		// the account stays until an administrator removes it
		assertThat(user.get("/api/user/v1/me").statusCode()).isEqualTo(200);
	}
	
	@Test
	void testSearch() {
		var prefix = RandomStringUtils.insecure().nextAlphabetic(10).toLowerCase();
		test.createUser("zz" + prefix + " contained", AccountType.USER);
		test.createUser(prefix + " starting", AccountType.USER);
		test.createUser(prefix + " moderator", AccountType.MODERATOR);
		var user = test.createUserAndLogin();
		
		var response = user.request().queryParam("query", prefix).get("/api/user/v1/search");
		assertThat(response.statusCode()).isEqualTo(200);
		var found = response.getBody().as(UserSimple[].class);
		assertThat(found).extracting(UserSimple::getName).containsExactly(prefix + " moderator", prefix + " starting", "zz" + prefix + " contained");
		
		response = user.request().queryParam("query", prefix).queryParam("excludedAccountTypes", "MODERATOR").get("/api/user/v1/search");
		assertThat(response.getBody().as(UserSimple[].class)).extracting(UserSimple::getName).containsExactly(prefix + " starting", "zz" + prefix + " contained");
		
		response = user.request().queryParam("query", prefix.toUpperCase()).queryParam("includedAccountTypes", "MODERATOR").get("/api/user/v1/search");
		assertThat(response.getBody().as(UserSimple[].class)).extracting(UserSimple::getName).containsExactly(prefix + " moderator");
		
		response = user.request().queryParam("query", " ").get("/api/user/v1/search");
		assertThat(response.getBody().as(UserSimple[].class)).isEmpty();
	}
	
	@Test
	void testSearchIsLimited() {
		var prefix = RandomStringUtils.insecure().nextAlphabetic(10).toLowerCase();
		for (int i = 0; i < UserService.SEARCH_MAX_RESULTS + 3; i++)
			test.createUser(prefix + " " + i, AccountType.USER);
		var user = test.createUserAndLogin();
		var response = user.request().queryParam("query", prefix).get("/api/user/v1/search");
		assertThat(response.getBody().as(UserSimple[].class)).hasSize(UserService.SEARCH_MAX_RESULTS);
	}
	
	@Test
	void testSearchRequiresAuthentication() {
		var response = RestAssured.given().queryParam("query", "abc").get("/api/user/v1/search");
		TestUtils.expectError(response, 401, "not-authenticated");
	}
	
}
