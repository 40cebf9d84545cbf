package org.rttrail.user;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.rttrail.auth.AccessGate;
import org.rttrail.test.AbstractTest;
import org.rttrail.test.TestUtils;
import org.rttrail.user.dto.User;
import org.rttrail.user.dto.UserCount;
import org.rttrail.user.dto.UserUpdateAdmin;

class TestAdminUsers extends AbstractTest {

	@Test
	void testRequiresAdmin() {
		var user = test.createUserAndLogin();
		TestUtils.expectError(user.get("/api/admin/users/v1"), 403, AccessGate.INSUFFICIENT_PRIVILEGE);
		var moderator = test.createUserAndLogin(AccountType.MODERATOR);
		TestUtils.expectError(moderator.get("/api/admin/users/v1/count"), 403, AccessGate.INSUFFICIENT_PRIVILEGE);
	}
	
	@Test
	void testListAndCount() {
		var admin = test.createUserAndLogin(AccountType.ADMIN);
		var user = test.createUser();
		var moderator = test.createUser(AccountType.MODERATOR);
		
		var response = admin.get("/api/admin/users/v1");
		assertThat(response.statusCode()).isEqualTo(200);
		var users = response.getBody().as(User[].class);
		assertThat(users).extracting(User::getId).contains(admin.getId(), user.getId(), moderator.getId());
		
		response = admin.request().queryParam("accountTypes", "MODERATOR").get("/api/admin/users/v1");
		users = response.getBody().as(User[].class);
		assertThat(users).extracting(User::getId).contains(moderator.getId()).doesNotContain(admin.getId(), user.getId());
		assertThat(users).allMatch(u -> u.getAccountType() == AccountType.MODERATOR);
		
		response = admin.get("/api/admin/users/v1/count");
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.getBody().as(UserCount.class).getCount()).isGreaterThanOrEqualTo(3);
		
		response = admin.get("/api/admin/users/v1/account-types");
		assertThat(response.getBody().as(AccountType[].class)).containsExactly(AccountType.USER, AccountType.MODERATOR, AccountType.ADMIN);
	}
	
	@Test
	void testGetAndUpdateUser() {
		var admin = test.createUserAndLogin(AccountType.ADMIN);
		var user = test.createUser();
		
		var response = admin.get("/api/admin/users/v1/{id}", user.getId());
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.getBody().as(User.class).getEmail()).isEqualTo(user.getEmail());
		
		var newEmail = test.email();
		response = admin.patch("/api/admin/users/v1/" + user.getId(), new UserUpdateAdmin(newEmail.toUpperCase(), AccountType.MODERATOR, null));
		assertThat(response.statusCode()).isEqualTo(200);
		var updated = response.getBody().as(User.class);
		assertThat(updated.getEmail()).isEqualTo(newEmail);
		assertThat(updated.getAccountType()).isEqualTo(AccountType.MODERATOR);
		assertThat(updated.getName()).isEqualTo(user.getName());
		
		var other = test.createUser();
		response = admin.patch("/api/admin/users/v1/" + user.getId(), new UserUpdateAdmin(other.getEmail(), null, null));
		TestUtils.expectError(response, 400, "integrity-error");
		assertThat(admin.get("/api/admin/users/v1/{id}", user.getId()).getBody().as(User.class).getEmail()).isEqualTo(newEmail);
	}
	
	@Test
	void testUnknownUser() {
		var admin = test.createUserAndLogin(AccountType.ADMIN);
		TestUtils.expectError(admin.get("/api/admin/users/v1/{id}", UUID.randomUUID()), 404, "user-not-found");
		TestUtils.expectError(admin.patch("/api/admin/users/v1/" + UUID.randomUUID(), new UserUpdateAdmin(null, null, "name")), 404, "user-not-found");
	}
	
}
