package org.rttrail.test;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import org.apache.commons.lang3.RandomStringUtils;
import org.rttrail.auth.PasswordHasher;
import org.rttrail.auth.dto.AccessToken;
import org.rttrail.user.AccountType;
import org.rttrail.user.UserService;
import org.rttrail.user.db.UserEntity;
import org.rttrail.user.db.UserRepository;
import org.springframework.stereotype.Service;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class TestService {

	private final UserService userService;
	private final UserRepository userRepo;
	private final PasswordHasher hasher;
	
	private static Set<String> usedEmails = new HashSet<>();
	
	public TestUser createUser() {
		return createUser(AccountType.USER);
	}
	
	public TestUser createUser(AccountType accountType) {
		return createUser(RandomStringUtils.insecure().nextAlphabetic(3, 20), accountType);
	}
	
	public TestUser createUser(String name, AccountType accountType) {
		String email = email();
		String password = RandomStringUtils.insecure().nextAlphanumeric(8, 20);
		UserEntity user = hasher.hash(password)
			.flatMap(hash -> userService.createUser(UUID.randomUUID(), email, hash, name, accountType))
			.block();
		return new TestUser(user.getId(), email, password, name);
	}
	
	public String email() {
		do {
			String email = RandomStringUtils.insecure().nextAlphanumeric(3, 20).toLowerCase() + '@' + RandomStringUtils.insecure().nextAlphanumeric(3, 10).toLowerCase() + ".test";
			if (usedEmails.add(email)) return email;
		} while (true);
	}
	
	public void setActive(UUID userId, boolean active) {
		userRepo.findById(userId)
			.flatMap(user -> {
				user.setActive(active);
				return userRepo.save(user);
			})
			.block();
	}
	
	public static Response requestToken(String path, String username, String password) {
		return RestAssured.given()
			.contentType(ContentType.URLENC)
			.formParam("username", username)
			.formParam("password", password)
			.post(path);
	}
	
	public TestUserLoggedIn login(TestUser user) {
		var response = requestToken("/api/auth/v1/access-token", user.getEmail(), user.getPassword());
		assertThat(response.statusCode()).isEqualTo(200);
		var token = response.getBody().as(AccessToken.class);
		assertThat(token.getTokenType()).isEqualTo("bearer");
		return new TestUserLoggedIn(user.getId(), user.getEmail(), user.getPassword(), user.getName(), token.getAccessToken());
	}
	
	public TestUserLoggedIn createUserAndLogin() {
		return login(createUser());
	}
	
	public TestUserLoggedIn createUserAndLogin(AccountType accountType) {
		return login(createUser(accountType));
	}
	
	@AllArgsConstructor
	@Data
	public static class TestUser {
		private UUID id;
		private String email;
		private String password;
		private String name;
	}
	
	@AllArgsConstructor
	@Data
	public static class TestUserLoggedIn {
		private UUID id;
		private String email;
		private String password;
		private String name;
		private String accessToken;
		
		public RequestSpecification request() {
			return RestAssured.given().header("Authorization", "Bearer " + accessToken);
		}
		
		public Response get(String path, Object... pathParams) {
			return request().get(path, pathParams);
		}
		
		public Response post(String path, Object body) {
			return request().contentType(ContentType.JSON).body(body).post(path);
		}
		
		public Response put(String path, Object body) {
			return request().contentType(ContentType.JSON).body(body).put(path);
		}
		
		public Response patch(String path, Object body) {
			return request().contentType(ContentType.JSON).body(body).patch(path);
		}
		
		public Response delete(String path, Object... pathParams) {
			return request().delete(path, pathParams);
		}
	}
	
}
