package org.rttrail.auth.rest;

import org.rttrail.auth.AuthService;
import org.rttrail.auth.Authenticated;
import org.rttrail.auth.ScopeType;
import org.rttrail.auth.Scopes;
import org.rttrail.auth.dto.AccessToken;
import org.rttrail.auth.dto.LoginForm;
import org.rttrail.global.rest.RetryRest;
import org.rttrail.user.UserService;
import org.rttrail.user.db.UserEntity;
import org.rttrail.user.dto.User;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/auth/v1")
@RequiredArgsConstructor
public class AuthV1Controller {

	private final AuthService service;
	
	@PostMapping(path = "access-token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
	public Mono<AccessToken> accessToken(@ModelAttribute LoginForm form) {
		return RetryRest.retry(service.login(form.getUsername(), form.getPassword(), ScopeType.API));
	}
	
	@PostMapping(path = "simple-token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
	public Mono<AccessToken> simpleToken(@ModelAttribute LoginForm form) {
		return RetryRest.retry(service.login(form.getUsername(), form.getPassword(), ScopeType.AUTH));
	}
	
	@PostMapping("test-token")
	public Mono<User> testToken(@Authenticated UserEntity user) {
		return Mono.just(UserService.toDto(user));
	}
	
	@GetMapping("userinfo")
	public Mono<User> userInfo(@Authenticated(scopes = { @Scopes(ScopeType.AUTH), @Scopes(ScopeType.API) }) UserEntity user) {
		return Mono.just(UserService.toDto(user));
	}
	
}
