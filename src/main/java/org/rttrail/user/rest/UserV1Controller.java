package org.rttrail.user.rest;

import java.util.List;

import org.rttrail.auth.Authenticated;
import org.rttrail.global.dto.Result;
import org.rttrail.global.rest.RetryRest;
import org.rttrail.user.AccountService;
import org.rttrail.user.AccountType;
import org.rttrail.user.UserService;
import org.rttrail.user.db.UserEntity;
import org.rttrail.user.dto.ActivateRequest;
import org.rttrail.user.dto.ChangePasswordRequest;
import org.rttrail.user.dto.MailMigrationRequest;
import org.rttrail.user.dto.RecoverRequest;
import org.rttrail.user.dto.RegisterRequest;
import org.rttrail.user.dto.ResetPasswordRequest;
import org.rttrail.user.dto.User;
import org.rttrail.user.dto.UserSimple;
import org.rttrail.user.dto.UserUpdate;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
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
@RequestMapping("/api/user/v1")
@RequiredArgsConstructor
public class UserV1Controller {

	private final AccountService accountService;
	private final UserService userService;
	
	@PostMapping("register")
	@ResponseStatus(HttpStatus.CREATED)
	public Mono<Result> register(@RequestBody RegisterRequest request) {
		return accountService.register(request);
	}
	
	@PostMapping("activate")
	public Mono<User> activate(@RequestBody ActivateRequest request) {
		return accountService.activate(request);
	}
	
	@PostMapping("recover")
	@ResponseStatus(HttpStatus.CREATED)
	public Mono<Result> recover(@RequestBody RecoverRequest request) {
		return accountService.recover(request);
	}
	
	@PostMapping("reset-password")
	@ResponseStatus(HttpStatus.CREATED)
	public Mono<Result> resetPassword(@RequestBody ResetPasswordRequest request) {
		return accountService.resetPassword(request);
	}
	
	@PostMapping("change-password")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public Mono<Void> changePassword(@RequestBody ChangePasswordRequest request) {
		return accountService.changePassword(request);
	}
	
	@PostMapping("migrate-mail")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public Mono<Void> migrateMail(@RequestBody MailMigrationRequest request, @Authenticated UserEntity user) {
		return accountService.migrateMail(user, request);
	}
	
	@GetMapping("migrate-mail-confirm")
	public Mono<Result> confirmMailMigration(@RequestParam("token") String token) {
		return accountService.confirmMailMigration(token);
	}
	
	@GetMapping("me")
	public Mono<User> getMe(@Authenticated UserEntity user) {
		return Mono.just(UserService.toDto(user));
	}
	
	@PatchMapping("me")
	public Mono<User> updateMe(@RequestBody UserUpdate update, @Authenticated UserEntity user) {
		return userService.updateMe(user, update);
	}
	
	@PostMapping("me/ask-deletion")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public Mono<Void> askDeletion(@Authenticated UserEntity user) {
		return userService.askDeletion(user);
	}
	
	@GetMapping("search")
	public Flux<UserSimple> search(
		@RequestParam(name = "query", required = false) String query,
		@RequestParam(name = "includedAccountTypes", required = false) List<AccountType> included,
		@RequestParam(name = "excludedAccountTypes", required = false) List<AccountType> excluded,
		@Authenticated UserEntity user
	) {
		return RetryRest.retry(userService.search(query, included, excluded));
	}
	
}
