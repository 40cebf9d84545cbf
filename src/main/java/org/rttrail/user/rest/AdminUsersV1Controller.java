package org.rttrail.user.rest;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import org.rttrail.auth.Authenticated;
import org.rttrail.global.rest.RetryRest;
import org.rttrail.user.AccountType;
import org.rttrail.user.UserService;
import org.rttrail.user.db.UserEntity;
import org.rttrail.user.dto.User;
import org.rttrail.user.dto.UserCount;
import org.rttrail.user.dto.UserUpdateAdmin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/admin/users/v1")
@RequiredArgsConstructor
public class AdminUsersV1Controller {

	private final UserService service;
	
	@GetMapping()
	public Flux<User> getUsers(
		@RequestParam(name = "accountTypes", required = false) List<AccountType> accountTypes,
		@Authenticated(accountType = AccountType.ADMIN) UserEntity admin
	) {
		return RetryRest.retry(service.getUsers(accountTypes));
	}
	
	@GetMapping("/count")
	public Mono<UserCount> countUsers(@Authenticated(accountType = AccountType.ADMIN) UserEntity admin) {
		return RetryRest.retry(service.countUsers());
	}
	
	@GetMapping("/account-types")
	public Mono<List<AccountType>> getAccountTypes(@Authenticated(accountType = AccountType.ADMIN) UserEntity admin) {
		return Mono.just(Arrays.asList(AccountType.values()));
	}
	
	@GetMapping("/{id}")
	public Mono<User> getUser(@PathVariable("id") UUID id, @Authenticated(accountType = AccountType.ADMIN) UserEntity admin) {
		return RetryRest.retry(service.getUser(id));
	}
	
	@PatchMapping("/{id}")
	public Mono<User> updateUser(@PathVariable("id") UUID id, @RequestBody UserUpdateAdmin update, @Authenticated(accountType = AccountType.ADMIN) UserEntity admin) {
		return service.updateUser(id, update);
	}
	
}
