package org.rttrail.auth;

import org.rttrail.auth.dto.TokenData;
import org.rttrail.global.RttrailUtils;
import org.rttrail.global.exceptions.ForbiddenException;
import org.rttrail.global.exceptions.NotFoundException;
import org.rttrail.user.AccountType;
import org.rttrail.user.db.UserEntity;
import org.rttrail.user.db.UserRepository;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Authorization of a decoded token: scope policy first, then the account lookup, then the
 * account type.
 */
@Component
@RequiredArgsConstructor
public class AccessGate {

	public static final String SCOPE_DENIED = "scope-denied";
	public static final String INSUFFICIENT_PRIVILEGE = "insufficient-privilege";

	private final UserRepository userRepo;
	
	public Mono<UserEntity> authorize(TokenData token, ScopePolicy policy, AccountType minimum) {
		return Mono.defer(() -> {
			checkScopes(token, policy);
			return RttrailUtils.ifUuid(token.getSub())
				.map(userRepo::findById)
				.orElse(Mono.empty())
				.switchIfEmpty(Mono.error(() -> new NotFoundException("user", token.getSub())))
				.doOnNext(user -> checkAccountType(user, minimum));
		});
	}
	
	public static void checkScopes(TokenData token, ScopePolicy policy) {
		if (!policy.isSatisfiedBy(token.scopeSet()))
			throw new ForbiddenException(SCOPE_DENIED, "Unauthorized, token does not contain at least one of the following scope sets " + policy);
	}
	
	public static void checkAccountType(UserEntity user, AccountType minimum) {
		if (minimum == null || user.getAccountType().isAtLeast(minimum)) return;
		throw new ForbiddenException(INSUFFICIENT_PRIVILEGE, "Unauthorized, user does not have " + minimum.name().toLowerCase() + " permissions");
	}
	
}
