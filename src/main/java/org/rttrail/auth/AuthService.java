package org.rttrail.auth;

import org.rttrail.auth.dto.AccessToken;
import org.rttrail.auth.dto.TokenData;
import org.rttrail.global.RttrailUtils;
import org.rttrail.global.exceptions.BadRequestException;
import org.rttrail.global.exceptions.UnauthorizedException;
import org.rttrail.global.rest.JwtCodec;
import org.rttrail.global.rest.RequestId;
import org.rttrail.user.db.UserEntity;
import org.rttrail.user.db.UserRepository;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
@Slf4j(topic = RttrailUtils.LOG_SECURITY)
public class AuthService {

	public static final String INVALID_CREDENTIALS = "invalid-credentials";
	public static final String INACTIVE_USER = "inactive-user";

	private final UserRepository userRepo;
	private final PasswordHasher hasher;
	private final JwtCodec codec;
	
	/**
	 * Returns the account matching the credentials, whether it is active or not.
	 * Empty if the email is unknown or the password does not match.
	 */
	public Mono<UserEntity> authenticate(String email, String password) {
		String normalized = RttrailUtils.normalizeEmail(email);
		if (normalized == null || password == null) return Mono.empty();
		return userRepo.findByEmail(normalized)
			.filterWhen(user -> hasher.matches(password, user.getPasswordHash()));
	}
	
	public Mono<AccessToken> login(String username, String password, ScopeType scope) {
		return RequestId.current().flatMap(requestId ->
			authenticate(username, password)
			.switchIfEmpty(Mono.error(() -> {
				log.warn("Failed login for {} ({})", username, requestId);
				return new UnauthorizedException(INVALID_CREDENTIALS, "Incorrect login or password");
			}))
			.flatMap(user -> {
				if (!user.isActive()) {
					log.warn("Login refused for inactive user {} ({})", user.getId(), requestId);
					return Mono.error(new BadRequestException(INACTIVE_USER, "Inactive user"));
				}
				log.info("User {} logged in with scope {} ({})", user.getId(), scope.getValue(), requestId);
				return Mono.just(issueToken(user, scope));
			})
		);
	}
	
	public AccessToken issueToken(UserEntity user, ScopeType scope) {
		String token = codec.issue(new TokenData(user.getId().toString(), scope.getValue()));
		return new AccessToken(token, AccessToken.TOKEN_TYPE);
	}
	
}
