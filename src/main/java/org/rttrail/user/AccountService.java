package org.rttrail.user;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.rttrail.auth.AuthService;
import org.rttrail.auth.PasswordHasher;
import org.rttrail.email.EmailService;
import org.rttrail.global.RttrailUtils;
import org.rttrail.global.dto.Result;
import org.rttrail.global.exceptions.BadRequestException;
import org.rttrail.global.exceptions.ForbiddenException;
import org.rttrail.global.exceptions.NotFoundException;
import org.rttrail.global.exceptions.RttrailException;
import org.rttrail.global.exceptions.TokenNotFoundException;
import org.rttrail.global.exceptions.ValidationUtils;
import org.rttrail.global.rest.RequestId;
import org.rttrail.user.db.EmailMigrationCodeEntity;
import org.rttrail.user.db.EmailMigrationCodeRepository;
import org.rttrail.user.db.RecoverRequestEntity;
import org.rttrail.user.db.RecoverRequestRepository;
import org.rttrail.user.db.UnconfirmedUserEntity;
import org.rttrail.user.db.UnconfirmedUserRepository;
import org.rttrail.user.db.UserEntity;
import org.rttrail.user.db.UserRepository;
import org.rttrail.user.dto.ActivateRequest;
import org.rttrail.user.dto.ChangePasswordRequest;
import org.rttrail.user.dto.MailMigrationRequest;
import org.rttrail.user.dto.RecoverRequest;
import org.rttrail.user.dto.RegisterRequest;
import org.rttrail.user.dto.ResetPasswordRequest;
import org.rttrail.user.dto.User;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.reactive.TransactionalOperator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Account life cycle: registration and activation, password recovery and change, email migration.
 * <p>
 * Registration and recovery always answer with a success, whatever the email, so they cannot be
 * used to find out which accounts exist. The real outcome is only logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j(topic = RttrailUtils.LOG_SECURITY)
public class AccountService {

	public static final String ALREADY_CONFIRMED = "already-confirmed";
	public static final String INVALID_OLD_PASSWORD = "invalid-old-password";
	public static final String EMAIL_MIGRATION_FAILED = "email-migration-failed";

	private static final int ACTIVATION_TOKEN_BYTES = 16;
	private static final int RESET_TOKEN_BYTES = 32;
	private static final int CONFIRMATION_TOKEN_BYTES = 32;

	private final UserRepository userRepo;
	private final UnconfirmedUserRepository unconfirmedRepo;
	private final RecoverRequestRepository recoverRepo;
	private final EmailMigrationCodeRepository migrationCodeRepo;
	private final R2dbcEntityTemplate r2dbc;
	private final TransactionalOperator transactionalOperator;
	private final UserService userService;
	private final AuthService authService;
	private final PasswordHasher hasher;
	private final EmailService emailService;
	private final SecureRandom random;

	@Value("${rttrail.email-token.validity:24h}")
	private Duration emailTokenValidity;
	@Value("${rttrail.cleanup.retention:7d}")
	private Duration retention;
	@Value("${rttrail.mail-migration.archive:data/core/mail-migration-archives.txt}")
	private String migrationArchive;

	public Mono<Result> register(RegisterRequest request) {
		String email = validEmail(request.getEmail());
		String password = RttrailUtils.validatePassword(request.getPassword());
		return RequestId.current().flatMap(requestId ->
			userRepo.existsByEmail(email)
			.flatMap(exists -> {
				if (exists.booleanValue()) {
					log.warn("Registration attempt with the email of an existing account {} ({})", email, requestId);
					emailService.sendInBackground(email, EmailService.ACCOUNT_EXISTS, Map.of(
						"recover_link", emailService.getLinkUrl("/recover")
					));
					return Mono.just(Result.ok());
				}
				String token = RttrailUtils.generateToken(random, ACTIVATION_TOKEN_BYTES);
				long now = System.currentTimeMillis();
				return hasher.hash(password)
				.flatMap(hash -> r2dbc.insert(new UnconfirmedUserEntity(UUID.randomUUID(), email, hash, token, now, now + emailTokenValidity.toMillis())))
				.map(pending -> {
					log.info("Registration request {} for {} ({})", pending.getId(), email, requestId);
					emailService.sendInBackground(email, EmailService.ACTIVATION, Map.of(
						"token", token,
						"link", emailService.getLinkUrl("/activate?activation_token=" + token)
					));
					return Result.ok();
				});
			})
		);
	}

	@Transactional
	public Mono<User> activate(ActivateRequest request) {
		String token = request.getActivationToken();
		String name = RttrailUtils.trimToNull(request.getName());
		ValidationUtils.field("activationToken", token).notBlank();
		ValidationUtils.field("name", name).notBlank().maxLength(UserService.NAME_MAX_LENGTH);
		return RequestId.current().flatMap(requestId ->
			unconfirmedRepo.findByActivationToken(token)
			.switchIfEmpty(Mono.error(() -> new TokenNotFoundException("Invalid activation token")))
			.flatMap(pending -> {
				if (pending.getExpireOn() < System.currentTimeMillis())
					return Mono.error(new BadRequestException(BadRequestException.EXPIRED_TOKEN, "Expired activation token"));
				return userRepo.existsByEmail(pending.getEmail())
				.flatMap(exists -> {
					if (exists.booleanValue()) return Mono.error(alreadyConfirmed(pending.getEmail()));
					return userService.createUser(pending.getId(), pending.getEmail(), pending.getPasswordHash(), name, AccountType.USER);
				})
				.flatMap(user -> unconfirmedRepo.deleteAllByEmail(user.getEmail()).thenReturn(user))
				.onErrorMap(DuplicateKeyException.class, e -> alreadyConfirmed(pending.getEmail()));
			})
			.doOnNext(user -> log.info("Account {} activated for {} ({})", user.getId(), user.getEmail(), requestId))
			.map(UserService::toDto)
		);
	}

	private static BadRequestException alreadyConfirmed(String email) {
		return new BadRequestException(ALREADY_CONFIRMED, "The account with the email " + email + " is already confirmed");
	}

	public Mono<Result> recover(RecoverRequest request) {
		String email = validEmail(request.getEmail());
		return RequestId.current().flatMap(requestId ->
			userRepo.findByEmail(email)
			.map(Optional::of)
			.switchIfEmpty(Mono.just(Optional.empty()))
			.flatMap(user -> {
				if (user.isEmpty()) {
					log.info("Password recovery requested for unknown email {} ({})", email, requestId);
					emailService.sendInBackground(email, EmailService.RESET_PASSWORD_UNKNOWN, Map.of());
					return Mono.just(Result.ok());
				}
				String token = RttrailUtils.generateToken(random, RESET_TOKEN_BYTES);
				long now = System.currentTimeMillis();
				return r2dbc.insert(new RecoverRequestEntity(token, email, user.get().getId(), now, now + emailTokenValidity.toMillis()))
				.map(recover -> {
					log.info("Password recovery requested for user {} ({})", recover.getUserId(), requestId);
					emailService.sendInBackground(email, EmailService.RESET_PASSWORD, Map.of(
						"token", token,
						"link", emailService.getLinkUrl("/reset-password?reset_token=" + token)
					));
					return Result.ok();
				});
			})
		);
	}

	@Transactional
	public Mono<Result> resetPassword(ResetPasswordRequest request) {
		String token = request.getResetToken();
		ValidationUtils.field("resetToken", token).notBlank();
		String password = RttrailUtils.validatePassword(request.getNewPassword());
		return RequestId.current().flatMap(requestId ->
			recoverRepo.findById(token)
			.switchIfEmpty(Mono.error(() -> new TokenNotFoundException("Invalid reset token")))
			.flatMap(recover -> {
				if (recover.getExpireOn() < System.currentTimeMillis())
					return Mono.error(new BadRequestException(BadRequestException.EXPIRED_TOKEN, "Expired reset token"));
				return userRepo.findById(recover.getUserId())
				.switchIfEmpty(Mono.error(() -> new NotFoundException("user", recover.getUserId().toString())))
				.zipWith(hasher.hash(password))
				.flatMap(userAndHash -> {
					UserEntity user = userAndHash.getT1();
					user.setPasswordHash(userAndHash.getT2());
					return userRepo.save(user);
				})
				.flatMap(user -> recoverRepo.deleteAllByEmail(recover.getEmail()).thenReturn(user));
			})
			.map(user -> {
				log.info("Password reset for user {} ({})", user.getId(), requestId);
				return Result.ok();
			})
		);
	}

	public Mono<Void> changePassword(ChangePasswordRequest request) {
		String password = RttrailUtils.validatePassword(request.getNewPassword());
		return RequestId.current().flatMap(requestId ->
			authService.authenticate(request.getEmail(), request.getOldPassword())
			.switchIfEmpty(Mono.error(() -> {
				log.warn("Password change refused for {}: invalid old password ({})", request.getEmail(), requestId);
				return new ForbiddenException(INVALID_OLD_PASSWORD, "The old password is invalid");
			}))
			.zipWith(hasher.hash(password))
			.flatMap(userAndHash -> {
				UserEntity user = userAndHash.getT1();
				user.setPasswordHash(userAndHash.getT2());
				return userRepo.save(user);
			})
			.doOnNext(user -> log.info("Password changed for user {} ({})", user.getId(), requestId))
			.then()
		);
	}

	public Mono<Void> migrateMail(UserEntity me, MailMigrationRequest request) {
		String newEmail = validEmail(request.getNewEmail());
		return RequestId.current().flatMap(requestId ->
			userRepo.existsByEmail(newEmail)
			.flatMap(exists -> {
				if (exists.booleanValue()) {
					log.info("User {} asked to migrate to the already used email {} ({})", me.getId(), newEmail, requestId);
					emailService.sendInBackground(newEmail, EmailService.MIGRATE_MAIL_ALREADY_USED, Map.of());
					return Mono.<Void>empty();
				}
				String token = RttrailUtils.generateToken(random, CONFIRMATION_TOKEN_BYTES);
				return r2dbc.insert(new EmailMigrationCodeEntity(token, me.getId(), newEmail, me.getEmail(), System.currentTimeMillis()))
				.doOnNext(code -> {
					log.info("User {} asked to migrate email {} to {} ({})", me.getId(), code.getOldEmail(), newEmail, requestId);
					emailService.sendInBackground(newEmail, EmailService.MIGRATE_MAIL, Map.of(
						"token", token,
						"link", emailService.getLinkUrl("/api/user/v1/migrate-mail-confirm?token=" + token)
					));
				})
				.then();
			})
		);
	}

	public Mono<Result> confirmMailMigration(String token) {
		ValidationUtils.field("token", token).notBlank();
		return RequestId.current().flatMap(requestId ->
			migrationCodeRepo.findById(token)
			.switchIfEmpty(Mono.error(() -> new TokenNotFoundException("Invalid confirmation token")))
			.flatMap(code -> applyMailMigration(code)
				.as(transactionalOperator::transactional)
				.onErrorMap(DataIntegrityViolationException.class, e -> new BadRequestException(BadRequestException.INTEGRITY_ERROR, "Email migration failed due to database integrity error"))
				.onErrorMap(e -> !(e instanceof RttrailException), e -> new BadRequestException(EMAIL_MIGRATION_FAILED, e.getMessage()))
				.then(archiveMailMigration(code))
				.doOnSuccess(v -> log.info("User {} migrated email {} to {} ({})", code.getUserId(), code.getOldEmail(), code.getNewEmail(), requestId))
			)
			.thenReturn(Result.ok())
		);
	}

	private Mono<UserEntity> applyMailMigration(EmailMigrationCodeEntity code) {
		return userRepo.existsByEmail(code.getNewEmail())
		.flatMap(exists -> {
			if (exists.booleanValue())
				return Mono.error(new BadRequestException(BadRequestException.INTEGRITY_ERROR, "The email " + code.getNewEmail() + " is already used"));
			return userRepo.findById(code.getUserId())
				.switchIfEmpty(Mono.error(() -> new NotFoundException("user", code.getUserId().toString())));
		})
		.flatMap(user -> {
			user.setEmail(code.getNewEmail());
			return userRepo.save(user);
		})
		.flatMap(user -> migrationCodeRepo.delete(code).thenReturn(user));
	}

	private Mono<Void> archiveMailMigration(EmailMigrationCodeEntity code) {
		String line = code.getUserId() + "," + code.getOldEmail() + "," + code.getNewEmail() + "\n";
		return Mono.fromCallable(() -> {
			Path path = Path.of(migrationArchive);
			if (path.getParent() != null) Files.createDirectories(path.getParent());
			return Files.writeString(path, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
		})
		.onErrorMap(IOException.class, e -> new IllegalStateException("Unable to write email migration archive " + migrationArchive, e))
		.subscribeOn(Schedulers.boundedElastic()).publishOn(Schedulers.parallel())
		.then();
	}

	@Scheduled(fixedRate = 60, timeUnit = TimeUnit.MINUTES, initialDelay = 5)
	public void purgeExpired() {
		long limit = System.currentTimeMillis() - retention.toMillis();
		log.info("Purging registrations and recover requests expired before {}", Instant.ofEpochMilli(limit));
		purgeExpiredBefore(limit)
		.checkpoint("Purge expired registrations and recover requests")
		.subscribe();
	}

	public Mono<Void> purgeExpiredBefore(long limit) {
		return unconfirmedRepo.deleteAllByExpireOnLessThan(limit)
		.doOnNext(nb -> log.info("Unconfirmed users removed: {}", nb))
		.then(recoverRepo.deleteAllByExpireOnLessThan(limit))
		.doOnNext(nb -> log.info("Recover requests removed: {}", nb))
		.then();
	}

	private static String validEmail(String input) {
		String email = RttrailUtils.normalizeEmail(input);
		ValidationUtils.field("email", email).notBlank().maxLength(UserService.EMAIL_MAX_LENGTH).email();
		return email;
	}

}
