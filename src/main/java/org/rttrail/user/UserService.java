package org.rttrail.user;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import org.rttrail.auth.PasswordHasher;
import org.rttrail.global.RttrailUtils;
import org.rttrail.global.exceptions.BadRequestException;
import org.rttrail.global.exceptions.NotFoundException;
import org.rttrail.global.exceptions.ValidationUtils;
import org.rttrail.global.rest.RequestId;
import org.rttrail.user.db.UserEntity;
import org.rttrail.user.db.UserRepository;
import org.rttrail.user.dto.User;
import org.rttrail.user.dto.UserCount;
import org.rttrail.user.dto.UserSimple;
import org.rttrail.user.dto.UserUpdate;
import org.rttrail.user.dto.UserUpdateAdmin;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
@Slf4j(topic = RttrailUtils.LOG_SECURITY)
public class UserService {

	public static final int NAME_MAX_LENGTH = 100;
	public static final int EMAIL_MAX_LENGTH = 250;
	public static final int SEARCH_MAX_RESULTS = 10;

	private final UserRepository userRepo;
	private final R2dbcEntityTemplate r2dbc;
	private final PasswordHasher hasher;

	public static User toDto(UserEntity entity) {
		return new User(entity.getId(), entity.getEmail(), entity.getName(), entity.getAccountType(), entity.getCreatedOn(), entity.isActive());
	}

	public static UserSimple toSimpleDto(UserEntity entity) {
		return new UserSimple(entity.getId(), entity.getName());
	}

	public Mono<UserEntity> createUser(UUID id, String email, String passwordHash, String name, AccountType accountType) {
		UserEntity entity = new UserEntity(id, email, passwordHash, accountType, name, System.currentTimeMillis(), true);
		return r2dbc.insert(entity);
	}

	/** Creates the first administrator if no account uses this email yet. */
	public Mono<Void> createSuperuser(String emailInput, String password, String name) {
		String email = RttrailUtils.normalizeEmail(emailInput);
		return userRepo.existsByEmail(email)
		.flatMap(exists -> {
			if (exists.booleanValue()) return Mono.<Void>empty();
			log.info("Creating first administrator account {}", email);
			return hasher.hash(RttrailUtils.validatePassword(password))
				.flatMap(hash -> createUser(UUID.randomUUID(), email, hash, name, AccountType.ADMIN))
				.then();
		})
		.onErrorComplete(DuplicateKeyException.class);
	}

	public Mono<User> getUser(UUID id) {
		return userRepo.findById(id)
			.switchIfEmpty(Mono.error(() -> new NotFoundException("user", id.toString())))
			.map(UserService::toDto);
	}

	public Flux<User> getUsers(Collection<AccountType> accountTypes) {
		Criteria criteria = accountTypes == null || accountTypes.isEmpty()
			? Criteria.empty()
			: Criteria.where("accountType").in(names(accountTypes));
		return r2dbc.select(UserEntity.class)
			.matching(Query.query(criteria).sort(Sort.by("createdOn")))
			.all()
			.map(UserService::toDto);
	}

	public Mono<UserCount> countUsers() {
		return userRepo.count().map(UserCount::new);
	}

	public Flux<UserSimple> search(String query, Collection<AccountType> included, Collection<AccountType> excluded) {
		String q = RttrailUtils.trimToNull(query);
		if (q == null) return Flux.empty();
		String pattern = "%" + escapeLike(q) + "%";
		Criteria criteria = Criteria.empty().and(
			Criteria.where("name").like(pattern).ignoreCase(true)
			.or(Criteria.where("email").like(pattern).ignoreCase(true))
		);
		if (included != null && !included.isEmpty()) criteria = criteria.and(Criteria.where("accountType").in(names(included)));
		if (excluded != null && !excluded.isEmpty()) criteria = criteria.and(Criteria.where("accountType").notIn(names(excluded)));
		String lower = q.toLowerCase(Locale.ROOT);
		return r2dbc.select(UserEntity.class).matching(Query.query(criteria)).all()
			.sort(Comparator.<UserEntity, Boolean>comparing(u -> u.getName() == null || !u.getName().toLowerCase(Locale.ROOT).startsWith(lower))
				.thenComparing(UserEntity::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
			.take(SEARCH_MAX_RESULTS)
			.map(UserService::toSimpleDto);
	}

	public Mono<User> updateMe(UserEntity me, UserUpdate update) {
		String name = RttrailUtils.trimToNull(update.getName());
		ValidationUtils.field("name", name).nullable().maxLength(NAME_MAX_LENGTH);
		if (name == null) return Mono.just(toDto(me));
		me.setName(name);
		return userRepo.save(me).map(UserService::toDto);
	}

	public Mono<User> updateUser(UUID id, UserUpdateAdmin update) {
		String email = RttrailUtils.normalizeEmail(update.getEmail());
		String name = RttrailUtils.trimToNull(update.getName());
		ValidationUtils.field("email", email).nullable().notBlank().maxLength(EMAIL_MAX_LENGTH);
		ValidationUtils.field("name", name).nullable().maxLength(NAME_MAX_LENGTH);
		return RequestId.current().flatMap(requestId ->
			userRepo.findById(id)
			.switchIfEmpty(Mono.error(() -> new NotFoundException("user", id.toString())))
			.flatMap(user -> {
				if (email != null) user.setEmail(email);
				if (name != null) user.setName(name);
				if (update.getAccountType() != null) user.setAccountType(update.getAccountType());
				log.info("Administrator update of user {}: email {}, account type {} ({})", id, user.getEmail(), user.getAccountType(), requestId);
				return userRepo.save(user);
			})
			.onErrorMap(DataIntegrityViolationException.class, e -> new BadRequestException(BadRequestException.INTEGRITY_ERROR, "Email already used by another account"))
			.map(UserService::toDto)
		);
	}

	public Mono<Void> askDeletion(UserEntity me) {
		return RequestId.current()
			.doOnNext(requestId -> log.warn("User {} ({}) asked for the deletion of the account ({})", me.getId(), me.getEmail(), requestId))
			.then();
	}

	private static List<String> names(Collection<AccountType> types) {
		return types.stream().map(AccountType::name).toList();
	}

	private static String escapeLike(String s) {
		return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
	}

}
