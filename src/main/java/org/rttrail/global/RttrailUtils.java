package org.rttrail.global;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;
import org.rttrail.global.exceptions.ValidationUtils;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RttrailUtils {
	
	public static final int MIN_PASSWORD_SIZE = 8;
	
	public static final String LOG_ACCESS = "rttrail.access";
	public static final String LOG_SECURITY = "rttrail.security";
	public static final String LOG_ERROR = "rttrail.error";
	
	/** Lower-cased and trimmed, the form under which emails are stored and looked up. */
	public static String normalizeEmail(String email) {
		if (email == null) return null;
		return email.trim().toLowerCase(Locale.ROOT);
	}
	
	/** Checks the minimum size then strips surrounding spaces. */
	public static String validatePassword(String password) {
		ValidationUtils.field("password", password).notNull().minLength(MIN_PASSWORD_SIZE);
		return password.strip();
	}
	
	public static String trimToNull(String s) {
		return StringUtils.trimToNull(s);
	}
	
	/** URL-safe random token of the given number of random bytes. */
	public static String generateToken(SecureRandom random, int nbBytes) {
		byte[] bytes = new byte[nbBytes];
		random.nextBytes(bytes);
		return Base64.encodeBase64URLSafeString(bytes);
	}
	
	public static Mono<String> readResource(String filename) {
		return Mono.fromCallable(() -> {
			try (InputStream in = RttrailUtils.class.getClassLoader().getResourceAsStream(filename)) {
				if (in == null) throw new IllegalStateException("Missing resource: " + filename);
				return new String(in.readAllBytes(), StandardCharsets.UTF_8);
			}
		}).subscribeOn(Schedulers.boundedElastic()).publishOn(Schedulers.parallel());
	}
	
	public static Optional<UUID> ifUuid(String s) {
		if (s == null) return Optional.empty();
		try {
			return Optional.of(UUID.fromString(s));
		} catch (IllegalArgumentException e) {
			return Optional.empty();
		}
	}
	
}
