package org.rttrail.global;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;

import org.junit.jupiter.api.Test;
import org.rttrail.global.exceptions.BadRequestException;
import org.rttrail.global.exceptions.ValidationUtils;

class TestValidation {

	@Test
	void testNormalizeEmail() {
		assertThat(RttrailUtils.normalizeEmail("  John.Doe@Example.COM ")).isEqualTo("john.doe@example.com");
		assertThat(RttrailUtils.normalizeEmail(null)).isNull();
	}
	
	@Test
	void testPasswordMinimumSize() {
		assertThat(RttrailUtils.validatePassword("12345678")).isEqualTo("12345678");
		assertThat(RttrailUtils.validatePassword(" 12345678 ")).isEqualTo("12345678");
		assertThatThrownBy(() -> RttrailUtils.validatePassword("1234567"))
			.isInstanceOfSatisfying(BadRequestException.class, e -> {
				assertThat(e.getErrorCode()).isEqualTo("invalid-password");
				assertThat(e.getMessage()).isEqualTo("The password must be at least 8 characters long");
			});
		assertThatThrownBy(() -> RttrailUtils.validatePassword(null))
			.isInstanceOfSatisfying(BadRequestException.class, e -> assertThat(e.getErrorCode()).isEqualTo("missing-password"));
	}
	
	@Test
	void testFieldString() {
		ValidationUtils.field("name", (String) null).nullable().notBlank().maxLength(3);
		ValidationUtils.field("name", "abc").notBlank().maxLength(3);
		assertThatThrownBy(() -> ValidationUtils.field("name", "abcd").maxLength(3))
			.isInstanceOfSatisfying(BadRequestException.class, e -> assertThat(e.getErrorCode()).isEqualTo("invalid-name-too-long"));
		assertThatThrownBy(() -> ValidationUtils.field("name", "  ").notBlank())
			.isInstanceOfSatisfying(BadRequestException.class, e -> assertThat(e.getErrorCode()).isEqualTo("missing-name"));
		assertThatThrownBy(() -> ValidationUtils.field("email", "not-an-email").email())
			.isInstanceOfSatisfying(BadRequestException.class, e -> assertThat(e.getErrorCode()).isEqualTo("invalid-email"));
		ValidationUtils.field("email", "a@b.fr").email();
	}
	
	@Test
	void testFieldNumber() {
		ValidationUtils.field("latitude", 45.0).notNull().between(-90, 90);
		ValidationUtils.field("latitude", (Double) null).nullable().between(-90, 90);
		assertThatThrownBy(() -> ValidationUtils.field("latitude", 90.5).between(-90, 90))
			.isInstanceOfSatisfying(BadRequestException.class, e -> assertThat(e.getErrorCode()).isEqualTo("invalid-latitude"));
		assertThatThrownBy(() -> ValidationUtils.field("latitude", (Double) null).notNull())
			.isInstanceOfSatisfying(BadRequestException.class, e -> assertThat(e.getErrorCode()).isEqualTo("missing-latitude"));
	}
	
	@Test
	void testGeneratedTokensAreUrlSafeAndDistinct() {
		var random = new SecureRandom();
		var t1 = RttrailUtils.generateToken(random, 32);
		var t2 = RttrailUtils.generateToken(random, 32);
		assertThat(t1).isNotEqualTo(t2).matches("[A-Za-z0-9_-]{43}");
	}
	
}
