package org.rttrail.global.exceptions;

import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationUtils {

	public static final String INVALID_PREFIX = "invalid-";
	public static final String MISSING_PREFIX = "missing-";
	
	private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

	public static FieldObject field(String name, Object value) {
		return new FieldObject(name, value, false);
	}

	public static FieldString field(String name, String value) {
		return new FieldString(name, value, false);
	}

	public static FieldNumber field(String name, Double value) {
		return new FieldNumber(name, value, false);
	}

	@RequiredArgsConstructor
	@SuppressWarnings("unchecked")
	public abstract static class Field<T, S extends Field<T, S>> {

		protected final String name;
		protected final T value;
		/** set by nullable() when the value is null: following checks pass */
		protected final boolean skipped;

		public S notNull() {
			if (!skipped && value == null) throw new BadRequestException(MISSING_PREFIX + name, name + " cannot be null");
			return (S) this;
		}

		public abstract S nullable();

	}

	public static class FieldObject extends Field<Object, FieldObject> {

		private FieldObject(String name, Object value, boolean skipped) {
			super(name, value, skipped);
		}

		@Override
		public FieldObject nullable() {
			return new FieldObject(name, value, value == null);
		}

	}

	public static class FieldString extends Field<String, FieldString> {

		private FieldString(String name, String value, boolean skipped) {
			super(name, value, skipped);
		}

		@Override
		public FieldString nullable() {
			return new FieldString(name, value, value == null);
		}

		public FieldString notBlank() {
			notNull();
			if (!skipped && value.isBlank()) throw new BadRequestException(MISSING_PREFIX + name, name + " cannot be empty");
			return this;
		}

		public FieldString email() {
			if (!skipped && !EMAIL.matcher(value).matches()) throw new BadRequestException(INVALID_PREFIX + name, "Invalid " + name + ": " + value);
			return this;
		}

		public FieldString minLength(int min) {
			if (!skipped && value.length() < min) throw new BadRequestException(INVALID_PREFIX + name, "The " + name + " must be at least " + min + " characters long");
			return this;
		}

		public FieldString maxLength(int max) {
			if (!skipped && value.length() > max) throw new BadRequestException(INVALID_PREFIX + name + "-too-long", name + " exceeds the maximum length of " + max + " characters");
			return this;
		}

	}

	public static class FieldNumber extends Field<Double, FieldNumber> {

		private FieldNumber(String name, Double value, boolean skipped) {
			super(name, value, skipped);
		}

		@Override
		public FieldNumber nullable() {
			return new FieldNumber(name, value, value == null);
		}

		public FieldNumber between(double min, double max) {
			if (!skipped && (value < min || value > max)) throw new BadRequestException(INVALID_PREFIX + name, name + " must be between " + min + " and " + max);
			return this;
		}

	}
}
