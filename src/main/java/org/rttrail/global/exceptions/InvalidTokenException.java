package org.rttrail.global.exceptions;

import lombok.Getter;

/**
 * A bearer token that could not be turned into a claim set.
 * All kinds are reported as 403, the kind only changes the error code and the log line.
 */
@Getter
public class InvalidTokenException extends ForbiddenException {

	private static final long serialVersionUID = 1L;
	
	public enum Kind {
		EXPIRED("token-expired", "Token has expired"),
		MALFORMED("token-malformed", "Could not validate credentials"),
		INVALID("token-invalid", "Could not validate credentials");
		
		private final String errorCode;
		private final String message;
		
		Kind(String errorCode, String message) {
			this.errorCode = errorCode;
			this.message = message;
		}
	}
	
	private final Kind kind;
	private final String detail;

	public InvalidTokenException(Kind kind, String detail) {
		super(kind.errorCode, kind.message);
		this.kind = kind;
		this.detail = detail;
	}
	
}
