package org.rttrail.global.exceptions;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends RttrailException {

	private static final long serialVersionUID = 1L;

	public UnauthorizedException() {
		this("not-authenticated", "Not authenticated");
	}
	
	public UnauthorizedException(String errorCode, String message) {
		super(HttpStatus.UNAUTHORIZED, errorCode, message);
	}
	
}
