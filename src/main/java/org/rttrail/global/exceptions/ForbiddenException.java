package org.rttrail.global.exceptions;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends RttrailException {

	private static final long serialVersionUID = 1L;

	public ForbiddenException() {
		this("forbidden", "Access denied");
	}
	
	public ForbiddenException(String errorCode, String message) {
		super(HttpStatus.FORBIDDEN, errorCode, message);
	}
	
}
