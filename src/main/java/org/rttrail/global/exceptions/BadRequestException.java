package org.rttrail.global.exceptions;

import org.springframework.http.HttpStatus;

public class BadRequestException extends RttrailException {

	private static final long serialVersionUID = 1L;

	public static final String INTEGRITY_ERROR = "integrity-error";
	public static final String EXPIRED_TOKEN = "expired-token";

	public BadRequestException(String message) {
		this("bad-request", message);
	}
	
	public BadRequestException(String errorCode, String message) {
		super(HttpStatus.BAD_REQUEST, errorCode, message);
	}
	
}
