package org.rttrail.global.exceptions;

import org.rttrail.global.rest.ApiError;
import org.springframework.http.HttpStatus;

import lombok.Getter;

@Getter
public abstract class RttrailException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	
	private final HttpStatus status;
	private final String errorCode;
	
	protected RttrailException(HttpStatus status, String errorCode, String message) {
		super(message);
		this.status = status;
		this.errorCode = errorCode;
	}
	
	public ApiError toApiError() {
		return new ApiError(status.value(), errorCode, getMessage());
	}
	
}
