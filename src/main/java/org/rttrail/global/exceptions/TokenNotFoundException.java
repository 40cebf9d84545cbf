package org.rttrail.global.exceptions;

import org.springframework.http.HttpStatus;

/** An activation, reset or confirmation token matching no pending row. */
public class TokenNotFoundException extends RttrailException {

	private static final long serialVersionUID = 1L;

	public TokenNotFoundException(String message) {
		super(HttpStatus.NOT_FOUND, "invalid-token", message);
	}
	
}
