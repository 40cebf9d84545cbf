package org.rttrail.auth;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Scopes minted by this server. */
@Getter
@RequiredArgsConstructor
public enum ScopeType {

	/** General API access, granted by the password login. */
	API("API"),
	/** Reserved to the auth endpoints. */
	AUTH("auth");
	
	private final String value;
	
}
