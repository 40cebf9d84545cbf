package org.rttrail.auth.dto;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Claim set carried by an access token. {@code exp} is added when the token is signed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenData {

	private String sub;
	private String iss;
	private String aud;
	private String cid;
	private Long iat;
	private String nonce;
	private String scopes = "";
	
	public TokenData(String sub, String scopes) {
		this.sub = sub;
		this.scopes = scopes;
	}
	
	public Set<String> scopeSet() {
		if (scopes == null || scopes.isBlank()) return Set.of();
		return Arrays.stream(scopes.split(" ")).filter(s -> !s.isEmpty()).collect(Collectors.toSet());
	}
	
}
