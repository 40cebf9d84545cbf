package org.rttrail.global.rest;

import org.rttrail.auth.dto.TokenData;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import lombok.Getter;

@Getter
public class TokenAuthentication extends AbstractAuthenticationToken {

	private static final long serialVersionUID = 1L;
	
	private final transient TokenData tokenData;
	private final String token;

	public TokenAuthentication(TokenData tokenData, String token) {
		super(tokenData.scopeSet().stream().map(scope -> new SimpleGrantedAuthority("SCOPE_" + scope)).toList());
		this.tokenData = tokenData;
		this.token = token;
		setAuthenticated(true);
	}

	@Override
	public Object getCredentials() {
		return token;
	}

	@Override
	public Object getPrincipal() {
		return tokenData.getSub();
	}
	
}
