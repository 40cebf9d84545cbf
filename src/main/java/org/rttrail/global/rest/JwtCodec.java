package org.rttrail.global.rest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.rttrail.auth.dto.TokenData;
import org.rttrail.global.exceptions.InvalidTokenException;
import org.rttrail.global.exceptions.InvalidTokenException.Kind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;

/**
 * Signs and verifies access tokens with HS256.
 * <p>
 * A token is accepted only if its signature matches the configured secret, its {@code exp} is not
 * in the past according to the injected clock, and it carries a subject.
 */
@Component
public class JwtCodec {

	private static final String CLAIM_SCOPES = "scopes";
	private static final String CLAIM_CID = "cid";
	private static final String CLAIM_NONCE = "nonce";

	private final Algorithm algo;
	private final JWTVerifier verifier;
	private final Duration tokenValidity;
	private final String issuer;
	private final Clock clock;
	
	public JwtCodec(
		@Value("${rttrail.jwt.secret:}") String secret,
		@Value("${rttrail.jwt.validity:30m}") Duration tokenValidity,
		@Value("${rttrail.jwt.issuer:}") String issuer,
		Clock clock
	) {
		if (StringUtils.isBlank(secret)) throw new IllegalStateException("rttrail.jwt.secret must be configured");
		this.algo = Algorithm.HMAC256(secret);
		this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algo)).build(clock);
		this.tokenValidity = tokenValidity;
		this.issuer = StringUtils.trimToNull(issuer);
		this.clock = clock;
	}
	
	public Duration getTokenValidity() {
		return tokenValidity;
	}
	
	public String issue(TokenData data) {
		Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
		JWTCreator.Builder builder = JWT.create()
			.withSubject(data.getSub())
			.withClaim(CLAIM_SCOPES, data.getScopes() != null ? data.getScopes() : "")
			.withIssuedAt(now)
			.withExpiresAt(now.plus(tokenValidity));
		String iss = data.getIss() != null ? data.getIss() : issuer;
		if (iss != null) builder.withIssuer(iss);
		if (data.getAud() != null) builder.withAudience(data.getAud());
		if (data.getCid() != null) builder.withClaim(CLAIM_CID, data.getCid());
		if (data.getNonce() != null) builder.withClaim(CLAIM_NONCE, data.getNonce());
		return builder.sign(algo);
	}
	
	public TokenData decode(String token) {
		DecodedJWT decoded;
		try {
			decoded = verifier.verify(token);
		} catch (TokenExpiredException e) {
			throw new InvalidTokenException(Kind.EXPIRED, e.getMessage());
		} catch (JWTVerificationException e) {
			throw new InvalidTokenException(Kind.MALFORMED, e.getClass().getSimpleName() + ": " + e.getMessage());
		}
		if (StringUtils.isBlank(decoded.getSubject()))
			throw new InvalidTokenException(Kind.INVALID, "missing sub claim");
		Claim scopes = decoded.getClaim(CLAIM_SCOPES);
		if (!scopes.isMissing() && !scopes.isNull() && scopes.asString() == null)
			throw new InvalidTokenException(Kind.INVALID, "scopes claim must be a string");
		List<String> audience = decoded.getAudience();
		Instant iat = decoded.getIssuedAtAsInstant();
		return new TokenData(
			decoded.getSubject(),
			decoded.getIssuer(),
			audience == null || audience.isEmpty() ? null : audience.get(0),
			decoded.getClaim(CLAIM_CID).asString(),
			iat != null ? iat.getEpochSecond() : null,
			decoded.getClaim(CLAIM_NONCE).asString(),
			scopes.isMissing() || scopes.isNull() ? "" : scopes.asString()
		);
	}
	
}
