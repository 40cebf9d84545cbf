package org.rttrail.auth;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.rttrail.user.AccountType;

/**
 * Marks a handler parameter of type {@link org.rttrail.user.db.UserEntity} that receives the
 * account of the bearer token.
 * <p>
 * The request is accepted if at least one of {@link #scopes()} is fully contained in the token
 * scopes, and if the account type is at least {@link #accountType()}.
 * An empty {@link #scopes()} accepts any valid token.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Authenticated {

	Scopes[] scopes() default { @Scopes(ScopeType.API) };
	
	AccountType accountType() default AccountType.USER;
	
}
