package org.rttrail.auth;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** One set of scopes that must all be present in the token. */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({})
public @interface Scopes {

	ScopeType[] value();
	
}
