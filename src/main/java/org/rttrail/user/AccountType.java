package org.rttrail.user;

/** Privilege tiers, declared in ascending order. */
public enum AccountType {

	USER,
	MODERATOR,
	ADMIN;
	
	public boolean isAtLeast(AccountType required) {
		return compareTo(required) >= 0;
	}
	
}
