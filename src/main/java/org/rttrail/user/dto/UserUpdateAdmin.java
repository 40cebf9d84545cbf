package org.rttrail.user.dto;

import org.rttrail.user.AccountType;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Fields left null are not modified. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdateAdmin {

	private String email;
	private AccountType accountType;
	private String name;
	
}
