package org.rttrail.user.dto;

import java.util.UUID;

import org.rttrail.user.AccountType;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class User {

	private UUID id;
	private String email;
	private String name;
	private AccountType accountType;
	private long createdOn;
	private boolean active;
	
}
