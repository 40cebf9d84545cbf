package org.rttrail.user.db;

import java.util.UUID;

import org.rttrail.user.AccountType;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Table("core_user")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class UserEntity {

	@Id
	private UUID id;
	private String email;
	private String passwordHash;
	private AccountType accountType;
	private String name;
	private long createdOn;
	private boolean isActive;
	
}
