package org.rttrail.user.db;

import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A pending registration. Several rows may exist for the same email. */
@Table("core_user_unconfirmed")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class UnconfirmedUserEntity {

	@Id
	private UUID id;
	private String email;
	private String passwordHash;
	private String activationToken;
	private long createdOn;
	private long expireOn;
	
}
