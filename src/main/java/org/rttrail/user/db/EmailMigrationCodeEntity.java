package org.rttrail.user.db;

import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Table("core_user_email_migration_code")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class EmailMigrationCodeEntity {

	@Id
	private String confirmationToken;
	private UUID userId;
	private String newEmail;
	private String oldEmail;
	private long createdOn;
	
}
