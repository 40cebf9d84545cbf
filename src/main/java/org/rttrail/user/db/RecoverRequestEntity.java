package org.rttrail.user.db;

import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Table("core_user_recover_request")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class RecoverRequestEntity {

	@Id
	private String resetToken;
	private String email;
	private UUID userId;
	private long createdOn;
	private long expireOn;
	
}
