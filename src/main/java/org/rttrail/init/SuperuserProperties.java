package org.rttrail.init;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** First administrator, created at startup when the email is set and unknown. */
@ConfigurationProperties(prefix = "rttrail.init.superuser")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SuperuserProperties {

	private String email;
	private String password;
	private String name = "Administrator";
	
}
