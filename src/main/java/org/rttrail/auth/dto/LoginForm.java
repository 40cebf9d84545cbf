package org.rttrail.auth.dto;

import lombok.Data;

/** OAuth2 password grant fields, posted as form data. */
@Data
public class LoginForm {

	private String username;
	private String password;
	
}
