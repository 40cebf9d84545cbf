package org.rttrail.flappybird.dto;

import org.rttrail.user.dto.UserSimple;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlappyBirdScore {

	private UserSimple user;
	private int value;
	private long creationTime;
	
}
