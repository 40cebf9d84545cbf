package org.rttrail.flappybird.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlappyBirdScoreCreate {

	private Integer value;
	
}
