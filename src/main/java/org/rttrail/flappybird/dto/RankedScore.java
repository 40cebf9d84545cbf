package org.rttrail.flappybird.dto;

import org.rttrail.user.dto.UserSimple;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Best score of a user with its 1-based position in the leaderboard. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RankedScore {

	private int position;
	private UserSimple user;
	private int value;
	private long creationTime;
	
}
