package org.rttrail.flappybird.db;

import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Table("flappybird_score")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class FlappyBirdScoreEntity {

	@Id
	private UUID id;
	private UUID userId;
	private int value;
	private long creationTime;
	
}
