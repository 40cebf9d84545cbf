package org.rttrail.poi.db;

import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** At most one vote per user and point of interest. */
@Table("poi_vote")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class VoteEntity {

	@Id
	private UUID id;
	private UUID poiId;
	private UUID userId;
	private int value;
	private long creationTime;
	
}
