package org.rttrail.poi.db;

import java.util.UUID;

import org.rttrail.poi.PoiType;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Table("poi")
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PoiEntity {

	@Id
	private UUID id;
	private UUID userId;
	private long creationTime;
	private String title;
	private PoiType type;
	private String description;
	private double latitude;
	private double longitude;
	private String imageUrl;
	private int voteScore;
	
}
