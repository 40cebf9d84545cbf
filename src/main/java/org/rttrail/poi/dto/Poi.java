package org.rttrail.poi.dto;

import java.util.UUID;

import org.rttrail.poi.PoiType;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Poi {

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
