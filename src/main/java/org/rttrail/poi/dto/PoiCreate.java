package org.rttrail.poi.dto;

import org.rttrail.poi.PoiType;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PoiCreate {

	private String title;
	private PoiType type;
	private String description;
	private Double latitude;
	private Double longitude;
	private String imageUrl;
	
}
