package org.rttrail.poi.dto;

import org.rttrail.poi.PoiType;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Null fields are left unchanged. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PoiUpdate {

	private String title;
	private PoiType type;
	private String description;
	private String imageUrl;
	
}
