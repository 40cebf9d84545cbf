package org.rttrail.poi;

public enum PoiType {

	DANGER,
	DISAPPEAR,
	DIFFICULTY,
	POV,
	OTHER;
	
}
