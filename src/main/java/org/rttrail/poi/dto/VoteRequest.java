package org.rttrail.poi.dto;

import org.rttrail.poi.VoteValue;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoteRequest {

	private VoteValue value;
	
}
