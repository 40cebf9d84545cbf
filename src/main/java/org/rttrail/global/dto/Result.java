package org.rttrail.global.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result {

	private boolean success;
	
	public static Result ok() {
		return new Result(true);
	}
	
}
