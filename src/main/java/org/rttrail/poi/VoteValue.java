package org.rttrail.poi;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** A vote on a point of interest, stored as its weight in the vote score. */
@RequiredArgsConstructor
@Getter
public enum VoteValue {

	UP(1),
	DOWN(-1);
	
	private final int weight;
	
}
