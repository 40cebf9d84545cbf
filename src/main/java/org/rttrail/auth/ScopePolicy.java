package org.rttrail.auth;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;

/**
 * Alternatives of scope sets: satisfied when every scope of at least one set is granted.
 * A policy without any set is always satisfied.
 */
@EqualsAndHashCode
public final class ScopePolicy {

	private final List<Set<String>> alternatives;
	
	private ScopePolicy(List<Set<String>> alternatives) {
		this.alternatives = alternatives;
	}
	
	public static ScopePolicy none() {
		return new ScopePolicy(List.of());
	}
	
	@SafeVarargs
	public static ScopePolicy anyOf(Set<String>... sets) {
		return new ScopePolicy(Arrays.stream(sets).map(Set::copyOf).toList());
	}
	
	public static ScopePolicy of(Scopes[] annotations) {
		return new ScopePolicy(Arrays.stream(annotations)
			.map(set -> Arrays.stream(set.value()).map(ScopeType::getValue).collect(Collectors.toCollection(LinkedHashSet::new)))
			.map(set -> (Set<String>) set)
			.toList());
	}
	
	public boolean isSatisfiedBy(Set<String> granted) {
		if (alternatives.isEmpty()) return true;
		return alternatives.stream().anyMatch(granted::containsAll);
	}
	
	@Override
	public String toString() {
		return alternatives.stream()
			.map(set -> set.stream().collect(Collectors.joining(", ", "[", "]")))
			.collect(Collectors.joining(", ", "[", "]"));
	}
	
}
