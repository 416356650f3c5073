package com.linkanalysis.linkanalysis.domain.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one HITS run. Both score maps are L2-normalized unless no edge touches the graph.
 */
public record HitsResult(
		Map<String, Double> authorityScores,
		Map<String, Double> hubScores,
		List<RankedNode> topAuthorities,
		List<RankedNode> topHubs,
		int iterations,
		@JsonInclude(JsonInclude.Include.NON_NULL) List<HitsIteration> history) {

	public HitsResult {
		history = history != null ? List.copyOf(history) : null;
	}

	public static HitsResult empty(boolean includeHistory) {
		return new HitsResult(Map.of(), Map.of(), List.of(), List.of(), 0, includeHistory ? List.of() : null);
	}
}
