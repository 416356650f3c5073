package com.linkanalysis.linkanalysis.domain.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one PageRank run.
 *
 * @param nodeScores final scores by label, summing to 1 for a non-empty graph.
 * @param topNodes highest scores first, ties in node input order.
 * @param iterations iterations actually performed.
 * @param convergenceThreshold L1 threshold used.
 * @param dampingFactor damping factor used.
 * @param history per-iteration raw vectors, or {@code null} when not requested.
 */
public record PageRankResult(
		Map<String, Double> nodeScores,
		List<RankedNode> topNodes,
		int iterations,
		double convergenceThreshold,
		double dampingFactor,
		@JsonInclude(JsonInclude.Include.NON_NULL) List<PageRankIteration> history) {

	public PageRankResult {
		history = history != null ? List.copyOf(history) : null;
	}

	public static PageRankResult empty(AlgorithmSettings settings, boolean includeHistory) {
		return new PageRankResult(Map.of(), List.of(), 0, settings.convergenceThreshold(), settings.dampingFactor(),
				includeHistory ? List.of() : null);
	}
}
