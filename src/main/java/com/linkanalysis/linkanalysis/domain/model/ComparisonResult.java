package com.linkanalysis.linkanalysis.domain.model;

import java.util.List;

public record ComparisonResult(
		PageRankResult pagerank,
		HitsResult hits,
		List<String> overlapAuthorities,
		List<String> overlapHubs,
		List<String> insights) {
}
