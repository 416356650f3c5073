package com.linkanalysis.linkanalysis.domain.model;

import java.util.Map;

public record PageRankIteration(int iteration, Map<String, Double> scores) {
}
