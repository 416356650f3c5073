package com.linkanalysis.linkanalysis.domain.model;

import java.util.Map;

public record HitsIteration(int iteration, Map<String, Double> authorityScores, Map<String, Double> hubScores) {
}
