package com.linkanalysis.linkanalysis.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers shared by the ranking engines to turn score vectors into label keyed maps.
 */
public final class ScoreVectors {

	private ScoreVectors() {
	}

	/**
	 * Snapshot of {@code scores} keyed by label, iterating in node input order.
	 */
	public static Map<String, Double> toLabelMap(GraphIndex index, double[] scores) {
		Map<String, Double> mapped = new LinkedHashMap<>(index.size() * 2);
		for (int i = 0; i < index.size(); i++) {
			mapped.put(index.label(i), scores[i]);
		}
		return Collections.unmodifiableMap(mapped);
	}

	public static double l1Distance(double[] left, double[] right) {
		double sum = 0.0;
		for (int i = 0; i < left.length; i++) {
			sum += Math.abs(left[i] - right[i]);
		}
		return sum;
	}

	public static double l2Norm(double[] vector) {
		double sum = 0.0;
		for (double value : vector) {
			sum += value * value;
		}
		return Math.sqrt(sum);
	}

	public static double sum(double[] vector) {
		double total = 0.0;
		for (double value : vector) {
			total += value;
		}
		return total;
	}
}
