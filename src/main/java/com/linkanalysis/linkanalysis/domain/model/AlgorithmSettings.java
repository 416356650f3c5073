package com.linkanalysis.linkanalysis.domain.model;

import org.springframework.util.Assert;

/**
 * Per-request tuning of the ranking engines. HITS ignores {@code dampingFactor}.
 */
public record AlgorithmSettings(double dampingFactor, int maxIterations, double convergenceThreshold) {

	public static final double DEFAULT_DAMPING_FACTOR = 0.85;
	public static final int DEFAULT_MAX_ITERATIONS = 100;
	public static final double DEFAULT_CONVERGENCE_THRESHOLD = 0.0001;

	public AlgorithmSettings {
		Assert.isTrue(dampingFactor > 0 && dampingFactor < 1, "Damping factor must be between 0 and 1");
		Assert.isTrue(maxIterations > 0, "Max iterations must be positive");
		Assert.isTrue(convergenceThreshold > 0, "Convergence threshold must be positive");
	}

	public static AlgorithmSettings defaults() {
		return new AlgorithmSettings(DEFAULT_DAMPING_FACTOR, DEFAULT_MAX_ITERATIONS, DEFAULT_CONVERGENCE_THRESHOLD);
	}
}
