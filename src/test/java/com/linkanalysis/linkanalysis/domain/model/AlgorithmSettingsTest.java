package com.linkanalysis.linkanalysis.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class AlgorithmSettingsTest {

	@Test
	@DisplayName("defaults are 0.85 / 100 / 0.0001")
	void defaults() {
		AlgorithmSettings settings = AlgorithmSettings.defaults();

		assertEquals(0.85, settings.dampingFactor());
		assertEquals(100, settings.maxIterations());
		assertEquals(0.0001, settings.convergenceThreshold());
	}

	@ParameterizedTest
	@DisplayName("out of range values are rejected")
	@CsvSource({
			"0.0,100,0.0001",
			"1.0,100,0.0001",
			"-0.5,100,0.0001",
			"0.85,0,0.0001",
			"0.85,100,0.0",
			"0.85,100,-1e-6"
	})
	void rejectsInvalidValues(double damping, int maxIterations, double threshold) {
		assertThrows(IllegalArgumentException.class, () -> new AlgorithmSettings(damping, maxIterations, threshold));
	}
}
