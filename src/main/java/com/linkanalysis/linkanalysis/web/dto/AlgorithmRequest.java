package com.linkanalysis.linkanalysis.web.dto;

import org.springframework.util.StringUtils;

import com.linkanalysis.linkanalysis.domain.model.AlgorithmSettings;
import com.linkanalysis.linkanalysis.settings.LinkAnalysisSettingsProperties;

/**
 * Body of the algorithm endpoints. Missing fields fall back to the configured defaults.
 */
public record AlgorithmRequest(
		String networkType,
		Double dampingFactor,
		Integer maxIterations,
		Double convergenceThreshold) {

	public String effectiveNetworkType(LinkAnalysisSettingsProperties settings) {
		return StringUtils.hasText(networkType) ? networkType.trim() : settings.defaultNetwork();
	}

	/**
	 * @throws IllegalArgumentException if a supplied value is out of range.
	 */
	public AlgorithmSettings toAlgorithmSettings(LinkAnalysisSettingsProperties settings) {
		return new AlgorithmSettings(
				dampingFactor != null ? dampingFactor : settings.damping(),
				maxIterations != null ? maxIterations : settings.maxIters(),
				convergenceThreshold != null ? convergenceThreshold : settings.epsilon());
	}
}
