package com.linkanalysis.linkanalysis.settings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Strongly typed access to ranking defaults and the sample networks defined in application.yml.
 */
@ConfigurationProperties(prefix = "linkanalysis.settings")
public record LinkAnalysisSettingsProperties(
		double damping,
		double epsilon,
		int maxIters,
		int kTop,
		String defaultNetwork,
		Map<String, NetworkSource> networks,
		List<String> corsAllowedOrigins) {

	public LinkAnalysisSettingsProperties {
		Assert.isTrue(damping > 0 && damping < 1, "Damping factor must be between 0 and 1");
		Assert.isTrue(epsilon > 0, "Epsilon must be positive");
		Assert.isTrue(maxIters > 0, "Max iterations must be positive");
		Assert.isTrue(kTop > 0, "K Top must be positive");
		Assert.isTrue(StringUtils.hasText(defaultNetwork), "Default network type required");
		networks = networks != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(networks))
				: Map.of();
		corsAllowedOrigins = corsAllowedOrigins != null ? List.copyOf(corsAllowedOrigins) : List.of();
	}

	/**
	 * Describes one sample network shipped on the classpath.
	 */
	public record NetworkSource(String name, String description, String csvFile) {

		public NetworkSource {
			Assert.isTrue(StringUtils.hasText(name), "Network name required");
			Assert.isTrue(StringUtils.hasText(csvFile), "Network csv file required");
			description = description != null ? description : "";
		}
	}
}
