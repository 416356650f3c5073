package com.linkanalysis.linkanalysis.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import com.linkanalysis.linkanalysis.settings.LinkAnalysisSettingsProperties;

@Configuration
public class CorsConfig {

	@Bean
	public WebMvcConfigurer corsConfigurer(LinkAnalysisSettingsProperties settings) {
		String[] origins = settings.corsAllowedOrigins().toArray(String[]::new);
		return new WebMvcConfigurer() {
			@Override
			public void addCorsMappings(CorsRegistry registry) {
				if (origins.length == 0) {
					return;
				}
				registry.addMapping("/api/**")
						.allowedOrigins(origins)
						.allowedMethods("*")
						.allowedHeaders("*")
						.allowCredentials(true);
			}
		};
	}
}
