package com.linkanalysis.linkanalysis.config;

import java.util.List;
import java.util.Locale;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.linkanalysis.linkanalysis.settings.LinkAnalysisSettingsProperties;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;

@Configuration
public class SwaggerConfig {

	@Bean
	public OpenAPI linkAnalysisOpenApi(LinkAnalysisSettingsProperties settings) {
		String defaults = String.format(Locale.US,
				"Defaults: damping %.2f, max %d iterations, threshold %s, top %d, network '%s'.",
				settings.damping(), settings.maxIters(), settings.epsilon(), settings.kTop(),
				settings.defaultNetwork());
		return new OpenAPI()
				.info(new Info()
						.title("PageRank & HITS Analysis API")
						.description("Ranks the nodes of the sample networks with PageRank and HITS and compares "
								+ "both rankings. " + defaults)
						.version("0.1.0")
						.contact(new Contact().name("Link Analysis Team")))
				.tags(List.of(
						new Tag().name("Networks").description("Sample networks, their statistics and node degrees"),
						new Tag().name("Algorithms").description("PageRank, HITS and their comparison")));
	}
}
