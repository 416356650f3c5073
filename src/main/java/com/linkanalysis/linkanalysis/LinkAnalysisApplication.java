package com.linkanalysis.linkanalysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LinkAnalysisApplication {

	public static void main(String[] args) {
		SpringApplication.run(LinkAnalysisApplication.class, args);
	}
}
