package com.linkanalysis.linkanalysis.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.linkanalysis.linkanalysis.domain.model.Network;
import com.linkanalysis.linkanalysis.settings.LinkAnalysisSettingsProperties;
import com.linkanalysis.linkanalysis.settings.LinkAnalysisSettingsProperties.NetworkSource;

@Component
@Order(0)
public class DatasetBootstrapper implements ApplicationRunner {

	private static final Logger log = LoggerFactory.getLogger(DatasetBootstrapper.class);

	private final NetworkIngestionService ingestionService;
	private final NetworkCatalog catalog;
	private final LinkAnalysisSettingsProperties settings;

	public DatasetBootstrapper(
			NetworkIngestionService ingestionService,
			NetworkCatalog catalog,
			LinkAnalysisSettingsProperties settings) {
		this.ingestionService = ingestionService;
		this.catalog = catalog;
		this.settings = settings;
	}

	@Override
	public void run(ApplicationArguments args) {
		if (settings.networks().isEmpty()) {
			log.info("Skipping dataset bootstrap: no networks configured");
			return;
		}
		log.info("Bootstrapping {} network(s)", settings.networks().size());
		List<Network> loaded = new ArrayList<>(settings.networks().size());
		for (Map.Entry<String, NetworkSource> entry : settings.networks().entrySet()) {
			ingestionService.loadIfAvailable(entry.getKey(), entry.getValue()).ifPresent(loaded::add);
		}
		catalog.publish(loaded);
	}
}
