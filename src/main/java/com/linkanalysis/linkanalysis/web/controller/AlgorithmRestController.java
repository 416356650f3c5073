package com.linkanalysis.linkanalysis.web.controller;

import java.util.Locale;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.linkanalysis.linkanalysis.domain.model.AlgorithmSettings;
import com.linkanalysis.linkanalysis.domain.model.ComparisonResult;
import com.linkanalysis.linkanalysis.domain.model.GraphIndex;
import com.linkanalysis.linkanalysis.domain.model.HitsResult;
import com.linkanalysis.linkanalysis.domain.model.Network;
import com.linkanalysis.linkanalysis.domain.model.PageRankMethod;
import com.linkanalysis.linkanalysis.domain.model.PageRankResult;
import com.linkanalysis.linkanalysis.services.HitsService;
import com.linkanalysis.linkanalysis.services.NetworkCatalog;
import com.linkanalysis.linkanalysis.services.PageRankService;
import com.linkanalysis.linkanalysis.services.RankingComparisonService;
import com.linkanalysis.linkanalysis.settings.LinkAnalysisSettingsProperties;
import com.linkanalysis.linkanalysis.web.dto.AlgorithmRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@RequestMapping("/api/algorithms")
@Tag(name = "Algorithms")
public class AlgorithmRestController {

	private static final AlgorithmRequest DEFAULT_REQUEST = new AlgorithmRequest(null, null, null, null);

	private final NetworkCatalog catalog;
	private final PageRankService pageRankService;
	private final HitsService hitsService;
	private final RankingComparisonService comparisonService;
	private final LinkAnalysisSettingsProperties settings;

	public AlgorithmRestController(
			NetworkCatalog catalog,
			PageRankService pageRankService,
			HitsService hitsService,
			RankingComparisonService comparisonService,
			LinkAnalysisSettingsProperties settings) {
		this.catalog = catalog;
		this.pageRankService = pageRankService;
		this.hitsService = hitsService;
		this.comparisonService = comparisonService;
		this.settings = settings;
	}

	@PostMapping("/pagerank")
	@Operation(summary = "Runs PageRank on a network")
	public PageRankResult pageRank(
			@RequestBody(required = false) AlgorithmRequest request,
			@RequestParam(value = "history", defaultValue = "false") boolean includeHistory,
			@RequestParam(value = "method", defaultValue = "adjacency") String method) {
		AlgorithmRequest effective = request != null ? request : DEFAULT_REQUEST;
		PageRankMethod pageRankMethod = parseMethod(method);
		AlgorithmSettings algorithmSettings = effective.toAlgorithmSettings(settings);
		Network network = catalog.getNetwork(effective.effectiveNetworkType(settings));
		return pageRankService.compute(GraphIndex.of(network.graph()), algorithmSettings, pageRankMethod,
				includeHistory);
	}

	@PostMapping("/hits")
	@Operation(summary = "Runs HITS on a network; the damping factor is ignored")
	public HitsResult hits(
			@RequestBody(required = false) AlgorithmRequest request,
			@RequestParam(value = "history", defaultValue = "false") boolean includeHistory) {
		AlgorithmRequest effective = request != null ? request : DEFAULT_REQUEST;
		AlgorithmSettings algorithmSettings = effective.toAlgorithmSettings(settings);
		Network network = catalog.getNetwork(effective.effectiveNetworkType(settings));
		return hitsService.compute(GraphIndex.of(network.graph()), algorithmSettings, includeHistory);
	}

	@PostMapping("/compare")
	@Operation(summary = "Runs PageRank and HITS and compares their top nodes")
	public ComparisonResult compare(@RequestBody(required = false) AlgorithmRequest request) {
		AlgorithmRequest effective = request != null ? request : DEFAULT_REQUEST;
		AlgorithmSettings algorithmSettings = effective.toAlgorithmSettings(settings);
		Network network = catalog.getNetwork(effective.effectiveNetworkType(settings));
		return comparisonService.compare(network, algorithmSettings);
	}

	private PageRankMethod parseMethod(String method) {
		try {
			return PageRankMethod.valueOf(method.trim().toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Unknown PageRank method: " + method, ex);
		}
	}
}
