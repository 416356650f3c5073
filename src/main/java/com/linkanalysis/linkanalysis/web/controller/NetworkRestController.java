package com.linkanalysis.linkanalysis.web.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.linkanalysis.linkanalysis.domain.model.GraphIndex;
import com.linkanalysis.linkanalysis.domain.model.Network;
import com.linkanalysis.linkanalysis.services.GraphStatisticsService;
import com.linkanalysis.linkanalysis.services.NetworkCatalog;
import com.linkanalysis.linkanalysis.web.dto.DatasetResponse;
import com.linkanalysis.linkanalysis.web.dto.NetworkInfoResponse;
import com.linkanalysis.linkanalysis.web.dto.NetworkListResponse;
import com.linkanalysis.linkanalysis.web.dto.NetworkSummary;
import com.linkanalysis.linkanalysis.web.dto.NodeDegreesResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@RequestMapping("/api")
@Tag(name = "Networks")
public class NetworkRestController {

	private final NetworkCatalog catalog;
	private final GraphStatisticsService statisticsService;

	public NetworkRestController(NetworkCatalog catalog, GraphStatisticsService statisticsService) {
		this.catalog = catalog;
		this.statisticsService = statisticsService;
	}

	@GetMapping("/networks")
	@Operation(summary = "Lists the available sample networks")
	public NetworkListResponse networks() {
		return new NetworkListResponse(catalog.getAll().stream()
				.map(NetworkSummary::from)
				.toList());
	}

	@GetMapping("/network/{networkType}")
	@Operation(summary = "Returns size, density and average degree of a network")
	public NetworkInfoResponse networkInfo(@PathVariable String networkType) {
		Network network = catalog.getNetwork(networkType);
		return NetworkInfoResponse.from(network, statisticsService.statistics(GraphIndex.of(network.graph())));
	}

	@GetMapping("/node-degrees/{networkType}")
	@Operation(summary = "Returns in, out and total degree of every node")
	public NodeDegreesResponse nodeDegrees(@PathVariable String networkType) {
		Network network = catalog.getNetwork(networkType);
		return new NodeDegreesResponse(statisticsService.nodeDegrees(GraphIndex.of(network.graph())));
	}

	@GetMapping("/dataset/{networkType}")
	@Operation(summary = "Returns the dataset source and a sample of its edges")
	public DatasetResponse dataset(@PathVariable String networkType) {
		return DatasetResponse.from(catalog.getNetwork(networkType));
	}
}
