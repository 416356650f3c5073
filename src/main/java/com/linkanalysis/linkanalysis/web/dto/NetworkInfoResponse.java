package com.linkanalysis.linkanalysis.web.dto;

import com.linkanalysis.linkanalysis.domain.model.Network;
import com.linkanalysis.linkanalysis.domain.model.NetworkStatistics;

public record NetworkInfoResponse(
		String name,
		String description,
		String type,
		int numNodes,
		int numEdges,
		double density,
		double avgDegree) {

	public static NetworkInfoResponse from(Network network, NetworkStatistics statistics) {
		return new NetworkInfoResponse(
				network.name(),
				network.description(),
				network.type(),
				statistics.numNodes(),
				statistics.numEdges(),
				statistics.density(),
				statistics.avgDegree());
	}
}
