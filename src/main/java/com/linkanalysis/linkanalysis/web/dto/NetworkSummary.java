package com.linkanalysis.linkanalysis.web.dto;

import com.linkanalysis.linkanalysis.domain.model.Network;

public record NetworkSummary(String type, String name, String description, int numNodes, int numEdges) {

	public static NetworkSummary from(Network network) {
		return new NetworkSummary(
				network.type(),
				network.name(),
				network.description(),
				network.graph().nodeCount(),
				network.graph().edges().size());
	}
}
