package com.linkanalysis.linkanalysis.web.dto;

import java.util.List;

import com.linkanalysis.linkanalysis.domain.model.Edge;
import com.linkanalysis.linkanalysis.domain.model.Network;

/**
 * Dataset details including where the edge list came from and its first edges.
 */
public record DatasetResponse(
		String name,
		String description,
		String type,
		String csvFile,
		int numNodes,
		int numEdges,
		List<Edge> sampleEdges) {

	private static final int SAMPLE_SIZE = 10;

	public static DatasetResponse from(Network network) {
		List<Edge> edges = network.graph().edges();
		return new DatasetResponse(
				network.name(),
				network.description(),
				network.type(),
				network.csvFile() != null ? network.csvFile() : "N/A",
				network.graph().nodeCount(),
				edges.size(),
				List.copyOf(edges.subList(0, Math.min(SAMPLE_SIZE, edges.size()))));
	}
}
