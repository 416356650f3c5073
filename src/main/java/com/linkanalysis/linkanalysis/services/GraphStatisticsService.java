package com.linkanalysis.linkanalysis.services;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import com.linkanalysis.linkanalysis.domain.model.GraphIndex;
import com.linkanalysis.linkanalysis.domain.model.NetworkStatistics;
import com.linkanalysis.linkanalysis.domain.model.NodeDegree;

@Service
public class GraphStatisticsService {

	/**
	 * In, out and total degree per node, in node input order. Parallel edges count once each and
	 * a self-loop adds one to both the in and the out degree.
	 *
	 * @param index indexed graph.
	 * @return degrees keyed by label.
	 */
	public Map<String, NodeDegree> nodeDegrees(GraphIndex index) {
		Assert.notNull(index, "Graph index cannot be null");
		Map<String, NodeDegree> degrees = new LinkedHashMap<>(index.size() * 2);
		for (int i = 0; i < index.size(); i++) {
			int in = index.inDegree(i);
			int out = index.outDegree(i);
			degrees.put(index.label(i), new NodeDegree(in, out, in + out));
		}
		return Collections.unmodifiableMap(degrees);
	}

	/**
	 * Graph level counters. Density is {@code E / (N * (N - 1))} for more than one node, else 0;
	 * averages are 0 for an empty graph.
	 *
	 * @param index indexed graph.
	 * @return statistics over the edges with two known endpoints.
	 */
	public NetworkStatistics statistics(GraphIndex index) {
		Assert.notNull(index, "Graph index cannot be null");
		int nodes = index.size();
		int edges = index.edgeCount();
		double density = nodes > 1 ? (double) edges / ((double) nodes * (nodes - 1)) : 0.0;
		double avgDirected = nodes > 0 ? (double) edges / nodes : 0.0;
		return new NetworkStatistics(nodes, edges, density, 2.0 * avgDirected, avgDirected, avgDirected);
	}
}
