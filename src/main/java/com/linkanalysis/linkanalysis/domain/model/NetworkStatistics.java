package com.linkanalysis.linkanalysis.domain.model;

/**
 * Graph level counters. Only edges with two known endpoints are counted.
 */
public record NetworkStatistics(
		int numNodes,
		int numEdges,
		double density,
		double avgDegree,
		double avgInDegree,
		double avgOutDegree) {
}
