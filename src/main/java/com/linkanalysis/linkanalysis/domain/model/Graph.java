package com.linkanalysis.linkanalysis.domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.util.Assert;

/**
 * Immutable directed graph: ordered unique node labels plus ordered edges.
 * <p>
 * Edges may reference labels that are not part of {@link #nodes()}; such edges are kept here
 * and ignored by {@link GraphIndex}. Parallel edges and self-loops are preserved.
 */
public record Graph(List<String> nodes, List<Edge> edges) {

	private static final Graph EMPTY = new Graph(List.of(), List.of());

	public Graph {
		Assert.notNull(nodes, "Nodes cannot be null");
		Assert.notNull(edges, "Edges cannot be null");
		nodes = List.copyOf(nodes);
		edges = List.copyOf(edges);
		Set<String> seen = new HashSet<>(nodes.size());
		for (String node : nodes) {
			Assert.isTrue(seen.add(node), () -> "Duplicate node label: " + node);
		}
	}

	public static Graph empty() {
		return EMPTY;
	}

	public int nodeCount() {
		return nodes.size();
	}
}
