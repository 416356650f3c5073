package com.linkanalysis.linkanalysis.domain.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import org.springframework.util.Assert;

/**
 * Dense 0-based view of a {@link Graph}: label positions follow node insertion order, and
 * forward/reverse adjacency lists keep duplicates so parallel edges count once per occurrence.
 * <p>
 * Edges whose source or target is not a known label are dropped silently. Instances are
 * immutable; neighbor arrays are never handed out.
 */
public final class GraphIndex {

	private final List<String> labels;
	private final Map<String, Integer> positions;
	private final int[][] outgoing;
	private final int[][] incoming;
	private final int edgeCount;

	private GraphIndex(List<String> labels, Map<String, Integer> positions, int[][] outgoing, int[][] incoming,
			int edgeCount) {
		this.labels = labels;
		this.positions = positions;
		this.outgoing = outgoing;
		this.incoming = incoming;
		this.edgeCount = edgeCount;
	}

	public static GraphIndex of(Graph graph) {
		Assert.notNull(graph, "Graph cannot be null");
		return of(graph.nodes(), graph.edges());
	}

	public static GraphIndex of(List<String> nodes, List<Edge> edges) {
		Graph graph = new Graph(nodes, edges);
		int nodeCount = graph.nodeCount();
		Map<String, Integer> positions = new HashMap<>(nodeCount * 2);
		for (int i = 0; i < nodeCount; i++) {
			positions.put(graph.nodes().get(i), i);
		}

		List<List<Integer>> forward = new ArrayList<>(nodeCount);
		List<List<Integer>> reverse = new ArrayList<>(nodeCount);
		for (int i = 0; i < nodeCount; i++) {
			forward.add(new ArrayList<>());
			reverse.add(new ArrayList<>());
		}
		int valid = 0;
		for (Edge edge : graph.edges()) {
			Integer sourceIndex = positions.get(edge.source());
			Integer targetIndex = positions.get(edge.target());
			if (sourceIndex == null || targetIndex == null) {
				continue;
			}
			forward.get(sourceIndex).add(targetIndex);
			reverse.get(targetIndex).add(sourceIndex);
			valid++;
		}
		return new GraphIndex(graph.nodes(), Map.copyOf(positions), toArrays(forward), toArrays(reverse), valid);
	}

	private static int[][] toArrays(List<List<Integer>> lists) {
		int[][] arrays = new int[lists.size()][];
		for (int i = 0; i < arrays.length; i++) {
			arrays[i] = lists.get(i).stream().mapToInt(Integer::intValue).toArray();
		}
		return arrays;
	}

	public int size() {
		return labels.size();
	}

	public boolean isEmpty() {
		return labels.isEmpty();
	}

	/** Number of edges whose endpoints are both known labels. */
	public int edgeCount() {
		return edgeCount;
	}

	public String label(int index) {
		return labels.get(index);
	}

	public OptionalInt indexOf(String label) {
		Integer position = positions.get(label);
		return position != null ? OptionalInt.of(position) : OptionalInt.empty();
	}

	public int outDegree(int index) {
		return outgoing[index].length;
	}

	public int inDegree(int index) {
		return incoming[index].length;
	}

	/** The k-th target of an out-edge of {@code index}, in edge input order. */
	public int outLink(int index, int k) {
		return outgoing[index][k];
	}

	/** The k-th source of an in-edge of {@code index}, in edge input order. */
	public int inLink(int index, int k) {
		return incoming[index][k];
	}
}
