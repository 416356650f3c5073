package com.linkanalysis.linkanalysis.domain.model;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RankedNodeTest {

	@Test
	@DisplayName("sorts by score descending and breaks ties by node input order")
	void stableDescendingSort() {
		GraphIndex index = GraphIndex.of(List.of("C", "A", "B", "D"), List.of());

		List<RankedNode> top = RankedNode.top(index, new double[] { 0.2, 0.5, 0.2, 0.1 }, 5);

		assertEquals(List.of(
				new RankedNode("A", 0.5),
				new RankedNode("C", 0.2),
				new RankedNode("B", 0.2),
				new RankedNode("D", 0.1)), top);
	}

	@Test
	@DisplayName("keeps only the first k entries")
	void truncatesToK() {
		GraphIndex index = GraphIndex.of(List.of("A", "B", "C"), List.of());

		List<RankedNode> top = RankedNode.top(index, new double[] { 0.1, 0.3, 0.2 }, 2);

		assertEquals(2, top.size());
		assertEquals("B", top.get(0).label());
		assertEquals("C", top.get(1).label());
	}

	@Test
	@DisplayName("empty index gives an empty list")
	void emptyIndex() {
		assertTrue(RankedNode.top(GraphIndex.of(Graph.empty()), new double[0], 5).isEmpty());
	}
}
