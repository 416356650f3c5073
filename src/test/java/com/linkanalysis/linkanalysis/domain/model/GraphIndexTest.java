package com.linkanalysis.linkanalysis.domain.model;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GraphIndexTest {

	@Test
	@DisplayName("positions follow node insertion order, not label order")
	void positionsFollowInsertionOrder() {
		GraphIndex index = GraphIndex.of(List.of("zeta", "alpha", "mid"), List.of());

		assertEquals(3, index.size());
		assertEquals(0, index.indexOf("zeta").getAsInt());
		assertEquals(1, index.indexOf("alpha").getAsInt());
		assertEquals(2, index.indexOf("mid").getAsInt());
		assertEquals("alpha", index.label(1));
		assertTrue(index.indexOf("missing").isEmpty());
	}

	@Test
	@DisplayName("edges with an unknown endpoint are dropped without error")
	void unknownEndpointsAreDropped() {
		GraphIndex index = GraphIndex.of(
				List.of("A", "B"),
				List.of(new Edge("A", "B"), new Edge("A", "Z"), new Edge("Y", "B"), new Edge("Y", "Z")));

		assertEquals(1, index.edgeCount());
		assertEquals(1, index.outDegree(0));
		assertEquals(1, index.inDegree(1));
		assertEquals(0, index.inDegree(0));
	}

	@Test
	@DisplayName("parallel edges and self-loops are kept once per occurrence")
	void parallelEdgesAndSelfLoopsAreKept() {
		GraphIndex index = GraphIndex.of(
				List.of("A", "B"),
				List.of(new Edge("A", "B"), new Edge("A", "B"), new Edge("B", "B")));

		assertEquals(3, index.edgeCount());
		assertEquals(2, index.outDegree(0));
		assertEquals(1, index.outDegree(1));
		assertEquals(3, index.inDegree(1));
		assertEquals(1, index.outLink(0, 0));
		assertEquals(1, index.outLink(0, 1));
		assertEquals(1, index.inLink(1, 2));
	}

	@Test
	@DisplayName("adjacency keeps edge input order")
	void adjacencyKeepsEdgeOrder() {
		GraphIndex index = GraphIndex.of(
				List.of("A", "B", "C"),
				List.of(new Edge("A", "C"), new Edge("B", "C"), new Edge("A", "B")));

		assertEquals(2, index.outLink(0, 0));
		assertEquals(1, index.outLink(0, 1));
		assertEquals(0, index.inLink(2, 0));
		assertEquals(1, index.inLink(2, 1));
	}

	@Test
	@DisplayName("empty graph yields an empty index")
	void emptyGraph() {
		GraphIndex index = GraphIndex.of(Graph.empty());

		assertTrue(index.isEmpty());
		assertEquals(0, index.edgeCount());
		assertEquals(0, index.size());
		assertTrue(index.indexOf("A").isEmpty());
	}

	@Test
	@DisplayName("duplicate node labels are rejected")
	void duplicateLabelsRejected() {
		assertThrows(IllegalArgumentException.class, () -> new Graph(List.of("A", "A"), List.of()));
	}
}
