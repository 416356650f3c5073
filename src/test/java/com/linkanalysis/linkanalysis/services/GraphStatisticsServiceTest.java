package com.linkanalysis.linkanalysis.services;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.linkanalysis.linkanalysis.domain.model.Graph;
import com.linkanalysis.linkanalysis.domain.model.GraphIndex;
import com.linkanalysis.linkanalysis.domain.model.NetworkStatistics;
import com.linkanalysis.linkanalysis.domain.model.NodeDegree;

import static com.linkanalysis.linkanalysis.services.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

class GraphStatisticsServiceTest {

	private final GraphStatisticsService service = new GraphStatisticsService();

	private final GraphIndex sample = GraphIndex.of(
			graph(List.of("A", "B", "C"), "A->B", "A->B", "B->B", "C->A", "X->A"));

	@Test
	@DisplayName("degrees count parallel edges and self-loops, ignore unknown endpoints")
	void nodeDegrees() {
		Map<String, NodeDegree> degrees = service.nodeDegrees(sample);

		assertEquals(List.of("A", "B", "C"), List.copyOf(degrees.keySet()));
		assertEquals(new NodeDegree(1, 2, 3), degrees.get("A"));
		assertEquals(new NodeDegree(3, 1, 4), degrees.get("B"));
		assertEquals(new NodeDegree(0, 1, 1), degrees.get("C"));
	}

	@Test
	@DisplayName("density and average degrees over valid edges")
	void statistics() {
		NetworkStatistics statistics = service.statistics(sample);

		assertEquals(3, statistics.numNodes());
		assertEquals(4, statistics.numEdges());
		assertEquals(4.0 / 6.0, statistics.density(), 1e-12);
		assertEquals(8.0 / 3.0, statistics.avgDegree(), 1e-12);
		assertEquals(4.0 / 3.0, statistics.avgInDegree(), 1e-12);
		assertEquals(4.0 / 3.0, statistics.avgOutDegree(), 1e-12);
	}

	@Test
	@DisplayName("single node has zero density")
	void singleNode() {
		NetworkStatistics statistics = service.statistics(GraphIndex.of(graph(List.of("A"), "A->A")));

		assertEquals(0.0, statistics.density());
		assertEquals(2.0, statistics.avgDegree());
	}

	@Test
	@DisplayName("empty graph yields zeros")
	void emptyGraph() {
		GraphIndex empty = GraphIndex.of(Graph.empty());

		assertEquals(new NetworkStatistics(0, 0, 0.0, 0.0, 0.0, 0.0), service.statistics(empty));
		assertTrue(service.nodeDegrees(empty).isEmpty());
	}
}
