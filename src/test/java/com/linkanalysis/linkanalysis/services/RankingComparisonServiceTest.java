package com.linkanalysis.linkanalysis.services;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.linkanalysis.linkanalysis.domain.model.AlgorithmSettings;
import com.linkanalysis.linkanalysis.domain.model.ComparisonResult;
import com.linkanalysis.linkanalysis.domain.model.Graph;
import com.linkanalysis.linkanalysis.domain.model.Network;
import com.linkanalysis.linkanalysis.domain.model.RankedNode;

import static com.linkanalysis.linkanalysis.services.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

class RankingComparisonServiceTest {

	private RankingComparisonService service;

	@BeforeEach
	void setUp() {
		service = new RankingComparisonService(new PageRankService(5), new HitsService(5),
				new GraphStatisticsService());
	}

	private static Network network(String type, Graph graph) {
		return new Network(type, "Test network", "", "test.csv", graph);
	}

	@Test
	@DisplayName("3-cycle: every top node overlaps and insights mention degrees and iterations")
	void threeCycle() {
		ComparisonResult result = service.compare(network("custom", GraphFixtures.threeCycle()),
				AlgorithmSettings.defaults());

		assertEquals(List.of("A", "B", "C"), result.overlapAuthorities());
		assertEquals(List.of("A", "B", "C"), result.overlapHubs());
		assertEquals(List.of(
				"3 node(s) appear in both top PageRank and top Authorities: A, B, C",
				"3 node(s) appear in both top PageRank and top Hubs: A, B, C",
				"Top PageRank node is A (score 0.33333, in-degree 1, out-degree 1)",
				"Top authority is A (score 0.57735, in-degree 1, out-degree 1)",
				"Top hub is A (score 0.57735, in-degree 1, out-degree 1)",
				"PageRank stopped after 1 iteration(s), HITS after 2 (limit 100)",
				"Average in-degree 1.00 and out-degree 1.00 across 3 node(s)"), result.insights());
	}

	@Test
	@DisplayName("leader insight reports the leader's own degrees")
	void leaderDegrees() {
		Graph star = graph(List.of("A", "B", "C", "D"), "A->C", "B->C", "D->C", "C->A", "A->Ghost");

		ComparisonResult result = service.compare(network("custom", star), AlgorithmSettings.defaults());

		String authority = result.insights().stream()
				.filter(line -> line.startsWith("Top authority is "))
				.findFirst()
				.orElseThrow();
		assertTrue(authority.startsWith("Top authority is C "), authority);
		assertTrue(authority.endsWith("in-degree 3, out-degree 1)"), authority);
	}

	@Test
	@DisplayName("overlaps are the intersections of the relayed top lists")
	void overlapsMatchTopLists() {
		ComparisonResult result = service.compare(network("custom", GraphFixtures.random(3L, 30, 90)),
				AlgorithmSettings.defaults());

		List<String> authorities = result.hits().topAuthorities().stream().map(RankedNode::label).toList();
		List<String> hubs = result.hits().topHubs().stream().map(RankedNode::label).toList();
		List<String> pagerank = result.pagerank().topNodes().stream().map(RankedNode::label).toList();

		assertEquals(pagerank.stream().filter(authorities::contains).toList(), result.overlapAuthorities());
		assertEquals(pagerank.stream().filter(hubs::contains).toList(), result.overlapHubs());
	}

	@Test
	@DisplayName("sinks overlap with the authorities but not with the hubs")
	void sinksAreAuthoritiesNotHubs() {
		// the PageRank leaders are the two dangling sinks, the hubs are the citing nodes
		Graph graph = graph(List.of("H1", "H2", "H3", "H4", "H5", "S1", "S2"),
				"H1->S1", "H2->S1", "H3->S1", "H4->S2", "H5->S2", "H1->S2");
		ComparisonResult result = service.compare(network("custom", graph), AlgorithmSettings.defaults());

		assertFalse(result.overlapHubs().contains("S1"));
		assertTrue(result.overlapAuthorities().containsAll(List.of("S1", "S2")));
	}

	@Test
	@DisplayName("citation networks get domain insights")
	void citationInsights() {
		ComparisonResult result = service.compare(network("citation", GraphFixtures.threeCycle()),
				AlgorithmSettings.defaults());

		assertTrue(result.insights().contains("High authority scores indicate papers that are frequently cited"));
	}

	@Test
	@DisplayName("social networks get domain insights")
	void socialInsights() {
		ComparisonResult result = service.compare(network("social", GraphFixtures.threeCycle()),
				AlgorithmSettings.defaults());

		assertTrue(result.insights().contains("In social networks, high PageRank indicates influential users"));
	}

	@Test
	@DisplayName("empty graph does not fail and reports no overlap")
	void emptyGraph() {
		ComparisonResult result = service.compare(network("citation", Graph.empty()), AlgorithmSettings.defaults());

		assertTrue(result.overlapAuthorities().isEmpty());
		assertTrue(result.overlapHubs().isEmpty());
		assertEquals("No overlap between top PageRank nodes and top Authorities", result.insights().get(0));
		assertEquals("No overlap between top PageRank nodes and top Hubs", result.insights().get(1));
		assertEquals(5, result.insights().size());
		assertEquals(0, result.pagerank().iterations());
		assertEquals(0, result.hits().iterations());
	}

	@Test
	@DisplayName("HITS runs with the request's iteration settings")
	void sharedSettings() {
		ComparisonResult result = service.compare(network("custom", GraphFixtures.random(9L, 20, 60)),
				new AlgorithmSettings(0.5, 2, 1e-15));

		assertEquals(2, result.pagerank().iterations());
		assertEquals(2, result.hits().iterations());
		assertEquals(0.5, result.pagerank().dampingFactor());
	}
}
