package com.linkanalysis.linkanalysis.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import com.linkanalysis.linkanalysis.domain.model.AlgorithmSettings;
import com.linkanalysis.linkanalysis.domain.model.ComparisonResult;
import com.linkanalysis.linkanalysis.domain.model.GraphIndex;
import com.linkanalysis.linkanalysis.domain.model.HitsResult;
import com.linkanalysis.linkanalysis.domain.model.Network;
import com.linkanalysis.linkanalysis.domain.model.NetworkStatistics;
import com.linkanalysis.linkanalysis.domain.model.PageRankMethod;
import com.linkanalysis.linkanalysis.domain.model.PageRankResult;
import com.linkanalysis.linkanalysis.domain.model.RankedNode;

/**
 * Runs PageRank and HITS over the same graph and explains where the rankings agree.
 */
@Service
public class RankingComparisonService {

	private final PageRankService pageRankService;
	private final HitsService hitsService;
	private final GraphStatisticsService statisticsService;

	public RankingComparisonService(
			PageRankService pageRankService,
			HitsService hitsService,
			GraphStatisticsService statisticsService) {
		this.pageRankService = pageRankService;
		this.hitsService = hitsService;
		this.statisticsService = statisticsService;
	}

	public ComparisonResult compare(Network network, AlgorithmSettings settings) {
		Assert.notNull(network, "Network cannot be null");
		Assert.notNull(settings, "Settings cannot be null");
		GraphIndex index = GraphIndex.of(network.graph());

		PageRankResult pagerank = pageRankService.compute(index, settings, PageRankMethod.ADJACENCY, false);
		HitsResult hits = hitsService.compute(index, settings, false);

		List<String> overlapAuthorities = overlap(pagerank.topNodes(), hits.topAuthorities());
		List<String> overlapHubs = overlap(pagerank.topNodes(), hits.topHubs());

		List<String> insights = new ArrayList<>();
		insights.add(overlapInsight(overlapAuthorities, "Authorities"));
		insights.add(overlapInsight(overlapHubs, "Hubs"));

		firstOf(pagerank.topNodes())
				.ifPresent(top -> insights.add(leaderInsight("Top PageRank node", top, index)));
		firstOf(hits.topAuthorities())
				.ifPresent(top -> insights.add(leaderInsight("Top authority", top, index)));
		firstOf(hits.topHubs())
				.ifPresent(top -> insights.add(leaderInsight("Top hub", top, index)));

		if (!index.isEmpty()) {
			insights.add(String.format(Locale.US, "PageRank stopped after %d iteration(s), HITS after %d (limit %d)",
					pagerank.iterations(), hits.iterations(), settings.maxIterations()));
			NetworkStatistics statistics = statisticsService.statistics(index);
			insights.add(String.format(Locale.US, "Average in-degree %.2f and out-degree %.2f across %d node(s)",
					statistics.avgInDegree(), statistics.avgOutDegree(), statistics.numNodes()));
		}
		insights.addAll(domainInsights(network.type()));

		return new ComparisonResult(pagerank, hits, overlapAuthorities, overlapHubs, List.copyOf(insights));
	}

	/**
	 * Labels present in both lists, in the order of {@code pagerank}.
	 */
	private List<String> overlap(List<RankedNode> pagerank, List<RankedNode> other) {
		Set<String> otherLabels = other.stream().map(RankedNode::label).collect(Collectors.toSet());
		return pagerank.stream()
				.map(RankedNode::label)
				.filter(otherLabels::contains)
				.toList();
	}

	private String overlapInsight(List<String> overlap, String ranking) {
		if (overlap.isEmpty()) {
			return "No overlap between top PageRank nodes and top " + ranking;
		}
		return overlap.size() + " node(s) appear in both top PageRank and top " + ranking + ": "
				+ String.join(", ", overlap);
	}

	private String leaderInsight(String title, RankedNode leader, GraphIndex index) {
		int position = index.indexOf(leader.label())
				.orElseThrow(() -> new IllegalStateException("Ranked node missing from index: " + leader.label()));
		return String.format(Locale.US, "%s is %s (score %.5f, in-degree %d, out-degree %d)",
				title, leader.label(), leader.score(), index.inDegree(position), index.outDegree(position));
	}

	private Optional<RankedNode> firstOf(List<RankedNode> ranking) {
		return ranking.isEmpty() ? Optional.empty() : Optional.of(ranking.get(0));
	}

	private List<String> domainInsights(String networkType) {
		if ("citation".equals(networkType)) {
			return List.of(
					"In citation networks, high PageRank typically indicates influential papers",
					"High authority scores indicate papers that are frequently cited",
					"High hub scores indicate papers that cite many important papers");
		}
		if ("social".equals(networkType)) {
			return List.of(
					"In social networks, high PageRank indicates influential users",
					"High authority scores indicate users who are mentioned/retweeted often",
					"High hub scores indicate users who frequently mention/retweet others");
		}
		return List.of();
	}
}
