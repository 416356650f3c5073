package com.linkanalysis.linkanalysis.domain.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One entry of a top-k list.
 */
public record RankedNode(String label, double score) {

	/**
	 * Sorts nodes by score descending and keeps the first {@code k}. Ties keep node input order.
	 */
	public static List<RankedNode> top(GraphIndex index, double[] scores, int k) {
		List<RankedNode> ranked = new ArrayList<>(index.size());
		for (int i = 0; i < index.size(); i++) {
			ranked.add(new RankedNode(index.label(i), scores[i]));
		}
		// List.sort is stable
		ranked.sort(Comparator.comparingDouble(RankedNode::score).reversed());
		return List.copyOf(ranked.subList(0, Math.min(Math.max(k, 0), ranked.size())));
	}
}
