package com.linkanalysis.linkanalysis.services;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import com.linkanalysis.linkanalysis.domain.model.AlgorithmSettings;
import com.linkanalysis.linkanalysis.domain.model.Graph;
import com.linkanalysis.linkanalysis.domain.model.GraphIndex;
import com.linkanalysis.linkanalysis.domain.model.HitsIteration;
import com.linkanalysis.linkanalysis.domain.model.HitsResult;
import com.linkanalysis.linkanalysis.domain.model.RankedNode;
import com.linkanalysis.linkanalysis.domain.model.ScoreVectors;
import com.linkanalysis.linkanalysis.settings.LinkAnalysisSettingsProperties;

/**
 * Hyperlink-Induced Topic Search: authorities are pointed to by good hubs, hubs point to good
 * authorities. Each iteration reads only the previous iteration's vectors.
 */
@Service
public class HitsService {

	private static final Logger log = LoggerFactory.getLogger(HitsService.class);

	private final int topK;

	@Autowired
	public HitsService(LinkAnalysisSettingsProperties settings) {
		this(settings.kTop());
	}

	HitsService(int topK) {
		Assert.isTrue(topK > 0, "K Top must be positive");
		this.topK = topK;
	}

	public HitsResult compute(Graph graph, AlgorithmSettings settings) {
		return compute(GraphIndex.of(graph), settings, false);
	}

	public HitsResult compute(GraphIndex index, AlgorithmSettings settings, boolean includeHistory) {
		Assert.notNull(index, "Graph index cannot be null");
		Assert.notNull(settings, "Settings cannot be null");
		if (index.isEmpty()) {
			return HitsResult.empty(includeHistory);
		}

		int nodeCount = index.size();
		double[] authority = new double[nodeCount];
		double[] hub = new double[nodeCount];
		Arrays.fill(authority, 1.0);
		Arrays.fill(hub, 1.0);
		double[] nextAuthority = new double[nodeCount];
		double[] nextHub = new double[nodeCount];
		List<HitsIteration> history = includeHistory ? new ArrayList<>() : null;

		Instant start = Instant.now();
		int iterations = 0;
		double authorityDelta = Double.MAX_VALUE;
		double hubDelta = Double.MAX_VALUE;
		boolean converged = false;
		while (iterations < settings.maxIterations()) {
			for (int i = 0; i < nodeCount; i++) {
				// auth(i) = sum of hub(j) over j -> i
				double authoritySum = 0.0;
				for (int k = 0; k < index.inDegree(i); k++) {
					authoritySum += hub[index.inLink(i, k)];
				}
				nextAuthority[i] = authoritySum;

				// hub(i) = sum of auth(j) over i -> j, previous authority values only
				double hubSum = 0.0;
				for (int k = 0; k < index.outDegree(i); k++) {
					hubSum += authority[index.outLink(i, k)];
				}
				nextHub[i] = hubSum;
			}
			normalize(nextAuthority);
			normalize(nextHub);

			authorityDelta = ScoreVectors.l1Distance(nextAuthority, authority);
			hubDelta = ScoreVectors.l1Distance(nextHub, hub);

			double[] swap = authority;
			authority = nextAuthority;
			nextAuthority = swap;
			swap = hub;
			hub = nextHub;
			nextHub = swap;

			iterations++;
			if (history != null) {
				history.add(new HitsIteration(iterations,
						ScoreVectors.toLabelMap(index, authority),
						ScoreVectors.toLabelMap(index, hub)));
			}
			log.debug("HITS iteration {}: authorityDelta={}, hubDelta={}", iterations, authorityDelta, hubDelta);
			if (authorityDelta < settings.convergenceThreshold() && hubDelta < settings.convergenceThreshold()) {
				converged = true;
				break;
			}
		}

		log.info("HITS completed: nodes={}, iterations={}, authorityDelta={}, hubDelta={}, converged={}, elapsed={} ms",
				nodeCount,
				iterations,
				String.format(Locale.US, "%.6f", authorityDelta),
				String.format(Locale.US, "%.6f", hubDelta),
				converged,
				Duration.between(start, Instant.now()).toMillis());

		return new HitsResult(
				ScoreVectors.toLabelMap(index, authority),
				ScoreVectors.toLabelMap(index, hub),
				RankedNode.top(index, authority, topK),
				RankedNode.top(index, hub, topK),
				iterations,
				history);
	}

	/**
	 * Divides by the Euclidean norm; an all-zero vector stays zero.
	 */
	private void normalize(double[] vector) {
		double norm = ScoreVectors.l2Norm(vector);
		if (norm == 0.0) {
			return;
		}
		for (int i = 0; i < vector.length; i++) {
			vector[i] /= norm;
		}
	}
}
