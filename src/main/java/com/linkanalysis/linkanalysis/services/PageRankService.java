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
import com.linkanalysis.linkanalysis.domain.model.PageRankIteration;
import com.linkanalysis.linkanalysis.domain.model.PageRankMethod;
import com.linkanalysis.linkanalysis.domain.model.PageRankResult;
import com.linkanalysis.linkanalysis.domain.model.RankedNode;
import com.linkanalysis.linkanalysis.domain.model.ScoreVectors;
import com.linkanalysis.linkanalysis.settings.LinkAnalysisSettingsProperties;

@Service
public class PageRankService {

	private static final Logger log = LoggerFactory.getLogger(PageRankService.class);

	private final int topK;

	@Autowired
	public PageRankService(LinkAnalysisSettingsProperties settings) {
		this(settings.kTop());
	}

	PageRankService(int topK) {
		Assert.isTrue(topK > 0, "K Top must be positive");
		this.topK = topK;
	}

	public PageRankResult compute(Graph graph, AlgorithmSettings settings) {
		return compute(GraphIndex.of(graph), settings, PageRankMethod.ADJACENCY, false);
	}

	public PageRankResult compute(GraphIndex index, AlgorithmSettings settings, PageRankMethod method,
			boolean includeHistory) {
		Assert.notNull(index, "Graph index cannot be null");
		Assert.notNull(settings, "Settings cannot be null");
		Assert.notNull(method, "Method cannot be null");
		if (index.isEmpty()) {
			return PageRankResult.empty(settings, includeHistory);
		}

		Instant start = Instant.now();
		Step step = method == PageRankMethod.MATRIX
				? new MatrixStep(index, settings.dampingFactor())
				: new AdjacencyStep(index, settings.dampingFactor());
		Outcome outcome = iterate(index, step, settings, includeHistory);
		normalize(outcome.scores());

		log.info("PageRank ({}) completed: nodes={}, iterations={}, delta={}, converged={}, elapsed={} ms",
				method,
				index.size(),
				outcome.iterations(),
				String.format(Locale.US, "%.6f", outcome.lastDelta()),
				outcome.converged(),
				Duration.between(start, Instant.now()).toMillis());

		return new PageRankResult(
				ScoreVectors.toLabelMap(index, outcome.scores()),
				RankedNode.top(index, outcome.scores(), topK),
				outcome.iterations(),
				settings.convergenceThreshold(),
				settings.dampingFactor(),
				outcome.history());
	}

	/*
	 * Base equation:
	 * p_{k+1} = (1-d)/N * e  +  d * (A^T * p_k + (sum_{i in D} p_k(i) / N) * e)
	 * where
	 * - N is the number of nodes,
	 * - d is the damping factor,
	 * - e is the all-ones vector,
	 * - A uses count(i->j) / out(i) as the transition probability from i to j,
	 * - D are the dangling nodes, whose mass is spread uniformly.
	 * The convergence check uses the raw iterate; the sum-to-one rescale runs once afterwards.
	 */
	private Outcome iterate(GraphIndex index, Step step, AlgorithmSettings settings, boolean includeHistory) {
		int nodeCount = index.size();
		double[] current = new double[nodeCount];
		Arrays.fill(current, 1.0 / nodeCount);
		double[] next = new double[nodeCount];
		List<PageRankIteration> history = includeHistory ? new ArrayList<>() : null;

		int iterations = 0;
		double lastDelta = Double.MAX_VALUE;
		boolean converged = false;
		while (iterations < settings.maxIterations()) {
			step.apply(current, next);
			lastDelta = ScoreVectors.l1Distance(next, current);

			// p_{k+1} -> p_k; the old buffer is reused for the next write
			double[] swap = current;
			current = next;
			next = swap;

			iterations++;
			if (history != null) {
				history.add(new PageRankIteration(iterations, ScoreVectors.toLabelMap(index, current)));
			}
			log.debug("PageRank iteration {}: delta={}", iterations, lastDelta);
			if (lastDelta < settings.convergenceThreshold()) {
				converged = true;
				break;
			}
		}
		return new Outcome(current, iterations, lastDelta, converged, history);
	}

	private void normalize(double[] scores) {
		double total = ScoreVectors.sum(scores);
		if (total <= 0.0) {
			return;
		}
		for (int i = 0; i < scores.length; i++) {
			scores[i] /= total;
		}
	}

	/**
	 * One synchronous PageRank update: reads only {@code current}, overwrites all of {@code next}.
	 */
	interface Step {

		void apply(double[] current, double[] next);
	}

	static final class AdjacencyStep implements Step {

		private final GraphIndex index;
		private final double damping;
		private final double teleport;

		AdjacencyStep(GraphIndex index, double damping) {
			this.index = index;
			this.damping = damping;
			this.teleport = (1.0 - damping) / index.size();
		}

		@Override
		public void apply(double[] current, double[] next) {
			int nodeCount = index.size();
			Arrays.fill(next, teleport);
			double danglingMass = 0.0;

			for (int i = 0; i < nodeCount; i++) {
				int outDegree = index.outDegree(i);
				// dangling nodes accumulate and are spread below
				if (outDegree == 0) {
					danglingMass += current[i];
					continue;
				}
				// every edge i->j carries d * p_i / out(i); parallel edges carry it once each
				double contribution = damping * current[i] / outDegree;
				for (int k = 0; k < outDegree; k++) {
					next[index.outLink(i, k)] += contribution;
				}
			}

			double danglingContribution = damping * danglingMass / nodeCount;
			for (int i = 0; i < nodeCount; i++) {
				next[i] += danglingContribution;
			}
		}
	}

	static final class MatrixStep implements Step {

		private final double[][] transition;
		private final double damping;
		private final double teleport;

		MatrixStep(GraphIndex index, double damping) {
			this.transition = buildTransitionMatrix(index);
			this.damping = damping;
			this.teleport = (1.0 - damping) / index.size();
		}

		/**
		 * Column j holds out(j)'s transition probabilities, or 1/N everywhere when j is dangling.
		 */
		static double[][] buildTransitionMatrix(GraphIndex index) {
			int nodeCount = index.size();
			double[][] matrix = new double[nodeCount][nodeCount];
			for (int j = 0; j < nodeCount; j++) {
				int outDegree = index.outDegree(j);
				if (outDegree == 0) {
					double uniform = 1.0 / nodeCount;
					for (int i = 0; i < nodeCount; i++) {
						matrix[i][j] = uniform;
					}
					continue;
				}
				double weight = 1.0 / outDegree;
				for (int k = 0; k < outDegree; k++) {
					matrix[index.outLink(j, k)][j] += weight;
				}
			}
			return matrix;
		}

		@Override
		public void apply(double[] current, double[] next) {
			int nodeCount = current.length;
			for (int i = 0; i < nodeCount; i++) {
				double[] row = transition[i];
				double product = 0.0;
				for (int j = 0; j < nodeCount; j++) {
					product += row[j] * current[j];
				}
				next[i] = damping * product + teleport;
			}
		}
	}

	private record Outcome(
			double[] scores,
			int iterations,
			double lastDelta,
			boolean converged,
			List<PageRankIteration> history) {
	}
}
