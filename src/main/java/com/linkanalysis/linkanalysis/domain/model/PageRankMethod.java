package com.linkanalysis.linkanalysis.domain.model;

/**
 * How the PageRank power iteration is carried out. Both produce the same scores up to rounding.
 */
public enum PageRankMethod {

	/** Pushes mass along adjacency lists each iteration. */
	ADJACENCY,

	/** Builds the column-stochastic transition matrix once and multiplies it each iteration. */
	MATRIX
}
