package com.linkanalysis.linkanalysis.domain.model;

import org.springframework.util.Assert;

/**
 * Directed link between two node labels.
 */
public record Edge(String source, String target) {

	public Edge {
		Assert.notNull(source, "Edge source cannot be null");
		Assert.notNull(target, "Edge target cannot be null");
	}
}
