package com.linkanalysis.linkanalysis.domain.model;

import org.springframework.util.Assert;

/**
 * A named sample graph as loaded from the classpath.
 *
 * @param type catalog key used by the API, e.g. {@code citation}.
 * @param name display name.
 * @param description free text description.
 * @param csvFile file the graph was loaded from.
 * @param graph the loaded graph.
 */
public record Network(String type, String name, String description, String csvFile, Graph graph) {

	public Network {
		Assert.hasText(type, "Network type cannot be blank");
		Assert.notNull(graph, "Network graph cannot be null");
	}
}
