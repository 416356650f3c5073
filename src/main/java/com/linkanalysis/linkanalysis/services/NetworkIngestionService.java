package com.linkanalysis.linkanalysis.services;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.util.ResourceUtils;

import com.linkanalysis.linkanalysis.domain.model.Edge;
import com.linkanalysis.linkanalysis.domain.model.Graph;
import com.linkanalysis.linkanalysis.domain.model.Network;
import com.linkanalysis.linkanalysis.settings.LinkAnalysisSettingsProperties.NetworkSource;

/**
 * Loads edge lists in {@code source,target} CSV form.
 */
@Service
public class NetworkIngestionService {

	private static final Logger log = LoggerFactory.getLogger(NetworkIngestionService.class);

	private static final String SOURCE_COLUMN = "source";
	private static final String TARGET_COLUMN = "target";

	private final ResourceLoader resourceLoader;

	public NetworkIngestionService(ResourceLoader resourceLoader) {
		this.resourceLoader = resourceLoader;
	}

	/**
	 * Loads the network described by {@code source}, or returns empty if its file is missing or
	 * unreadable.
	 *
	 * @param type catalog key of the network.
	 * @param source configured name, description and csv location; bare paths resolve on the classpath.
	 * @return the network, if it could be loaded.
	 */
	public Optional<Network> loadIfAvailable(String type, NetworkSource source) {
		Resource resource = resourceLoader.getResource(toLocation(source.csvFile()));
		if (!resource.exists()) {
			log.info("Network file not found for {} ({}), skipping", type, source.csvFile());
			return Optional.empty();
		}

		try (BufferedReader reader = new BufferedReader(
				new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
			Graph graph = readEdgeList(reader);
			log.info("Imported network {}: {} nodes, {} edges from {}",
					type,
					graph.nodeCount(),
					graph.edges().size(),
					source.csvFile());
			return Optional.of(new Network(type, source.name(), source.description(), source.csvFile(), graph));
		}
		catch (IOException | IllegalArgumentException ex) {
			log.error("Failed to import network {} from {}", type, source.csvFile(), ex);
			return Optional.empty();
		}
	}

	/**
	 * Parses a CSV edge list. The header row must name the {@code source} and {@code target}
	 * columns; other columns are ignored. Values are trimmed, blank rows and rows with a blank
	 * endpoint are skipped. Nodes are every endpoint seen, sorted.
	 *
	 * @param reader CSV text, positioned at the header row.
	 * @return the graph.
	 * @throws IOException if the reader fails.
	 * @throws IllegalArgumentException if the header is missing or lacks a required column.
	 */
	public Graph readEdgeList(BufferedReader reader) throws IOException {
		String line = reader.readLine(); // header
		if (line == null) {
			throw new IllegalArgumentException("Edge list is empty, header row required");
		}
		String[] header = line.split(",", -1);
		int sourceColumn = columnIndex(header, SOURCE_COLUMN);
		int targetColumn = columnIndex(header, TARGET_COLUMN);
		int requiredColumns = Math.max(sourceColumn, targetColumn) + 1;

		List<Edge> edges = new ArrayList<>();
		TreeSet<String> nodes = new TreeSet<>();
		while ((line = reader.readLine()) != null) {
			if (line.isBlank()) {
				continue;
			}
			String[] columns = line.split(",", -1);
			if (columns.length < requiredColumns) {
				continue;
			}
			String source = columns[sourceColumn].trim();
			String target = columns[targetColumn].trim();
			if (source.isEmpty() || target.isEmpty()) {
				continue;
			}
			edges.add(new Edge(source, target));
			nodes.add(source);
			nodes.add(target);
		}
		return new Graph(new ArrayList<>(nodes), edges);
	}

	private int columnIndex(String[] header, String column) {
		for (int i = 0; i < header.length; i++) {
			// strip a UTF-8 BOM on the first column
			String name = header[i].replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
			if (name.equals(column)) {
				return i;
			}
		}
		throw new IllegalArgumentException("Edge list header lacks column '" + column + "'");
	}

	private String toLocation(String csvFile) {
		return csvFile.contains(":") ? csvFile : ResourceUtils.CLASSPATH_URL_PREFIX + csvFile;
	}
}
