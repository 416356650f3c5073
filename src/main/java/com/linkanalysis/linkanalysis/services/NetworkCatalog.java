package com.linkanalysis.linkanalysis.services;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import com.linkanalysis.linkanalysis.domain.model.Network;

/**
 * Read-only registry of the sample networks. The bootstrapper publishes the loaded networks once
 * at startup; requests only read the published, immutable map.
 */
@Service
public class NetworkCatalog {

	private static final Logger log = LoggerFactory.getLogger(NetworkCatalog.class);

	private final AtomicReference<Map<String, Network>> networks = new AtomicReference<>(Map.of());

	public void publish(Collection<Network> loaded) {
		Assert.notNull(loaded, "Networks cannot be null");
		Map<String, Network> byType = new LinkedHashMap<>();
		for (Network network : loaded) {
			Assert.isTrue(byType.put(network.type(), network) == null,
					() -> "Duplicate network type: " + network.type());
		}
		networks.set(Collections.unmodifiableMap(byType));
		log.info("Network catalog published with {} network(s): {}", byType.size(), byType.keySet());
	}

	public Collection<Network> getAll() {
		return networks.get().values();
	}

	/**
	 * @param type catalog key.
	 * @return the network.
	 * @throws NetworkNotFoundException if no network is registered under {@code type}.
	 */
	public Network getNetwork(String type) {
		Network network = type != null ? networks.get().get(type) : null;
		if (network == null) {
			throw new NetworkNotFoundException(type);
		}
		return network;
	}
}
