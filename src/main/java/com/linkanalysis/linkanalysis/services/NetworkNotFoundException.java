package com.linkanalysis.linkanalysis.services;

public class NetworkNotFoundException extends RuntimeException {

	private final String networkType;

	public NetworkNotFoundException(String networkType) {
		super("Network " + networkType + " not found");
		this.networkType = networkType;
	}

	public String getNetworkType() {
		return networkType;
	}
}
