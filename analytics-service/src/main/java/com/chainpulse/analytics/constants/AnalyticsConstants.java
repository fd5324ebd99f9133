package com.chainpulse.analytics.constants;

public final class AnalyticsConstants {

	private AnalyticsConstants() {
		// Utility class - prevent instantiation
	}

	public static final String CONTRACTS_NAMESPACE = "contracts:";

	/**
	 * {@code total-txs} → {@code contracts:total-txs}
	 */
	public static String buildAdapterName(String metric) {
		return CONTRACTS_NAMESPACE + metric;
	}
}
