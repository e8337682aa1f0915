package com.rsitrader.exchange;

import java.util.Locale;

public enum ExchangeOrderStatus {
	NEW,
	PARTIALLY_FILLED,
	FILLED,
	CANCELED,
	REJECTED,
	EXPIRED,
	UNKNOWN;

	public static ExchangeOrderStatus parse(String value) {
		if (value == null || value.isBlank()) {
			return UNKNOWN;
		}
		String normalized = value.trim().toUpperCase(Locale.ROOT);
		// the exchange reports EXPIRED_IN_MATCH for self-trade prevention
		if (normalized.startsWith("EXPIRED")) {
			return EXPIRED;
		}
		for (ExchangeOrderStatus status : values()) {
			if (status.name().equals(normalized)) {
				return status;
			}
		}
		return UNKNOWN;
	}

	public boolean isOpen() {
		return this == NEW || this == PARTIALLY_FILLED;
	}

	public boolean isDead() {
		return this == CANCELED || this == REJECTED || this == EXPIRED;
	}
}
