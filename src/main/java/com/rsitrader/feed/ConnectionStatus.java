package com.rsitrader.feed;

import java.time.Instant;

public record ConnectionStatus(
		ConnectionState state,
		boolean connected,
		int reconnectAttempts,
		long totalReconnects,
		Instant lastConnectedAt,
		Instant lastDisconnectedAt,
		Instant safeModeUntil,
		boolean tradingBlocked,
		String blockReason) {
}
