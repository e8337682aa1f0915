package com.rsitrader.engine;

import java.math.BigDecimal;
import java.time.Instant;

import com.rsitrader.feed.ConnectionState;
import com.rsitrader.risk.RiskMetrics;
import com.rsitrader.signal.DetectorStatus;

public record HealthSnapshot(
		Instant timestamp,
		boolean running,
		boolean autoTrade,
		BigDecimal balance,
		int activeTrades,
		String activeTradeId,
		ConnectionState feedState,
		boolean feedConnected,
		long latencyMs,
		boolean emergencyStop,
		String emergencyReason,
		boolean safeMode,
		boolean tradingBlocked,
		int pendingProtections,
		RiskMetrics riskMetrics,
		DetectorStatus detectorStatus) {
}
