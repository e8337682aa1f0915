package com.rsitrader.order;

import java.math.BigDecimal;
import java.time.Instant;

import com.rsitrader.signal.Direction;

public record ProtectionStatus(
		String tradeId,
		Direction direction,
		Instant deadline,
		boolean placed,
		boolean inFlight,
		int attempts,
		BigDecimal originalStop,
		BigDecimal originalTarget,
		BigDecimal finalStop,
		BigDecimal finalTarget,
		Instant completedAt) {
}
