package com.rsitrader.order;

import java.math.BigDecimal;

public record PerformanceStats(
		int closedTrades,
		int failedTrades,
		int wins,
		int losses,
		double winRate,
		BigDecimal totalPnl,
		BigDecimal averagePnl,
		BigDecimal bestTrade,
		BigDecimal worstTrade,
		int degradedFills) {
}
