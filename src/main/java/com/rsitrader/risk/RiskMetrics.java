package com.rsitrader.risk;

import java.math.BigDecimal;
import java.time.LocalDate;

public record RiskMetrics(
		BigDecimal balance,
		BigDecimal initialBalance,
		BigDecimal dailyPnl,
		int dailyTradeCount,
		int consecutiveLosses,
		BigDecimal peakBalance,
		BigDecimal maxDrawdown,
		BigDecimal totalPnl,
		int wins,
		int losses,
		double winRate,
		boolean emergencyStop,
		String emergencyReason,
		LocalDate tradingDay) {
}
