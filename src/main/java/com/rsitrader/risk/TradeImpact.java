package com.rsitrader.risk;

import java.math.BigDecimal;

public record TradeImpact(
		BigDecimal newBalance,
		BigDecimal newDailyPnl,
		int newConsecutiveLosses,
		boolean wouldTriggerEmergency,
		boolean wouldHitDailyLimit) {
}
