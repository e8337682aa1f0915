package com.rsitrader.risk;

import java.math.BigDecimal;

public record PositionSize(
		BigDecimal quantity,
		BigDecimal entryPriceEstimate,
		BigDecimal stopLoss,
		BigDecimal takeProfit,
		BigDecimal riskAmount) {

	public BigDecimal notional() {
		return quantity.multiply(entryPriceEstimate);
	}

	public BigDecimal stopDistance() {
		return entryPriceEstimate.subtract(stopLoss).abs();
	}

	public BigDecimal targetDistance() {
		return takeProfit.subtract(entryPriceEstimate).abs();
	}
}
