package com.rsitrader.exchange;

import java.math.BigDecimal;

/**
 * Net position of one symbol. Positive amount is long, negative is short.
 */
public record PositionSnapshot(
		String symbol,
		BigDecimal positionAmt,
		BigDecimal entryPrice) {

	public static PositionSnapshot flat(String symbol) {
		return new PositionSnapshot(symbol, BigDecimal.ZERO, BigDecimal.ZERO);
	}

	public boolean isFlat() {
		return positionAmt == null || positionAmt.signum() == 0;
	}

	public BigDecimal absoluteAmount() {
		return positionAmt == null ? BigDecimal.ZERO : positionAmt.abs();
	}
}
