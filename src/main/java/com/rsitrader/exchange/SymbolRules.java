package com.rsitrader.exchange;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Trading rules of one symbol: price tick, quantity step, minimum quantity and minimum notional.
 */
public record SymbolRules(
		String symbol,
		BigDecimal tickSize,
		BigDecimal stepSize,
		BigDecimal minQty,
		BigDecimal minNotional) {

	public BigDecimal roundQuantityDown(BigDecimal quantity) {
		return roundToIncrement(quantity, stepSize, RoundingMode.DOWN);
	}

	public BigDecimal roundPrice(BigDecimal price, RoundingMode mode) {
		return roundToIncrement(price, tickSize, mode);
	}

	public boolean meetsMinimums(BigDecimal quantity, BigDecimal price) {
		if (minQty != null && quantity.compareTo(minQty) < 0) {
			return false;
		}
		if (minNotional != null && quantity.multiply(price).compareTo(minNotional) < 0) {
			return false;
		}
		return true;
	}

	private static BigDecimal roundToIncrement(BigDecimal value, BigDecimal increment, RoundingMode mode) {
		if (value == null) {
			return null;
		}
		if (increment == null || increment.signum() <= 0) {
			return value.stripTrailingZeros();
		}
		BigDecimal units = value.divide(increment, 0, mode);
		return units.multiply(increment).setScale(Math.max(increment.stripTrailingZeros().scale(), 0),
				RoundingMode.UNNECESSARY);
	}
}
