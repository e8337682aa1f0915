package com.rsitrader.risk;

import java.math.BigDecimal;

public enum TradeResult {
	WIN,
	LOSS,
	BREAKEVEN;

	public static TradeResult fromPnl(BigDecimal pnl) {
		int sign = pnl == null ? 0 : pnl.signum();
		if (sign > 0) {
			return WIN;
		}
		return sign < 0 ? LOSS : BREAKEVEN;
	}
}
