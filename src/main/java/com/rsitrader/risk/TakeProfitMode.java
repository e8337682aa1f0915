package com.rsitrader.risk;

public enum TakeProfitMode {
	/** Target at a fixed percentage away from entry. */
	FIXED_PERCENT,
	/** Target at a multiple of the stop distance. */
	RATIO
}
