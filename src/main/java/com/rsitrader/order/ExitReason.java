package com.rsitrader.order;

public enum ExitReason {
	STOP_LOSS,
	TAKE_PROFIT,
	MANUAL,
	EMERGENCY,
	/** Both protection orders vanished without a matching exit. */
	FORCED,
	PROTECTION_FAILED,
	/** Tracked locally but flat on the exchange. */
	GHOST
}
