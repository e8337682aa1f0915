package com.rsitrader.signal;

import java.time.Instant;

public record DetectorStatus(
		boolean pendingLong,
		boolean pendingShort,
		Instant longSince,
		Instant shortSince,
		int signalsToday,
		long totalSignals,
		LatchPolicy latchPolicy) {
}
