package com.rsitrader.signal;

import java.time.Instant;
import java.util.List;

public record Signal(
		Direction direction,
		Instant detectedAt,
		Instant confirmedAt,
		IndicatorSnapshot indicatorSnapshot,
		double confidence,
		List<String> reasons) {

	public Signal {
		reasons = List.copyOf(reasons);
	}
}
