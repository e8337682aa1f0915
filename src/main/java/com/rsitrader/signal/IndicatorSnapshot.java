package com.rsitrader.signal;

import java.time.Instant;

/**
 * Indicator readings at the close of one candle. Any reading may be NaN while its indicator warms up.
 */
public record IndicatorSnapshot(
		Instant closeTime,
		double close,
		double rsiFast,
		double rsiMid,
		double rsiSlow,
		double haOpen,
		double haClose,
		double ema,
		double emaSlope,
		double mtfRsi) {
}
