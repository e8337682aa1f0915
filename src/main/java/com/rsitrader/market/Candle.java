package com.rsitrader.market;

public record Candle(
		long openTime,
		double open,
		double high,
		double low,
		double close,
		double volume,
		long closeTime) {
}
