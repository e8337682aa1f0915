package com.rsitrader.market;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public final class CandleIntervals {

	private CandleIntervals() {
	}

	/**
	 * Parses a Binance kline interval such as {@code 1m}, {@code 15m}, {@code 4h} or {@code 1d}.
	 */
	public static Duration toDuration(String interval) {
		if (interval == null || interval.length() < 2) {
			throw new IllegalArgumentException("Invalid kline interval: " + interval);
		}
		String normalized = interval.trim();
		char unit = normalized.charAt(normalized.length() - 1);
		long amount;
		try {
			amount = Long.parseLong(normalized.substring(0, normalized.length() - 1));
		} catch (NumberFormatException ex) {
			throw new IllegalArgumentException("Invalid kline interval: " + interval, ex);
		}
		if (amount <= 0) {
			throw new IllegalArgumentException("Invalid kline interval: " + interval);
		}
		return switch (unit) {
			case 'm' -> Duration.ofMinutes(amount);
			case 'h' -> Duration.ofHours(amount);
			case 'd' -> Duration.ofDays(amount);
			case 'w' -> Duration.ofDays(7 * amount);
			default -> throw new IllegalArgumentException(
					"Unsupported kline interval unit: " + interval.toUpperCase(Locale.ROOT));
		};
	}

	/**
	 * Close time of the candle that contains {@code instant}, i.e. the next interval boundary.
	 */
	public static Instant currentCandleClose(Instant instant, Duration interval) {
		long intervalMs = interval.toMillis();
		long bucketStart = Math.floorDiv(instant.toEpochMilli(), intervalMs) * intervalMs;
		return Instant.ofEpochMilli(bucketStart + intervalMs);
	}
}
