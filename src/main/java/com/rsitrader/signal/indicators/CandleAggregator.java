package com.rsitrader.signal.indicators;

import java.time.Duration;
import java.util.Optional;

import com.rsitrader.market.Candle;

/**
 * Folds base interval candles into a coarser interval. A coarse candle is emitted as soon as the base candle
 * that closes its bucket arrives.
 */
public class CandleAggregator {

	private final long intervalMs;

	private long bucket = Long.MIN_VALUE;
	private Candle current;

	public CandleAggregator(Duration interval) {
		this.intervalMs = interval.toMillis();
	}

	public Optional<Candle> update(Candle candle) {
		long candleBucket = Math.floorDiv(candle.openTime(), intervalMs);
		if (current == null || candleBucket != bucket) {
			bucket = candleBucket;
			current = new Candle(candleBucket * intervalMs, candle.open(), candle.high(), candle.low(),
					candle.close(), candle.volume(), candle.closeTime());
		} else {
			current = new Candle(current.openTime(), current.open(),
					Math.max(current.high(), candle.high()),
					Math.min(current.low(), candle.low()),
					candle.close(),
					current.volume() + candle.volume(),
					candle.closeTime());
		}
		long bucketEnd = (bucket + 1) * intervalMs;
		if (candle.closeTime() + 1 >= bucketEnd) {
			Candle completed = current;
			current = null;
			return Optional.of(completed);
		}
		return Optional.empty();
	}
}
