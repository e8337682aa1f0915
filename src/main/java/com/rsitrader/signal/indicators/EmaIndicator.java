package com.rsitrader.signal.indicators;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Exponential moving average that also remembers its recent values so the slope over a lookback can be read.
 */
public class EmaIndicator {

	private final int period;
	private final double alpha;
	private final int historySize;
	private final Deque<Double> history = new ArrayDeque<>();
	private double value = Double.NaN;
	private int count;

	public EmaIndicator(int period, int slopeLookback) {
		if (period <= 0 || slopeLookback <= 0) {
			throw new IllegalArgumentException("EMA period and slope lookback must be positive");
		}
		this.period = period;
		this.alpha = 2.0 / (period + 1.0);
		this.historySize = slopeLookback + 1;
	}

	public double update(double price) {
		if (Double.isNaN(price)) {
			return value();
		}
		value = Double.isNaN(value) ? price : value + alpha * (price - value);
		count++;
		history.addLast(value);
		while (history.size() > historySize) {
			history.removeFirst();
		}
		return value();
	}

	public boolean isReady() {
		return count >= period;
	}

	public double value() {
		return isReady() ? value : Double.NaN;
	}

	/**
	 * Change of the average over the configured lookback, NaN until enough history exists.
	 */
	public double slope() {
		if (!isReady() || history.size() < historySize) {
			return Double.NaN;
		}
		return history.peekLast() - history.peekFirst();
	}
}
