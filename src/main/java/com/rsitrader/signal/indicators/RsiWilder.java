package com.rsitrader.signal.indicators;

/**
 * Wilder smoothed RSI. Seeds with the simple average of the first {@code period} changes, then smooths.
 */
public class RsiWilder {

	private final int period;
	private double previousClose = Double.NaN;
	private int seeded;
	private double gainSum;
	private double lossSum;
	private double averageGain = Double.NaN;
	private double averageLoss = Double.NaN;

	public RsiWilder(int period) {
		if (period <= 0) {
			throw new IllegalArgumentException("RSI period must be positive: " + period);
		}
		this.period = period;
	}

	public double update(double close) {
		if (Double.isNaN(close)) {
			return value();
		}
		if (Double.isNaN(previousClose)) {
			previousClose = close;
			return Double.NaN;
		}
		double change = close - previousClose;
		previousClose = close;
		double gain = change > 0 ? change : 0.0;
		double loss = change < 0 ? -change : 0.0;
		if (seeded < period) {
			gainSum += gain;
			lossSum += loss;
			seeded++;
			if (seeded == period) {
				averageGain = gainSum / period;
				averageLoss = lossSum / period;
			}
			return value();
		}
		averageGain = (averageGain * (period - 1) + gain) / period;
		averageLoss = (averageLoss * (period - 1) + loss) / period;
		return value();
	}

	public boolean isReady() {
		return seeded >= period;
	}

	public double value() {
		if (!isReady()) {
			return Double.NaN;
		}
		if (averageLoss == 0.0) {
			return averageGain == 0.0 ? 50.0 : 100.0;
		}
		return 100.0 - 100.0 / (1.0 + averageGain / averageLoss);
	}

	public int period() {
		return period;
	}
}
