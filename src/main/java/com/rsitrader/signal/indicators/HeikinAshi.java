package com.rsitrader.signal.indicators;

import com.rsitrader.market.Candle;

public class HeikinAshi {

	private double haOpen = Double.NaN;
	private double haClose = Double.NaN;

	public void update(Candle candle) {
		double close = (candle.open() + candle.high() + candle.low() + candle.close()) / 4.0;
		double open = Double.isNaN(haOpen)
				? (candle.open() + candle.close()) / 2.0
				: (haOpen + haClose) / 2.0;
		haOpen = open;
		haClose = close;
	}

	public double open() {
		return haOpen;
	}

	public double close() {
		return haClose;
	}
}
