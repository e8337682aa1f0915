package com.rsitrader.signal;

import com.rsitrader.market.Candle;

public interface IndicatorCalculator {

	/**
	 * Feeds one closed candle and returns the readings as of its close.
	 */
	IndicatorSnapshot update(Candle candle);

	void reset();
}
