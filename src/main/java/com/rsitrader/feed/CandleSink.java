package com.rsitrader.feed;

import com.rsitrader.market.Candle;

@FunctionalInterface
public interface CandleSink {

	void onCandleClosed(Candle candle);
}
