package com.rsitrader.signal;

import java.time.Instant;

import org.springframework.stereotype.Component;

import com.rsitrader.config.TradingProperties;
import com.rsitrader.market.Candle;
import com.rsitrader.market.CandleIntervals;
import com.rsitrader.signal.indicators.CandleAggregator;
import com.rsitrader.signal.indicators.EmaIndicator;
import com.rsitrader.signal.indicators.HeikinAshi;
import com.rsitrader.signal.indicators.RsiWilder;

@Component
public class StreamingIndicatorCalculator implements IndicatorCalculator {

	private final TradingProperties.Signal settings;

	private RsiWilder rsiFast;
	private RsiWilder rsiMid;
	private RsiWilder rsiSlow;
	private RsiWilder mtfRsi;
	private EmaIndicator ema;
	private HeikinAshi heikinAshi;
	private CandleAggregator mtfAggregator;
	private long lastCloseTime = Long.MIN_VALUE;

	public StreamingIndicatorCalculator(TradingProperties tradingProperties) {
		this.settings = tradingProperties.signal();
		reset();
	}

	@Override
	public synchronized IndicatorSnapshot update(Candle candle) {
		if (candle.closeTime() <= lastCloseTime) {
			// replayed candle after a reconnect
			return snapshot(candle);
		}
		lastCloseTime = candle.closeTime();
		rsiFast.update(candle.close());
		rsiMid.update(candle.close());
		rsiSlow.update(candle.close());
		ema.update(candle.close());
		heikinAshi.update(candle);
		mtfAggregator.update(candle).ifPresent(coarse -> mtfRsi.update(coarse.close()));
		return snapshot(candle);
	}

	@Override
	public synchronized void reset() {
		rsiFast = new RsiWilder(settings.rsiFastPeriod());
		rsiMid = new RsiWilder(settings.rsiMidPeriod());
		rsiSlow = new RsiWilder(settings.rsiSlowPeriod());
		mtfRsi = new RsiWilder(settings.mtfRsiPeriod());
		ema = new EmaIndicator(settings.emaPeriod(), settings.emaSlopeLookback());
		heikinAshi = new HeikinAshi();
		mtfAggregator = new CandleAggregator(CandleIntervals.toDuration(settings.mtfInterval()));
		lastCloseTime = Long.MIN_VALUE;
	}

	private IndicatorSnapshot snapshot(Candle candle) {
		return new IndicatorSnapshot(
				Instant.ofEpochMilli(candle.closeTime()),
				candle.close(),
				rsiFast.value(),
				rsiMid.value(),
				rsiSlow.value(),
				heikinAshi.open(),
				heikinAshi.close(),
				ema.value(),
				ema.slope(),
				mtfRsi.value());
	}
}
