package com.rsitrader.risk;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.rsitrader.config.TradingProperties;
import com.rsitrader.exchange.SymbolRules;
import com.rsitrader.market.Candle;
import com.rsitrader.signal.Direction;

/**
 * Structural stop: beyond the lowest low (LONG) or highest high (SHORT) of the last few closed candles, pushed
 * out by a fractional buffer.
 */
@Component
public class StopLossCalculator {

	private final int lookback;
	private final BigDecimal buffer;

	public StopLossCalculator(TradingProperties tradingProperties) {
		this.lookback = tradingProperties.risk().stopLookbackCandles();
		this.buffer = tradingProperties.risk().slBufferPct();
	}

	public Optional<BigDecimal> stopFor(Direction direction, List<Candle> recent, SymbolRules rules) {
		if (recent == null || recent.isEmpty()) {
			return Optional.empty();
		}
		List<Candle> window = recent.subList(Math.max(0, recent.size() - lookback), recent.size());
		BigDecimal stop;
		if (direction == Direction.LONG) {
			BigDecimal lowest = BigDecimal.valueOf(window.stream().mapToDouble(Candle::low).min().orElseThrow());
			stop = lowest.multiply(BigDecimal.ONE.subtract(buffer), MathContext.DECIMAL64);
		} else {
			BigDecimal highest = BigDecimal.valueOf(window.stream().mapToDouble(Candle::high).max().orElseThrow());
			stop = highest.multiply(BigDecimal.ONE.add(buffer), MathContext.DECIMAL64);
		}
		if (rules != null) {
			stop = rules.roundPrice(stop, direction == Direction.LONG ? RoundingMode.DOWN : RoundingMode.UP);
		}
		return stop.signum() > 0 ? Optional.of(stop) : Optional.empty();
	}
}
