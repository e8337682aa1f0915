package com.rsitrader.risk;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.rsitrader.exchange.SymbolRules;
import com.rsitrader.market.Candle;
import com.rsitrader.signal.Direction;
import com.rsitrader.support.TestProperties;

class StopLossCalculatorTest {

	private static final SymbolRules RULES = new SymbolRules("BTCUSDC", new BigDecimal("0.1"),
			new BigDecimal("0.001"), new BigDecimal("0.001"), new BigDecimal("5"));

	private final StopLossCalculator calculator = new StopLossCalculator(TestProperties.defaults());

	@Test
	void longStopSitsBelowLowestLowOfLookback() {
		assertThat(calculator.stopFor(Direction.LONG, candles(), null))
				.hasValueSatisfying(stop -> assertThat(stop).isEqualByComparingTo("99.0016"));
		assertThat(calculator.stopFor(Direction.LONG, candles(), RULES))
				.hasValueSatisfying(stop -> assertThat(stop).isEqualByComparingTo("99.0"));
	}

	@Test
	void shortStopSitsAboveHighestHighRoundedUp() {
		assertThat(calculator.stopFor(Direction.SHORT, candles(), RULES))
				.hasValueSatisfying(stop -> assertThat(stop).isEqualByComparingTo("101.3"));
	}

	@Test
	void emptyHistoryHasNoStop() {
		assertThat(calculator.stopFor(Direction.LONG, List.of(), RULES)).isEmpty();
	}

	private List<Candle> candles() {
		// the first candle falls outside the five candle lookback
		return List.of(
				candle(0, 95.0, 90.0),
				candle(1, 100.5, 99.5),
				candle(2, 100.2, 99.2),
				candle(3, 101.0, 99.8),
				candle(4, 100.6, 99.9),
				candle(5, 100.4, 99.6));
	}

	private Candle candle(int index, double high, double low) {
		long openTime = index * 60_000L;
		return new Candle(openTime, low + 0.2, high, low, high - 0.2, 5.0, openTime + 59_999L);
	}
}
