package com.rsitrader.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.rsitrader.support.TestProperties;

class TradingPropertiesTest {

	@Test
	void defaultsHaveNoCrossFieldErrors() {
		assertThat(TestProperties.defaults().crossFieldErrors()).isEmpty();
	}

	@Test
	void reportsMinNotionalAboveMaxNotional() {
		TradingProperties properties = TestProperties.builder().notionalBounds("500", "100").build();

		assertThat(properties.crossFieldErrors())
				.containsExactly("trader.risk.min-notional must not exceed trader.risk.max-notional");
	}

	@Test
	void reportsRiskFractionAboveOne() {
		TradingProperties base = TestProperties.defaults();
		TradingProperties.Risk risk = base.risk();
		TradingProperties.Risk tooMuch = new TradingProperties.Risk(new BigDecimal("1.5"), risk.minNotional(),
				risk.maxNotional(), risk.takeProfitMode(), risk.takeProfitPercent(), risk.tpRatio(),
				risk.slBufferPct(), risk.stopLookbackCandles(), risk.maxDailyTrades(), risk.maxDailyLoss(),
				risk.maxConsecutiveLosses(), risk.emergencyStopLoss(), risk.minConfidence());
		TradingProperties properties = new TradingProperties(base.symbol(), base.interval(), base.quoteAsset(),
				base.autoTrade(), base.signal(), tooMuch, base.order(), base.protection(), base.connection(),
				base.engine(), base.retry());

		assertThat(properties.crossFieldErrors()).containsExactly("trader.risk.max-risk-fraction must be in (0, 1]");
	}
}
