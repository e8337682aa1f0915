package com.rsitrader.support;

import java.math.BigDecimal;
import java.time.Duration;

import com.rsitrader.config.TradingProperties;
import com.rsitrader.order.EntryType;
import com.rsitrader.risk.TakeProfitMode;
import com.rsitrader.signal.LatchPolicy;

/**
 * Trading configuration with short timings, adjustable per test.
 */
public final class TestProperties {

	private boolean autoTrade = true;
	private boolean haFilter = true;
	private boolean trendFilter;
	private boolean mtfFilter;
	private LatchPolicy latchPolicy = LatchPolicy.LATCHED;
	private int maxPendingCandles;
	private Duration cooldown = Duration.ZERO;
	private BigDecimal maxNotional = new BigDecimal("5000");
	private BigDecimal minNotional = new BigDecimal("10");
	private TakeProfitMode takeProfitMode = TakeProfitMode.RATIO;
	private int maxDailyTrades = 50;
	private int maxConsecutiveLosses = 5;
	private BigDecimal emergencyStopLoss = new BigDecimal("500");
	private double minConfidence = 0.6;
	private EntryType entryType = EntryType.MARKET;
	private boolean marketFallback = true;
	private BigDecimal maxSlippagePercent = new BigDecimal("0.03");
	private boolean deferred;
	private int maxAttempts;

	private TestProperties() {
	}

	public static TestProperties builder() {
		return new TestProperties();
	}

	public static TradingProperties defaults() {
		return builder().build();
	}

	public TestProperties autoTrade(boolean value) {
		this.autoTrade = value;
		return this;
	}

	public TestProperties filters(boolean ha, boolean trend, boolean mtf) {
		this.haFilter = ha;
		this.trendFilter = trend;
		this.mtfFilter = mtf;
		return this;
	}

	public TestProperties latchPolicy(LatchPolicy value) {
		this.latchPolicy = value;
		return this;
	}

	public TestProperties maxPendingCandles(int value) {
		this.maxPendingCandles = value;
		return this;
	}

	public TestProperties cooldown(Duration value) {
		this.cooldown = value;
		return this;
	}

	public TestProperties notionalBounds(String min, String max) {
		this.minNotional = new BigDecimal(min);
		this.maxNotional = new BigDecimal(max);
		return this;
	}

	public TestProperties takeProfitMode(TakeProfitMode value) {
		this.takeProfitMode = value;
		return this;
	}

	public TestProperties maxDailyTrades(int value) {
		this.maxDailyTrades = value;
		return this;
	}

	public TestProperties maxConsecutiveLosses(int value) {
		this.maxConsecutiveLosses = value;
		return this;
	}

	public TestProperties emergencyStopLoss(String value) {
		this.emergencyStopLoss = new BigDecimal(value);
		return this;
	}

	public TestProperties minConfidence(double value) {
		this.minConfidence = value;
		return this;
	}

	public TestProperties entryType(EntryType value) {
		this.entryType = value;
		return this;
	}

	public TestProperties marketFallback(boolean value) {
		this.marketFallback = value;
		return this;
	}

	public TestProperties maxSlippagePercent(String value) {
		this.maxSlippagePercent = new BigDecimal(value);
		return this;
	}

	public TestProperties deferred(boolean value) {
		this.deferred = value;
		return this;
	}

	public TestProperties maxReconnectAttempts(int value) {
		this.maxAttempts = value;
		return this;
	}

	public TradingProperties build() {
		TradingProperties.Signal signal = new TradingProperties.Signal(5, 14, 21, 30.0, 70.0, 14, "5m", 200, 5,
				haFilter, trendFilter, mtfFilter, latchPolicy, maxPendingCandles, cooldown, 300);
		TradingProperties.Risk risk = new TradingProperties.Risk(new BigDecimal("0.02"), minNotional, maxNotional,
				takeProfitMode, new BigDecimal("0.15"), new BigDecimal("1.2"), new BigDecimal("0.002"), 5,
				maxDailyTrades, new BigDecimal("100"), maxConsecutiveLosses, emergencyStopLoss, minConfidence);
		TradingProperties.Order order = new TradingProperties.Order(entryType, new BigDecimal("0.01"),
				Duration.ofSeconds(5), Duration.ofSeconds(1), marketFallback, maxSlippagePercent,
				Duration.ofSeconds(5), 3, Duration.ofMillis(10));
		TradingProperties.Protection protection = new TradingProperties.Protection(deferred, Duration.ofSeconds(10),
				Duration.ofSeconds(30), new BigDecimal("0.01"), new BigDecimal("0.05"), Duration.ofSeconds(2),
				Duration.ofHours(24));
		TradingProperties.Connection connection = new TradingProperties.Connection(Duration.ofSeconds(30),
				Duration.ofSeconds(300), maxAttempts, Duration.ofMillis(200), Duration.ofSeconds(300),
				Duration.ofSeconds(1));
		TradingProperties.Engine engine = new TradingProperties.Engine(true, Duration.ofSeconds(30), 1000L);
		TradingProperties.RetrySpec spec = new TradingProperties.RetrySpec(2, Duration.ofMillis(1),
				Duration.ofMillis(5), 0.0);
		TradingProperties.Retry retry = new TradingProperties.Retry(spec, spec, spec, spec, 5, Duration.ZERO);
		return new TradingProperties("BTCUSDC", "1m", "USDC", autoTrade, signal, risk, order, protection, connection,
				engine, retry);
	}
}
