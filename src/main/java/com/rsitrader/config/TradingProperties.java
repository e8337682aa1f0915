package com.rsitrader.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.rsitrader.order.EntryType;
import com.rsitrader.risk.TakeProfitMode;
import com.rsitrader.signal.LatchPolicy;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

@Validated
@ConfigurationProperties(prefix = "trader")
public record TradingProperties(
		@NotBlank String symbol,
		@NotBlank String interval,
		@NotBlank String quoteAsset,
		boolean autoTrade,
		@Valid @NotNull Signal signal,
		@Valid @NotNull Risk risk,
		@Valid @NotNull Order order,
		@Valid @NotNull Protection protection,
		@Valid @NotNull Connection connection,
		@Valid @NotNull Engine engine,
		@Valid @NotNull Retry retry) {

	public record Signal(
			@Positive int rsiFastPeriod,
			@Positive int rsiMidPeriod,
			@Positive int rsiSlowPeriod,
			@Positive double oversold,
			@Positive double overbought,
			@Positive int mtfRsiPeriod,
			@NotBlank String mtfInterval,
			@Positive int emaPeriod,
			@Positive int emaSlopeLookback,
			boolean haFilter,
			boolean trendFilter,
			boolean mtfFilter,
			@NotNull LatchPolicy latchPolicy,
			@PositiveOrZero int maxPendingCandles,
			@NotNull Duration cooldown,
			@Positive int warmupCandles) {
	}

	public record Risk(
			@NotNull @Positive BigDecimal maxRiskFraction,
			@NotNull @Positive BigDecimal minNotional,
			@NotNull @Positive BigDecimal maxNotional,
			@NotNull TakeProfitMode takeProfitMode,
			@NotNull @Positive BigDecimal takeProfitPercent,
			@NotNull @Positive BigDecimal tpRatio,
			@NotNull @PositiveOrZero BigDecimal slBufferPct,
			@Positive int stopLookbackCandles,
			@Positive int maxDailyTrades,
			@NotNull @Positive BigDecimal maxDailyLoss,
			@Positive int maxConsecutiveLosses,
			@NotNull @Positive BigDecimal emergencyStopLoss,
			@PositiveOrZero double minConfidence) {
	}

	public record Order(
			@NotNull EntryType entryType,
			@NotNull @PositiveOrZero BigDecimal limitOffsetPercent,
			@NotNull Duration fillTimeout,
			@NotNull Duration fillPollInterval,
			boolean marketFallback,
			@NotNull @PositiveOrZero BigDecimal maxSlippagePercent,
			@NotNull Duration monitorInterval,
			@Positive int closeAttempts,
			@NotNull Duration closeRetryDelay) {
	}

	public record Protection(
			boolean deferred,
			@NotNull Duration checkInterval,
			@NotNull Duration processingTimeout,
			@NotNull @PositiveOrZero BigDecimal priceOffsetPercent,
			@NotNull @PositiveOrZero BigDecimal minDistancePercent,
			@NotNull Duration deadlineGrace,
			@NotNull Duration retention) {
	}

	public record Connection(
			@NotNull Duration baseDelay,
			@NotNull Duration maxDelay,
			@PositiveOrZero int maxAttempts,
			@NotNull Duration connectWait,
			@NotNull Duration safeModeDuration,
			@NotNull Duration safeModeRecheckPause) {
	}

	public record Engine(
			boolean enabled,
			@NotNull Duration healthInterval,
			@Positive long maxLatencyMs) {
	}

	public record Retry(
			@Valid @NotNull RetrySpec defaults,
			@Valid @NotNull RetrySpec placement,
			@Valid @NotNull RetrySpec status,
			@Valid @NotNull RetrySpec cancel,
			@Positive int maxConcurrentRequests,
			@NotNull Duration minRequestSpacing) {
	}

	public record RetrySpec(
			@PositiveOrZero int maxRetries,
			@NotNull Duration delay,
			@NotNull Duration maxDelay,
			double jitter) {
	}

	/**
	 * Cross-field checks that bean validation cannot express. Returns the list of problems, empty when the
	 * configuration is usable.
	 */
	public List<String> crossFieldErrors() {
		List<String> errors = new ArrayList<>();
		if (risk.minNotional().compareTo(risk.maxNotional()) > 0) {
			errors.add("trader.risk.min-notional must not exceed trader.risk.max-notional");
		}
		if (risk.maxRiskFraction().compareTo(BigDecimal.ONE) > 0) {
			errors.add("trader.risk.max-risk-fraction must be in (0, 1]");
		}
		if (signal.oversold() >= signal.overbought()) {
			errors.add("trader.signal.oversold must be below trader.signal.overbought");
		}
		if (connection.baseDelay().compareTo(connection.maxDelay()) > 0) {
			errors.add("trader.connection.base-delay must not exceed trader.connection.max-delay");
		}
		if (order.fillPollInterval().compareTo(order.fillTimeout()) > 0) {
			errors.add("trader.order.fill-poll-interval must not exceed trader.order.fill-timeout");
		}
		return errors;
	}
}
