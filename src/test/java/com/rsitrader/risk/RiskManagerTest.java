package com.rsitrader.risk;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.rsitrader.common.FailureKind;
import com.rsitrader.common.OperationResult;
import com.rsitrader.config.TradingProperties;
import com.rsitrader.exchange.SymbolRules;
import com.rsitrader.signal.Direction;
import com.rsitrader.signal.IndicatorSnapshot;
import com.rsitrader.signal.Signal;
import com.rsitrader.support.MutableClock;
import com.rsitrader.support.TestProperties;

class RiskManagerTest {

	private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
	private static final SymbolRules RULES = new SymbolRules("BTCUSDC", new BigDecimal("0.1"),
			new BigDecimal("0.001"), new BigDecimal("0.001"), new BigDecimal("5"));

	private final MutableClock clock = new MutableClock(NOW);
	private final EmergencySwitch emergencySwitch = new EmergencySwitch(clock);

	@Test
	void sizesLongByRiskBudgetAndRatioTarget() {
		RiskManager riskManager = riskManager(TestProperties.defaults());

		OperationResult<PositionSize> result = riskManager.size(signal(Direction.LONG, 0.8),
				new BigDecimal("1000"), new BigDecimal("99"));

		assertThat(result.isSuccess()).isTrue();
		PositionSize size = result.value();
		assertThat(size.quantity()).isEqualByComparingTo("20");
		assertThat(size.takeProfit()).isEqualByComparingTo("101.2");
		assertThat(size.riskAmount()).isEqualByComparingTo("20");
		assertThat(size.notional()).isEqualByComparingTo("2000");
	}

	@Test
	void sizesShortWithPercentTarget() {
		RiskManager riskManager = riskManager(TestProperties.builder()
				.takeProfitMode(TakeProfitMode.FIXED_PERCENT)
				.build());

		OperationResult<PositionSize> result = riskManager.size(signal(Direction.SHORT, 0.8),
				new BigDecimal("1000"), new BigDecimal("102"));

		assertThat(result.value().quantity()).isEqualByComparingTo("10");
		// 0.15% of 100 is 99.85, rounded half up to the tick
		assertThat(result.value().takeProfit()).isEqualByComparingTo("99.9");
	}

	@Test
	void clampsToMaxNotional() {
		RiskManager riskManager = riskManager(TestProperties.builder().notionalBounds("10", "1000").build());

		OperationResult<PositionSize> result = riskManager.size(signal(Direction.LONG, 0.8),
				new BigDecimal("1000"), new BigDecimal("99"));

		assertThat(result.value().quantity()).isEqualByComparingTo("10");
		assertThat(result.value().notional()).isEqualByComparingTo("1000");
	}

	@Test
	void refusesBelowMinimumNotional() {
		RiskManager riskManager = riskManager(TestProperties.defaults());

		OperationResult<PositionSize> result = riskManager.size(signal(Direction.LONG, 0.8), new BigDecimal("1"),
				new BigDecimal("99"));

		assertThat(result.isSuccess()).isFalse();
		assertThat(result.failureKind()).isEqualTo(FailureKind.VALIDATION);
		assertThat(result.reason()).contains("below minimum");
	}

	@Test
	void refusesLowConfidenceAndStopOnWrongSide() {
		RiskManager riskManager = riskManager(TestProperties.defaults());

		OperationResult<PositionSize> weak = riskManager.size(signal(Direction.LONG, 0.4), new BigDecimal("1000"),
				new BigDecimal("99"));
		OperationResult<PositionSize> wrongSide = riskManager.size(signal(Direction.LONG, 0.8),
				new BigDecimal("1000"), new BigDecimal("101"));
		OperationResult<PositionSize> noBalance = riskManager.size(signal(Direction.LONG, 0.8), BigDecimal.ZERO,
				new BigDecimal("99"));

		assertThat(weak.failureKind()).isEqualTo(FailureKind.VALIDATION);
		assertThat(wrongSide.failureKind()).isEqualTo(FailureKind.VALIDATION);
		assertThat(noBalance.failureKind()).isEqualTo(FailureKind.VALIDATION);
	}

	@Test
	void emergencyStopRefusesAsSystemic() {
		RiskManager riskManager = riskManager(TestProperties.defaults());
		emergencySwitch.trip("test");

		OperationResult<PositionSize> result = riskManager.size(signal(Direction.LONG, 0.8),
				new BigDecimal("1000"), new BigDecimal("99"));

		assertThat(result.failureKind()).isEqualTo(FailureKind.SYSTEMIC);
		assertThat(result.reason()).contains("emergency stop");
	}

	@Test
	void consecutiveLossesHaltTradingAndWinResetsStreak() {
		RiskManager riskManager = riskManager(TestProperties.builder().maxConsecutiveLosses(2).build());

		riskManager.recordOutcome(Direction.LONG, new BigDecimal("100"), BigDecimal.ONE, TradeResult.LOSS,
				new BigDecimal("-1"));
		riskManager.recordOutcome(Direction.LONG, new BigDecimal("100"), BigDecimal.ONE, TradeResult.WIN,
				new BigDecimal("2"));
		riskManager.recordOutcome(Direction.LONG, new BigDecimal("100"), BigDecimal.ONE, TradeResult.LOSS,
				new BigDecimal("-1"));
		assertThat(riskManager.tradingHaltReason()).isEmpty();

		riskManager.recordOutcome(Direction.SHORT, new BigDecimal("100"), BigDecimal.ONE, TradeResult.LOSS,
				new BigDecimal("-1"));

		assertThat(riskManager.tradingHaltReason()).hasValueSatisfying(
				reason -> assertThat(reason).contains("consecutive loss"));
		assertThat(emergencySwitch.isTripped()).isFalse();
	}

	@Test
	void dailyTradeLimitResetsOnNextUtcDay() {
		RiskManager riskManager = riskManager(TestProperties.builder().maxDailyTrades(1).build());
		riskManager.recordOutcome(Direction.LONG, new BigDecimal("100"), BigDecimal.ONE, TradeResult.WIN,
				new BigDecimal("1"));
		assertThat(riskManager.tradingHaltReason()).isPresent();

		clock.advance(Duration.ofDays(1));

		assertThat(riskManager.tradingHaltReason()).isEmpty();
		assertThat(riskManager.metrics().dailyTradeCount()).isZero();
		assertThat(riskManager.metrics().wins()).isEqualTo(1);
	}

	@Test
	void cumulativeLossCeilingTripsEmergencyStop() {
		RiskManager riskManager = riskManager(TestProperties.builder().emergencyStopLoss("50").build());
		riskManager.updateBalance(new BigDecimal("1000"));

		riskManager.recordOutcome(Direction.LONG, new BigDecimal("100"), BigDecimal.TEN, TradeResult.LOSS,
				new BigDecimal("-60"));

		assertThat(emergencySwitch.isTripped()).isTrue();
		assertThat(emergencySwitch.reason()).hasValueSatisfying(reason -> assertThat(reason).startsWith("RISK_CEILING"));
		RiskMetrics metrics = riskManager.metrics();
		assertThat(metrics.balance()).isEqualByComparingTo("940");
		assertThat(metrics.maxDrawdown()).isEqualByComparingTo("60");
		assertThat(metrics.emergencyStop()).isTrue();
	}

	@Test
	void dailyResetIsRefusedWhileEmergencyActive() {
		RiskManager riskManager = riskManager(TestProperties.defaults());
		emergencySwitch.trip("test");

		assertThat(riskManager.resetDailyLimits()).isFalse();
		assertThat(riskManager.overrideEmergencyStop("ops")).isTrue();
		assertThat(riskManager.resetDailyLimits()).isTrue();
		assertThat(riskManager.overrideEmergencyStop("ops")).isFalse();
	}

	@Test
	void simulatesLossImpactWithoutChangingState() {
		RiskManager riskManager = riskManager(TestProperties.builder().emergencyStopLoss("15").build());
		riskManager.updateBalance(new BigDecimal("1000"));
		PositionSize size = riskManager.size(signal(Direction.LONG, 0.8), new BigDecimal("1000"),
				new BigDecimal("99")).value();

		TradeImpact impact = riskManager.simulateImpact(size, TradeResult.LOSS);

		assertThat(impact.newBalance()).isEqualByComparingTo("980");
		assertThat(impact.newConsecutiveLosses()).isEqualTo(1);
		assertThat(impact.wouldTriggerEmergency()).isTrue();
		assertThat(impact.wouldHitDailyLimit()).isFalse();
		assertThat(riskManager.metrics().balance()).isEqualByComparingTo("1000");
	}

	private RiskManager riskManager(TradingProperties properties) {
		RiskManager riskManager = new RiskManager(properties, emergencySwitch, clock);
		riskManager.applySymbolRules(RULES);
		return riskManager;
	}

	private Signal signal(Direction direction, double confidence) {
		IndicatorSnapshot snapshot = new IndicatorSnapshot(NOW, 100.0, 20, 25, 28, 100.0, 101.0, Double.NaN,
				Double.NaN, Double.NaN);
		return new Signal(direction, NOW, NOW, snapshot, confidence, List.of("RSI " + direction));
	}
}
