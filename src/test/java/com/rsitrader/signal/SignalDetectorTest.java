package com.rsitrader.signal;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.rsitrader.support.TestProperties;

class SignalDetectorTest {

	private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

	@Test
	void latchedLongFiresWhenHeikinAshiTurnsAfterRsiRecovered() {
		SignalDetector detector = new SignalDetector(TestProperties.defaults());

		Optional<Signal> armed = detector.onSnapshot(snapshot(0, 20, 25, 28, Candle.BEARISH));
		assertThat(armed).isEmpty();
		assertThat(detector.status().pendingLong()).isTrue();

		Optional<Signal> signal = detector.onSnapshot(snapshot(1, 45, 40, 38, Candle.BULLISH));

		assertThat(signal).isPresent();
		assertThat(signal.get().direction()).isEqualTo(Direction.LONG);
		assertThat(signal.get().detectedAt()).isEqualTo(START);
		assertThat(signal.get().confirmedAt()).isEqualTo(START.plusSeconds(60));
		assertThat(signal.get().reasons()).containsExactly("RSI long", "HA confirmation");
		assertThat(detector.status().pendingLong()).isFalse();
		assertThat(detector.status().totalSignals()).isEqualTo(1);
	}

	@Test
	void reconfirmPolicyDropsLatchOnceRsiRecovers() {
		SignalDetector detector = new SignalDetector(TestProperties.builder()
				.latchPolicy(LatchPolicy.RECONFIRM)
				.build());

		detector.onSnapshot(snapshot(0, 20, 25, 28, Candle.BEARISH));
		Optional<Signal> signal = detector.onSnapshot(snapshot(1, 45, 40, 38, Candle.BULLISH));

		assertThat(signal).isEmpty();
		assertThat(detector.status().pendingLong()).isFalse();
	}

	@Test
	void oppositeTriggerReplacesPendingDirection() {
		SignalDetector detector = new SignalDetector(TestProperties.defaults());

		detector.onSnapshot(snapshot(0, 20, 25, 28, Candle.BEARISH));
		detector.onSnapshot(snapshot(1, 80, 75, 72, Candle.BULLISH));

		DetectorStatus status = detector.status();
		assertThat(status.pendingLong()).isFalse();
		assertThat(status.pendingShort()).isTrue();
		assertThat(status.shortSince()).isEqualTo(START.plusSeconds(60));

		Optional<Signal> signal = detector.onSnapshot(snapshot(2, 60, 62, 65, Candle.BEARISH));
		assertThat(signal).map(Signal::direction).contains(Direction.SHORT);
	}

	@Test
	void neverHoldsBothDirectionsPending() {
		SignalDetector detector = new SignalDetector(TestProperties.defaults());
		double[][] readings = {{20, 25, 28}, {80, 75, 72}, {10, 15, 20}, {90, 85, 80}, {25, 29, 29}};

		for (int i = 0; i < readings.length; i++) {
			// long triggers on even candles; each candle's shape rejects its own direction
			Candle shape = i % 2 == 0 ? Candle.BEARISH : Candle.BULLISH;
			detector.onSnapshot(snapshot(i, readings[i][0], readings[i][1], readings[i][2], shape));
			DetectorStatus status = detector.status();
			assertThat(status.pendingLong() && status.pendingShort()).isFalse();
		}
	}

	@Test
	void pendingLatchExpiresAfterConfiguredCandles() {
		SignalDetector detector = new SignalDetector(TestProperties.builder().maxPendingCandles(2).build());

		detector.onSnapshot(snapshot(0, 20, 25, 28, Candle.BEARISH));
		detector.onSnapshot(snapshot(1, 45, 40, 38, Candle.BEARISH));
		detector.onSnapshot(snapshot(2, 45, 40, 38, Candle.BEARISH));
		assertThat(detector.status().pendingLong()).isTrue();

		Optional<Signal> signal = detector.onSnapshot(snapshot(3, 45, 40, 38, Candle.BULLISH));

		assertThat(signal).isEmpty();
		assertThat(detector.status().pendingLong()).isFalse();
	}

	@Test
	void cooldownSuppressesArmingAfterSignal() {
		SignalDetector detector = new SignalDetector(TestProperties.builder()
				.cooldown(Duration.ofMinutes(2))
				.build());

		assertThat(detector.onSnapshot(snapshot(0, 20, 25, 28, Candle.BULLISH))).isPresent();
		assertThat(detector.onSnapshot(snapshot(1, 20, 25, 28, Candle.BULLISH))).isEmpty();
		assertThat(detector.status().pendingLong()).isFalse();

		assertThat(detector.onSnapshot(snapshot(2, 20, 25, 28, Candle.BULLISH))).isPresent();
	}

	@Test
	void replayedSnapshotIsIgnored() {
		SignalDetector detector = new SignalDetector(TestProperties.defaults());
		detector.onSnapshot(snapshot(1, 20, 25, 28, Candle.BEARISH));

		Optional<Signal> replay = detector.onSnapshot(snapshot(0, 20, 25, 28, Candle.BULLISH));

		assertThat(replay).isEmpty();
		assertThat(detector.status().pendingLong()).isTrue();
	}

	@Test
	void warmingIndicatorsDoNotArm() {
		SignalDetector detector = new SignalDetector(TestProperties.defaults());

		detector.onSnapshot(snapshot(0, Double.NaN, 25, 28, Candle.BULLISH));

		assertThat(detector.status().pendingLong()).isFalse();
	}

	@Test
	void confidenceReflectsEnabledGates() {
		SignalDetector noFilters = new SignalDetector(TestProperties.builder().filters(false, false, false).build());
		SignalDetector haOnly = new SignalDetector(TestProperties.defaults());

		Optional<Signal> plain = noFilters.onSnapshot(snapshot(0, 20, 25, 28, Candle.BEARISH));
		Optional<Signal> confirmed = haOnly.onSnapshot(snapshot(0, 20, 25, 28, Candle.BULLISH));

		assertThat(plain).map(Signal::confidence).contains(0.4);
		assertThat(confirmed).map(Signal::confidence).contains(1.0);
	}

	@Test
	void trendGateRequiresPriceAboveRisingEma() {
		SignalDetector detector = new SignalDetector(TestProperties.builder().filters(false, true, false).build());

		Optional<Signal> againstTrend = detector.onSnapshot(new IndicatorSnapshot(START, 100.0, 20, 25, 28,
				Double.NaN, Double.NaN, 105.0, -0.5, Double.NaN));
		Optional<Signal> withTrend = detector.onSnapshot(new IndicatorSnapshot(START.plusSeconds(60), 106.0, 25, 28,
				29, Double.NaN, Double.NaN, 105.0, 0.5, Double.NaN));

		assertThat(againstTrend).isEmpty();
		assertThat(withTrend).map(Signal::reasons).hasValueSatisfying(
				reasons -> assertThat(reasons).contains("Trend EMA"));
	}

	private IndicatorSnapshot snapshot(int minute, double fast, double mid, double slow, Candle shape) {
		return new IndicatorSnapshot(START.plusSeconds(60L * minute), 100.0, fast, mid, slow, shape.haOpen,
				shape.haClose, Double.NaN, Double.NaN, Double.NaN);
	}

	private enum Candle {
		BULLISH(100.0, 101.0),
		BEARISH(101.0, 100.0);

		private final double haOpen;
		private final double haClose;

		Candle(double haOpen, double haClose) {
			this.haOpen = haOpen;
			this.haClose = haClose;
		}
	}
}
