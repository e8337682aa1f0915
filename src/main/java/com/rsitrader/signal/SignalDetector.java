package com.rsitrader.signal;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rsitrader.config.TradingProperties;

/**
 * Two-stage entry detection. An oversold/overbought reading on all three RSIs arms a latch for that direction;
 * the latch fires a {@link Signal} once every enabled confirmation gate agrees. Only one direction can be armed at
 * a time.
 *
 * <p>The detector knows nothing about open positions. Callers stop feeding it while a trade is active.
 */
@Component
public class SignalDetector {

	private static final Logger LOGGER = LoggerFactory.getLogger(SignalDetector.class);
	private static final double RSI_WEIGHT = 0.4;
	private static final double HA_WEIGHT = 0.3;
	private static final double TREND_WEIGHT = 0.2;
	private static final double MTF_WEIGHT = 0.1;
	private static final double FILTER_RATIO_WEIGHT = 0.3;
	private static final double MTF_MIDLINE = 50.0;

	private final TradingProperties.Signal settings;

	private Latch longLatch;
	private Latch shortLatch;
	private Instant lastSignalAt;
	private Instant lastSnapshotAt;
	private LocalDate signalDay;
	private int signalsToday;
	private long totalSignals;

	public SignalDetector(TradingProperties tradingProperties) {
		this.settings = tradingProperties.signal();
	}

	public synchronized Optional<Signal> onSnapshot(IndicatorSnapshot snapshot) {
		if (snapshot == null || snapshot.closeTime() == null) {
			return Optional.empty();
		}
		Instant now = snapshot.closeTime();
		if (lastSnapshotAt != null && !now.isAfter(lastSnapshotAt)) {
			return Optional.empty();
		}
		lastSnapshotAt = now;
		if (inCooldown(now)) {
			return Optional.empty();
		}
		expireOrReconfirm(snapshot);
		armIfTriggered(snapshot, now);

		if (longLatch != null) {
			Optional<Signal> signal = confirm(Direction.LONG, longLatch, snapshot, now);
			if (signal.isPresent()) {
				longLatch = null;
				return record(signal.get());
			}
		}
		if (shortLatch != null) {
			Optional<Signal> signal = confirm(Direction.SHORT, shortLatch, snapshot, now);
			if (signal.isPresent()) {
				shortLatch = null;
				return record(signal.get());
			}
		}
		return Optional.empty();
	}

	public synchronized void resetPending() {
		longLatch = null;
		shortLatch = null;
		LOGGER.info("EVENT=SIGNAL_PENDING_RESET");
	}

	public synchronized DetectorStatus status() {
		return new DetectorStatus(
				longLatch != null,
				shortLatch != null,
				longLatch == null ? null : longLatch.armedAt(),
				shortLatch == null ? null : shortLatch.armedAt(),
				signalsToday,
				totalSignals,
				settings.latchPolicy());
	}

	private boolean inCooldown(Instant now) {
		Duration cooldown = settings.cooldown();
		return lastSignalAt != null && !cooldown.isZero() && now.isBefore(lastSignalAt.plus(cooldown));
	}

	private void expireOrReconfirm(IndicatorSnapshot snapshot) {
		if (longLatch != null) {
			longLatch = ageLatch(Direction.LONG, longLatch, snapshot);
		}
		if (shortLatch != null) {
			shortLatch = ageLatch(Direction.SHORT, shortLatch, snapshot);
		}
	}

	private Latch ageLatch(Direction direction, Latch latch, IndicatorSnapshot snapshot) {
		if (settings.latchPolicy() == LatchPolicy.RECONFIRM && !oscillatorHolds(direction, snapshot)) {
			LOGGER.info("EVENT=SIGNAL_LATCH_DROPPED direction={} reason=oscillator_released", direction);
			return null;
		}
		Latch aged = latch.age();
		if (settings.maxPendingCandles() > 0 && aged.candles() > settings.maxPendingCandles()) {
			LOGGER.info("EVENT=SIGNAL_LATCH_DROPPED direction={} reason=expired candles={}", direction,
					aged.candles());
			return null;
		}
		return aged;
	}

	private void armIfTriggered(IndicatorSnapshot snapshot, Instant now) {
		if (oscillatorHolds(Direction.LONG, snapshot)) {
			if (longLatch == null) {
				longLatch = new Latch(now, 0);
				LOGGER.info("EVENT=SIGNAL_ARMED direction=LONG at={} rsi={}/{}/{}", now, snapshot.rsiFast(),
						snapshot.rsiMid(), snapshot.rsiSlow());
			}
			if (shortLatch != null) {
				LOGGER.info("EVENT=SIGNAL_LATCH_DROPPED direction=SHORT reason=opposite_armed");
				shortLatch = null;
			}
		} else if (oscillatorHolds(Direction.SHORT, snapshot)) {
			if (shortLatch == null) {
				shortLatch = new Latch(now, 0);
				LOGGER.info("EVENT=SIGNAL_ARMED direction=SHORT at={} rsi={}/{}/{}", now, snapshot.rsiFast(),
						snapshot.rsiMid(), snapshot.rsiSlow());
			}
			if (longLatch != null) {
				LOGGER.info("EVENT=SIGNAL_LATCH_DROPPED direction=LONG reason=opposite_armed");
				longLatch = null;
			}
		}
	}

	boolean oscillatorHolds(Direction direction, IndicatorSnapshot snapshot) {
		double[] readings = {snapshot.rsiFast(), snapshot.rsiMid(), snapshot.rsiSlow()};
		for (double reading : readings) {
			if (Double.isNaN(reading)) {
				return false;
			}
			boolean holds = direction == Direction.LONG
					? reading < settings.oversold()
					: reading > settings.overbought();
			if (!holds) {
				return false;
			}
		}
		return true;
	}

	private Optional<Signal> confirm(Direction direction, Latch latch, IndicatorSnapshot snapshot, Instant now) {
		List<String> reasons = new ArrayList<>();
		reasons.add("RSI " + direction.name().toLowerCase());
		double confidence = RSI_WEIGHT;
		int enabled = 0;
		if (settings.haFilter()) {
			enabled++;
			if (!heikinAshiConfirms(direction, snapshot)) {
				return Optional.empty();
			}
			reasons.add("HA confirmation");
			confidence += HA_WEIGHT;
		}
		if (settings.trendFilter()) {
			enabled++;
			if (!trendConfirms(direction, snapshot)) {
				return Optional.empty();
			}
			reasons.add("Trend EMA");
			confidence += TREND_WEIGHT;
		}
		if (settings.mtfFilter()) {
			enabled++;
			if (!mtfConfirms(direction, snapshot)) {
				return Optional.empty();
			}
			reasons.add("RSI MTF");
			confidence += MTF_WEIGHT;
		}
		if (enabled > 0) {
			// every enabled gate passed to get here
			confidence = Math.min(confidence + FILTER_RATIO_WEIGHT, 1.0);
		}
		double rounded = Math.round(confidence * 100.0) / 100.0;
		return Optional.of(new Signal(direction, latch.armedAt(), now, snapshot, rounded, reasons));
	}

	private boolean heikinAshiConfirms(Direction direction, IndicatorSnapshot snapshot) {
		if (Double.isNaN(snapshot.haOpen()) || Double.isNaN(snapshot.haClose())) {
			return false;
		}
		return direction == Direction.LONG
				? snapshot.haClose() > snapshot.haOpen()
				: snapshot.haClose() < snapshot.haOpen();
	}

	private boolean trendConfirms(Direction direction, IndicatorSnapshot snapshot) {
		if (Double.isNaN(snapshot.close()) || Double.isNaN(snapshot.ema()) || Double.isNaN(snapshot.emaSlope())) {
			return false;
		}
		return direction == Direction.LONG
				? snapshot.close() > snapshot.ema() && snapshot.emaSlope() > 0
				: snapshot.close() < snapshot.ema() && snapshot.emaSlope() < 0;
	}

	private boolean mtfConfirms(Direction direction, IndicatorSnapshot snapshot) {
		if (Double.isNaN(snapshot.mtfRsi())) {
			return false;
		}
		return direction == Direction.LONG
				? snapshot.mtfRsi() > MTF_MIDLINE
				: snapshot.mtfRsi() < MTF_MIDLINE;
	}

	private Optional<Signal> record(Signal signal) {
		lastSignalAt = signal.confirmedAt();
		LocalDate day = signal.confirmedAt().atZone(ZoneOffset.UTC).toLocalDate();
		if (!day.equals(signalDay)) {
			signalDay = day;
			signalsToday = 0;
		}
		signalsToday++;
		totalSignals++;
		LOGGER.info("EVENT=SIGNAL_CONFIRMED direction={} detectedAt={} confirmedAt={} confidence={} reasons={}",
				signal.direction(), signal.detectedAt(), signal.confirmedAt(), signal.confidence(), signal.reasons());
		return Optional.of(signal);
	}

	private record Latch(Instant armedAt, int candles) {

		Latch age() {
			return new Latch(armedAt, candles + 1);
		}
	}
}
