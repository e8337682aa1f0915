package com.rsitrader.engine;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.rsitrader.common.FailureKind;
import com.rsitrader.common.OperationResult;
import com.rsitrader.config.TradingProperties;
import com.rsitrader.exchange.ExchangeException;
import com.rsitrader.exchange.ExchangeGateway;
import com.rsitrader.exchange.SymbolRules;
import com.rsitrader.feed.CandleSink;
import com.rsitrader.feed.ConnectionState;
import com.rsitrader.feed.ConnectionStatus;
import com.rsitrader.feed.ConnectionSupervisor;
import com.rsitrader.market.Candle;
import com.rsitrader.notify.NotificationLevel;
import com.rsitrader.notify.Notifier;
import com.rsitrader.order.DeferredProtectionCoordinator;
import com.rsitrader.order.ExitReason;
import com.rsitrader.order.OrderManager;
import com.rsitrader.order.Trade;
import com.rsitrader.risk.EmergencySwitch;
import com.rsitrader.risk.PositionSize;
import com.rsitrader.risk.RiskManager;
import com.rsitrader.risk.RiskMetrics;
import com.rsitrader.risk.StopLossCalculator;
import com.rsitrader.signal.IndicatorCalculator;
import com.rsitrader.signal.IndicatorSnapshot;
import com.rsitrader.signal.Signal;
import com.rsitrader.signal.SignalDetector;

import jakarta.annotation.PreDestroy;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires the feed, signal, risk and order components together. Closed candles are processed one at a time on a
 * dedicated worker; every refused or failed signal produces its own notification.
 */
@Component
public class TradingEngine implements CandleSink {

	private static final Logger LOGGER = LoggerFactory.getLogger(TradingEngine.class);
	private static final int RECENT_CANDLES = 100;

	private final TradingProperties tradingProperties;
	private final ExchangeGateway gateway;
	private final IndicatorCalculator indicators;
	private final SignalDetector detector;
	private final RiskManager riskManager;
	private final StopLossCalculator stopLossCalculator;
	private final OrderManager orderManager;
	private final DeferredProtectionCoordinator coordinator;
	private final ConnectionSupervisor supervisor;
	private final EmergencySwitch emergencySwitch;
	private final Notifier notifier;
	private final List<SignalSink> signalSinks;
	private final Clock clock;
	private final Scheduler worker = Schedulers.newBoundedElastic(1, 1000, "engine-worker");
	private final AtomicBoolean running = new AtomicBoolean(false);
	private final Deque<Candle> recentCandles = new ArrayDeque<>();
	private volatile long lastLatencyMs = -1L;
	private volatile SymbolRules symbolRules;

	public TradingEngine(TradingProperties tradingProperties, ExchangeGateway gateway, IndicatorCalculator indicators,
			SignalDetector detector, RiskManager riskManager, StopLossCalculator stopLossCalculator,
			OrderManager orderManager, DeferredProtectionCoordinator coordinator, ConnectionSupervisor supervisor,
			EmergencySwitch emergencySwitch, Notifier notifier, List<SignalSink> signalSinks, Clock clock) {
		this.tradingProperties = tradingProperties;
		this.gateway = gateway;
		this.indicators = indicators;
		this.detector = detector;
		this.riskManager = riskManager;
		this.stopLossCalculator = stopLossCalculator;
		this.orderManager = orderManager;
		this.coordinator = coordinator;
		this.supervisor = supervisor;
		this.emergencySwitch = emergencySwitch;
		this.notifier = notifier;
		this.signalSinks = List.copyOf(signalSinks);
		this.clock = clock;
		emergencySwitch.addListener(this::onEmergencyTripped);
	}

	public void start() {
		List<String> errors = tradingProperties.crossFieldErrors();
		if (!errors.isEmpty()) {
			throw new IllegalStateException("Invalid trader configuration: " + String.join("; ", errors));
		}
		if (!tradingProperties.engine().enabled()) {
			LOGGER.info("EVENT=ENGINE_DISABLED");
			return;
		}
		if (!running.compareAndSet(false, true)) {
			return;
		}
		String symbol = tradingProperties.symbol();
		SymbolRules rules = gateway.fetchSymbolRules(symbol);
		this.symbolRules = rules;
		riskManager.applySymbolRules(rules);
		orderManager.applySymbolRules(rules);
		riskManager.updateBalance(gateway.fetchAvailableBalance());
		warmUp();
		orderManager.start();
		coordinator.start();
		supervisor.start(this);
		LOGGER.info("EVENT=ENGINE_STARTED symbol={} interval={} autoTrade={} tickSize={} stepSize={}", symbol,
				tradingProperties.interval(), tradingProperties.autoTrade(), rules.tickSize(), rules.stepSize());
		notifier.notify(NotificationLevel.INFO, "ENGINE_STARTED", symbol + " " + tradingProperties.interval()
				+ (tradingProperties.autoTrade() ? "" : " (monitor only)"));
	}

	@PreDestroy
	public void stop() {
		if (!running.compareAndSet(true, false)) {
			worker.dispose();
			return;
		}
		supervisor.stop();
		coordinator.stop();
		orderManager.stop();
		worker.dispose();
		LOGGER.info("EVENT=ENGINE_STOPPED");
	}

	void warmUp() {
		int limit = tradingProperties.signal().warmupCandles();
		List<Candle> history = gateway.fetchRecentCandles(tradingProperties.symbol(), tradingProperties.interval(),
				limit);
		indicators.reset();
		long now = clock.millis();
		int used = 0;
		for (Candle candle : history) {
			// the newest kline from REST is usually still open
			if (candle.closeTime() >= now) {
				continue;
			}
			indicators.update(candle);
			remember(candle);
			used++;
		}
		LOGGER.info("EVENT=WARMUP_DONE requested={} used={}", limit, used);
	}

	/**
	 * Hands the candle to the engine worker so that stream threads never block on exchange calls.
	 */
	@Override
	public void onCandleClosed(Candle candle) {
		if (!running.get()) {
			return;
		}
		worker.schedule(() -> {
			try {
				processCandle(candle);
			} catch (RuntimeException ex) {
				LOGGER.error("EVENT=CANDLE_PROCESSING_FAILED closeTime={} reason={}", candle.closeTime(),
						ex.getMessage(), ex);
			}
		});
	}

	public Optional<OperationResult<Trade>> processCandle(Candle candle) {
		IndicatorSnapshot snapshot = indicators.update(candle);
		remember(candle);
		if (orderManager.hasActiveTrade()) {
			return Optional.empty();
		}
		Optional<Signal> signal = detector.onSnapshot(snapshot);
		if (signal.isEmpty()) {
			return Optional.empty();
		}
		for (SignalSink sink : signalSinks) {
			try {
				sink.onSignal(signal.get());
			} catch (RuntimeException ex) {
				LOGGER.error("EVENT=SIGNAL_SINK_FAILED sink={} reason={}", sink.getClass().getSimpleName(),
						ex.getMessage(), ex);
			}
		}
		return Optional.of(executeSignal(signal.get()));
	}

	public OperationResult<Trade> executeSignal(Signal signal) {
		if (emergencySwitch.isTripped()) {
			return refuse("SIGNAL_REFUSED_EMERGENCY", NotificationLevel.WARNING, FailureKind.SYSTEMIC, signal,
					"emergency stop active: " + emergencySwitch.reason().orElse("unknown"));
		}
		if (!tradingProperties.autoTrade()) {
			return refuse("SIGNAL_MONITOR_ONLY", NotificationLevel.INFO, FailureKind.VALIDATION, signal,
					"auto trading disabled");
		}
		Optional<String> feedBlocker = supervisor.newTradeBlocker();
		if (feedBlocker.isPresent()) {
			return refuse("SIGNAL_REFUSED_FEED", NotificationLevel.WARNING, FailureKind.TRANSIENT, signal,
					feedBlocker.get());
		}
		if (orderManager.hasActiveTrade()) {
			return refuse("SIGNAL_REFUSED_ACTIVE_TRADE", NotificationLevel.INFO, FailureKind.VALIDATION, signal,
					"a trade is already active");
		}
		Optional<BigDecimal> stop = stopLossCalculator.stopFor(signal.direction(), recentCandles(),
				symbolRules);
		if (stop.isEmpty()) {
			return refuse("SIGNAL_REFUSED_NO_STOP", NotificationLevel.WARNING, FailureKind.VALIDATION, signal,
					"no candles to derive a stop from");
		}
		BigDecimal balance;
		try {
			balance = gateway.fetchAvailableBalance();
		} catch (ExchangeException ex) {
			return refuse("SIGNAL_REFUSED_BALANCE_UNAVAILABLE", NotificationLevel.WARNING, ex.kind(), signal,
					ex.getMessage());
		}
		riskManager.updateBalance(balance);
		OperationResult<PositionSize> size = riskManager.size(signal, balance, stop.get());
		if (!size.isSuccess()) {
			return refuse("SIGNAL_REFUSED_RISK", NotificationLevel.WARNING, size.failureKind(), signal,
					size.reason());
		}
		OperationResult<Trade> opened = orderManager.openTrade(signal, size.value());
		if (!opened.isSuccess()) {
			NotificationLevel level = opened.failureKind() == FailureKind.SYSTEMIC
					? NotificationLevel.CRITICAL
					: NotificationLevel.WARNING;
			notifier.notify(level, "TRADE_OPEN_FAILED", signal.direction() + " " + opened.reason());
		}
		return opened;
	}

	private OperationResult<Trade> refuse(String event, NotificationLevel level, FailureKind kind, Signal signal,
			String reason) {
		LOGGER.info("EVENT={} direction={} reason={}", event, signal.direction(), reason);
		notifier.notify(level, event, signal.direction() + " " + reason);
		return OperationResult.failure(kind, reason);
	}

	/**
	 * Periodic check of balance, latency, emergency state and feed health.
	 */
	@Scheduled(fixedDelayString = "${trader.engine.health-interval:PT30S}")
	public void healthCheck() {
		if (!running.get()) {
			return;
		}
		riskManager.tradingHaltReason().ifPresent(reason -> LOGGER.info("EVENT=TRADING_HALTED reason={}", reason));
		try {
			riskManager.updateBalance(gateway.fetchAvailableBalance());
		} catch (ExchangeException ex) {
			LOGGER.warn("EVENT=HEALTH_BALANCE_FAILED reason={}", ex.getMessage());
		}
		try {
			lastLatencyMs = gateway.measureLatency();
			if (lastLatencyMs > tradingProperties.engine().maxLatencyMs()) {
				notifier.notify(NotificationLevel.WARNING, "HIGH_LATENCY", lastLatencyMs + "ms exceeds "
						+ tradingProperties.engine().maxLatencyMs() + "ms");
			}
		} catch (ExchangeException ex) {
			LOGGER.warn("EVENT=HEALTH_LATENCY_FAILED reason={}", ex.getMessage());
		}
		if (emergencySwitch.isTripped() && orderManager.hasActiveTrade()) {
			LOGGER.warn("EVENT=HEALTH_EMERGENCY_CLOSE_RETRY");
			orderManager.closeAllTrades(ExitReason.EMERGENCY);
		}
		if (supervisor.state() == ConnectionState.DISCONNECTED && !emergencySwitch.isTripped()) {
			notifier.notify(NotificationLevel.WARNING, "FEED_DOWN", "feed disconnected, forcing reconnect");
			supervisor.forceReconnect();
		}
		HealthSnapshot health = healthSnapshot();
		LOGGER.info("EVENT=HEALTH balance={} activeTrades={} feed={} latencyMs={} emergency={} blocked={}",
				health.balance(), health.activeTrades(), health.feedState(), health.latencyMs(),
				health.emergencyStop(), health.tradingBlocked());
	}

	/**
	 * Trips the one-way emergency stop and closes every open trade. New trades stay refused until
	 * {@link #manualOverrideEmergency(String)}.
	 */
	public void emergencyStop(String reason) {
		emergencySwitch.trip(reason);
		handleEmergency(reason);
	}

	private void onEmergencyTripped(String reason) {
		if (worker.isDisposed()) {
			return;
		}
		worker.schedule(() -> {
			try {
				handleEmergency(reason);
			} catch (RuntimeException ex) {
				LOGGER.error("EVENT=EMERGENCY_HANDLING_FAILED reason={}", ex.getMessage(), ex);
			}
		});
	}

	private void handleEmergency(String reason) {
		detector.resetPending();
		if (!orderManager.hasActiveTrade()) {
			return;
		}
		notifier.notify(NotificationLevel.CRITICAL, "EMERGENCY_STOP", reason);
		int closed = orderManager.closeAllTrades(ExitReason.EMERGENCY);
		LOGGER.error("EVENT=EMERGENCY_STOP reason={} closedTrades={}", reason, closed);
	}

	public boolean manualOverrideEmergency(String operator) {
		boolean cleared = riskManager.overrideEmergencyStop(operator);
		if (cleared) {
			notifier.notify(NotificationLevel.WARNING, "EMERGENCY_OVERRIDE", "cleared by " + operator);
		}
		return cleared;
	}

	public OperationResult<Trade> manualCloseTrade(String tradeId) {
		OperationResult<Trade> result = orderManager.closeTrade(tradeId, ExitReason.MANUAL);
		if (!result.isSuccess()) {
			notifier.notify(NotificationLevel.WARNING, "MANUAL_CLOSE_FAILED", tradeId + " " + result.reason());
		}
		return result;
	}

	public HealthSnapshot healthSnapshot() {
		RiskMetrics metrics = riskManager.metrics();
		Optional<Trade> active = orderManager.activeTrade();
		ConnectionStatus connection = supervisor.status();
		return new HealthSnapshot(
				clock.instant(),
				running.get(),
				tradingProperties.autoTrade(),
				metrics.balance(),
				active.isPresent() ? 1 : 0,
				active.map(Trade::id).orElse(null),
				connection.state(),
				connection.connected(),
				lastLatencyMs,
				emergencySwitch.isTripped(),
				emergencySwitch.reason().orElse(null),
				connection.state() == ConnectionState.SAFE_MODE,
				connection.tradingBlocked(),
				coordinator.status().size(),
				metrics,
				detector.status());
	}

	public boolean isRunning() {
		return running.get();
	}

	private void remember(Candle candle) {
		synchronized (recentCandles) {
			recentCandles.addLast(candle);
			while (recentCandles.size() > RECENT_CANDLES) {
				recentCandles.removeFirst();
			}
		}
	}

	private List<Candle> recentCandles() {
		synchronized (recentCandles) {
			return new ArrayList<>(recentCandles);
		}
	}
}
