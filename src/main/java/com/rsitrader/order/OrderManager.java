package com.rsitrader.order;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rsitrader.common.OperationResult;
import com.rsitrader.common.Sleeper;
import com.rsitrader.config.TradingProperties;
import com.rsitrader.exchange.ExchangeException;
import com.rsitrader.exchange.ExchangeGateway;
import com.rsitrader.exchange.OrderSnapshot;
import com.rsitrader.exchange.SymbolRules;
import com.rsitrader.market.CandleIntervals;
import com.rsitrader.order.EntryOrderExecutor.EntryFill;
import com.rsitrader.order.OrderWatcher.ProtectionState;
import com.rsitrader.order.ProtectionPlacer.ProtectionPair;
import com.rsitrader.risk.PositionSize;
import com.rsitrader.signal.Direction;
import com.rsitrader.signal.Signal;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Drives a trade through OPENING, OPEN, CLOSING and CLOSED (or FAILED). Every exit path starts with the
 * OPEN to CLOSING compare-and-set on the registry, so only one of them ever finishes a trade.
 */
@Component
public class OrderManager {

	private static final Logger LOGGER = LoggerFactory.getLogger(OrderManager.class);
	private static final MathContext MC = MathContext.DECIMAL64;

	private final ExchangeGateway gateway;
	private final TradeRegistry registry;
	private final OrderWatcher watcher;
	private final EntryOrderExecutor entryExecutor;
	private final ProtectionPlacer placer;
	private final DeferredProtectionCoordinator coordinator;
	private final PositionFlattener flattener;
	private final List<TradeLifecycleSink> sinks;
	private final TradingProperties tradingProperties;
	private final Clock clock;
	private final Sleeper sleeper;
	private final Map<String, ExitReason> closeReasons = new ConcurrentHashMap<>();
	private final Set<String> closesInFlight = ConcurrentHashMap.newKeySet();
	private final AtomicLong sequence = new AtomicLong();
	private final AtomicReference<Disposable> monitor = new AtomicReference<>();
	private final Scheduler scheduler = Schedulers.newBoundedElastic(2, 100, "order-monitor");
	private volatile SymbolRules symbolRules;

	public OrderManager(ExchangeGateway gateway, TradeRegistry registry, OrderWatcher watcher,
			EntryOrderExecutor entryExecutor, ProtectionPlacer placer, DeferredProtectionCoordinator coordinator,
			PositionFlattener flattener, List<TradeLifecycleSink> sinks, TradingProperties tradingProperties,
			Clock clock, Sleeper sleeper) {
		this.gateway = gateway;
		this.registry = registry;
		this.watcher = watcher;
		this.entryExecutor = entryExecutor;
		this.placer = placer;
		this.coordinator = coordinator;
		this.flattener = flattener;
		this.sinks = List.copyOf(sinks);
		this.tradingProperties = tradingProperties;
		this.clock = clock;
		this.sleeper = sleeper;
	}

	public void applySymbolRules(SymbolRules rules) {
		this.symbolRules = rules;
		coordinator.applySymbolRules(rules);
	}

	public void start() {
		Duration interval = tradingProperties.order().monitorInterval();
		Disposable loop = Flux.interval(interval, scheduler)
				.onBackpressureDrop()
				.subscribe(tick -> runMonitor(), error -> LOGGER.error("EVENT=ORDER_MONITOR_ERROR reason={}",
						error.getMessage(), error));
		Disposable previous = monitor.getAndSet(loop);
		if (previous != null) {
			previous.dispose();
		}
		LOGGER.info("EVENT=ORDER_MONITOR_STARTED interval={}", interval);
	}

	@PreDestroy
	public void stop() {
		Disposable loop = monitor.getAndSet(null);
		if (loop != null) {
			loop.dispose();
		}
		scheduler.dispose();
	}

	private void runMonitor() {
		try {
			monitorOnce();
		} catch (RuntimeException ex) {
			LOGGER.error("EVENT=ORDER_MONITOR_FAILED reason={}", ex.getMessage(), ex);
		}
	}

	public OperationResult<Trade> openTrade(Signal signal, PositionSize size) {
		Direction direction = signal.direction();
		if (!levelsOrdered(direction, size.entryPriceEstimate(), size.stopLoss(), size.takeProfit())) {
			LOGGER.warn("EVENT=TRADE_REJECTED reason=invalid_levels direction={} entry={} stop={} target={}",
					direction, size.entryPriceEstimate(), size.stopLoss(), size.takeProfit());
			return OperationResult.validation("stop " + size.stopLoss() + " / target " + size.takeProfit()
					+ " are not on the correct sides of " + size.entryPriceEstimate());
		}
		String symbol = tradingProperties.symbol();
		Trade opening = Trade.opening(nextTradeId(symbol), symbol, direction, size.quantity(),
				size.entryPriceEstimate(), size.stopLoss(), size.takeProfit(), clock.instant());
		if (!registry.tryBegin(opening)) {
			LOGGER.warn("EVENT=TRADE_REJECTED reason=active_trade direction={}", direction);
			return OperationResult.validation("another trade is still active");
		}
		LOGGER.info("EVENT=TRADE_OPENING tradeId={} direction={} qty={} entry={} stop={} target={}", opening.id(),
				direction, size.quantity(), size.entryPriceEstimate(), size.stopLoss(), size.takeProfit());
		AtomicReference<EntryFill> filled = new AtomicReference<>();
		try {
			return completeOpen(opening, size, filled);
		} catch (RuntimeException ex) {
			LOGGER.error("EVENT=TRADE_OPEN_CRASHED tradeId={} reason={}", opening.id(), ex.getMessage(), ex);
			EntryFill fill = filled.get();
			if (fill != null) {
				unwindCrashedOpen(opening, fill);
			}
			markFailed(opening.id(), "unexpected error: " + ex.getMessage());
			return OperationResult.systemic("unexpected error while opening: " + ex.getMessage());
		}
	}

	/**
	 * A crash after the entry filled leaves a live position; whatever protection was placed is cancelled and the
	 * filled quantity is exited.
	 */
	private void unwindCrashedOpen(Trade opening, EntryFill fill) {
		registry.find(opening.id()).ifPresent(this::cancelProtection);
		coordinator.release(opening.id());
		watcher.untrack(opening.id());
		try {
			flattener.exit(opening.symbol(), opening.direction(), fill.quantity(), "open crashed after fill");
		} catch (ExchangeException ex) {
			LOGGER.error("EVENT=TRADE_FLATTEN_AFTER_CRASH_FAILED tradeId={} reason={}", opening.id(),
					ex.getMessage());
		}
	}

	private OperationResult<Trade> completeOpen(Trade opening, PositionSize size,
			AtomicReference<EntryFill> filled) {
		String id = opening.id();
		Direction direction = opening.direction();
		OperationResult<EntryFill> entry = entryExecutor.execute(opening.symbol(), direction, size.quantity(),
				symbolRules);
		if (!entry.isSuccess()) {
			markFailed(id, entry.reason());
			return entry.propagate();
		}
		EntryFill fill = entry.value();
		filled.set(fill);
		BigDecimal stop = rebase(direction, fill.price(), size.stopDistance(), false);
		BigDecimal target = rebase(direction, fill.price(), size.targetDistance(), true);
		boolean deferred = tradingProperties.protection().deferred();
		Instant now = clock.instant();
		Trade open = registry.update(id, trade -> trade.opened(fill.order(), fill.quantity(), fill.price(), stop,
				target, fill.degraded(), deferred, now))
				.orElseThrow(() -> new IllegalStateException("trade " + id + " left the registry before its fill"));
		LOGGER.info("EVENT=TRADE_OPENED tradeId={} direction={} qty={} fillPrice={} stop={} target={} degraded={} "
				+ "deferred={}", id, direction, fill.quantity(), fill.price(), stop, target, fill.degraded(), deferred);

		if (deferred) {
			Duration interval = CandleIntervals.toDuration(tradingProperties.interval());
			Instant deadline = CandleIntervals.currentCandleClose(now, interval)
					.plus(tradingProperties.protection().deadlineGrace());
			coordinator.schedule(open, deadline, this::attachProtection);
		} else {
			OperationResult<ProtectionPair> protection = placer.place(id, open.symbol(), direction, fill.quantity(),
					stop, target);
			if (!protection.isSuccess()) {
				LOGGER.error("EVENT=TRADE_UNPROTECTED tradeId={} reason={} action=flatten", id, protection.reason());
				try {
					flattener.exit(open.symbol(), direction, fill.quantity(), "protection placement failed");
				} catch (ExchangeException ex) {
					LOGGER.error("EVENT=TRADE_FLATTEN_AFTER_PROTECTION_FAILED tradeId={} reason={}", id,
							ex.getMessage());
				}
				Trade failed = markFailed(id, "protection placement failed: " + protection.reason());
				if (failed != null) {
					notifyClosed(failed);
				}
				return protection.propagate();
			}
			attachProtection(id, protection.value(), stop, target);
			open = registry.find(id).orElse(open);
		}
		notifyOpened(open);
		return OperationResult.success(open);
	}

	/**
	 * Records a placed protection pair on the trade. A pair that arrives after the trade left OPEN is cancelled.
	 */
	void attachProtection(String tradeId, ProtectionPair pair, BigDecimal stop, BigDecimal target) {
		AtomicBoolean attached = new AtomicBoolean(false);
		registry.update(tradeId, trade -> {
			if (trade.status() != TradeStatus.OPEN) {
				return trade;
			}
			attached.set(true);
			return trade.withProtection(pair.stopOrder(), pair.targetOrder(), stop, target);
		});
		if (!attached.get()) {
			LOGGER.warn("EVENT=PROTECTION_ORPHANED tradeId={} action=cancel", tradeId);
			placer.cancel(tradeId, tradingProperties.symbol(), pair);
			return;
		}
		watcher.track(tradeId, pair.stopOrder().exchangeOrderId(), pair.targetOrder().exchangeOrderId());
	}

	/**
	 * One pass of the position monitor: retries stuck closes and reacts to protection orders leaving the book.
	 */
	public void monitorOnce() {
		Optional<Trade> active = registry.active();
		if (active.isEmpty()) {
			return;
		}
		Trade trade = active.get();
		if (trade.status() == TradeStatus.CLOSING) {
			ExitReason reason = closeReasons.getOrDefault(trade.id(), ExitReason.FORCED);
			LOGGER.warn("EVENT=CLOSE_RETRY tradeId={} reason={}", trade.id(), reason);
			executeClose(trade.id(), reason);
			return;
		}
		if (trade.status() != TradeStatus.OPEN || !watcher.isTracking(trade.id())) {
			return;
		}
		ProtectionState state = watcher.inspect(trade.symbol(), trade.id());
		switch (state) {
			case STOP_GONE -> onProtectionLegGone(trade, trade.slOrder(), trade.tpOrder(), ExitReason.STOP_LOSS);
			case TARGET_GONE -> onProtectionLegGone(trade, trade.tpOrder(), trade.slOrder(), ExitReason.TAKE_PROFIT);
			case BOTH_GONE -> {
				LOGGER.error("EVENT=PROTECTION_ANOMALY tradeId={} reason=both_orders_gone action=force_close",
						trade.id());
				closeTrade(trade.id(), ExitReason.FORCED);
			}
			default -> {
			}
		}
	}

	private void onProtectionLegGone(Trade trade, TradeOrder goneLeg, TradeOrder sibling, ExitReason reason) {
		OrderSnapshot leg = gateway.fetchOrder(trade.symbol(), goneLeg.exchangeOrderId());
		if (!leg.isFilled()) {
			LOGGER.error("EVENT=PROTECTION_ANOMALY tradeId={} orderId={} status={} action=force_close", trade.id(),
					goneLeg.exchangeOrderId(), leg.status());
			closeTrade(trade.id(), ExitReason.FORCED);
			return;
		}
		Optional<Trade> closing = registry.compareAndTransition(trade.id(), TradeStatus.OPEN, TradeStatus.CLOSING);
		if (closing.isEmpty()) {
			return;
		}
		closeReasons.put(trade.id(), reason);
		placer.cancelQuietly(trade.id(), trade.symbol(), sibling.exchangeOrderId());
		BigDecimal fallback = reason == ExitReason.STOP_LOSS ? trade.stopLoss() : trade.takeProfit();
		finish(closing.get(), leg.fillPriceOr(fallback), reason);
	}

	/**
	 * Closes the trade at market after cancelling its protection. A failed close leaves the trade CLOSING and is
	 * retried on every monitor pass.
	 */
	public OperationResult<Trade> closeTrade(String tradeId, ExitReason reason) {
		Optional<Trade> found = registry.find(tradeId).filter(Trade::isActive);
		if (found.isEmpty()) {
			return OperationResult.validation("no active trade " + tradeId);
		}
		Trade trade = found.get();
		if (trade.status() == TradeStatus.OPENING) {
			return OperationResult.validation("trade " + tradeId + " is still opening");
		}
		if (trade.status() == TradeStatus.OPEN
				&& registry.compareAndTransition(tradeId, TradeStatus.OPEN, TradeStatus.CLOSING).isEmpty()) {
			Optional<Trade> current = registry.find(tradeId);
			if (current.isEmpty() || current.get().status() != TradeStatus.CLOSING) {
				return OperationResult.validation("trade " + tradeId + " was closed by another exit");
			}
		}
		closeReasons.putIfAbsent(tradeId, reason);
		return executeClose(tradeId, closeReasons.get(tradeId));
	}

	private OperationResult<Trade> executeClose(String tradeId, ExitReason reason) {
		if (!closesInFlight.add(tradeId)) {
			return OperationResult.transientFailure("close of trade " + tradeId + " already in progress");
		}
		try {
			return executeCloseAttempts(tradeId, reason);
		} finally {
			closesInFlight.remove(tradeId);
		}
	}

	private OperationResult<Trade> executeCloseAttempts(String tradeId, ExitReason reason) {
		int attempts = tradingProperties.order().closeAttempts();
		String lastError = null;
		for (int attempt = 1; attempt <= attempts; attempt++) {
			Optional<Trade> current = registry.find(tradeId);
			if (current.isEmpty() || current.get().status() != TradeStatus.CLOSING) {
				return OperationResult.validation("trade " + tradeId + " is no longer closing");
			}
			Trade trade = current.get();
			try {
				cancelProtection(trade);
				coordinator.release(tradeId);
				Optional<OrderSnapshot> exitOrder = flattener.flatten(trade.symbol(), trade.direction(), reason.name());
				BigDecimal exitPrice = exitOrder.isPresent()
						? exitOrder.get().fillPriceOr(gateway.fetchLastPrice(trade.symbol()))
						: gateway.fetchLastPrice(trade.symbol());
				return OperationResult.success(finish(trade, exitPrice, reason));
			} catch (ExchangeException ex) {
				lastError = ex.getMessage();
				LOGGER.warn("EVENT=CLOSE_ATTEMPT_FAILED tradeId={} attempt={} reason={}", tradeId, attempt, lastError);
				if (attempt < attempts && !pause(tradingProperties.order().closeRetryDelay())) {
					break;
				}
			}
		}
		LOGGER.error("EVENT=CLOSE_EXHAUSTED tradeId={} reason={} lastError={}", tradeId, reason, lastError);
		return OperationResult.transientFailure("could not close trade " + tradeId + ": " + lastError);
	}

	/**
	 * @return number of trades closed
	 */
	public int closeAllTrades(ExitReason reason) {
		int closed = 0;
		for (Trade trade : registry.activeTrades()) {
			OperationResult<Trade> result = closeTrade(trade.id(), reason);
			if (result.isSuccess()) {
				closed++;
			} else {
				LOGGER.warn("EVENT=CLOSE_ALL_INCOMPLETE tradeId={} kind={} reason={}", trade.id(),
						result.failureKind(), result.reason());
			}
		}
		return closed;
	}

	/**
	 * Forgets a trade the exchange shows no position for, after cancelling whatever protection it still has.
	 */
	public OperationResult<Trade> dropGhost(String tradeId) {
		Optional<Trade> found = registry.find(tradeId).filter(Trade::isActive);
		if (found.isEmpty()) {
			return OperationResult.validation("no active trade " + tradeId);
		}
		Trade trade = found.get();
		if (trade.status() == TradeStatus.OPENING) {
			LOGGER.warn("EVENT=GHOST_DROP_REFUSED tradeId={} reason=entry_in_flight", tradeId);
			return OperationResult.validation("trade " + tradeId + " is still opening");
		}
		registry.compareAndTransition(tradeId, TradeStatus.OPEN, TradeStatus.CLOSING);
		cancelProtection(trade);
		coordinator.release(tradeId);
		watcher.untrack(tradeId);
		closeReasons.remove(tradeId);
		Instant now = clock.instant();
		Optional<Trade> dropped = registry.update(tradeId, current -> current.closed(null, BigDecimal.ZERO,
				ExitReason.GHOST, now));
		if (dropped.isEmpty()) {
			return OperationResult.validation("trade " + tradeId + " disappeared while dropping");
		}
		LOGGER.warn("EVENT=GHOST_TRADE_DROPPED tradeId={} direction={} qty={}", tradeId, trade.direction(),
				trade.quantity());
		notifyClosed(dropped.get());
		return OperationResult.success(dropped.get());
	}

	public Optional<Trade> activeTrade() {
		return registry.active();
	}

	public boolean hasActiveTrade() {
		return registry.hasActiveTrade();
	}

	public Optional<Trade> findTrade(String tradeId) {
		return registry.find(tradeId);
	}

	public PerformanceStats performanceStats() {
		int closed = 0;
		int failed = 0;
		int wins = 0;
		int losses = 0;
		int degraded = 0;
		BigDecimal total = BigDecimal.ZERO;
		BigDecimal best = null;
		BigDecimal worst = null;
		for (Trade trade : registry.history()) {
			if (trade.status() == TradeStatus.FAILED) {
				failed++;
				continue;
			}
			if (trade.exitReason() == ExitReason.GHOST || trade.pnl() == null) {
				continue;
			}
			closed++;
			if (trade.degradedFill()) {
				degraded++;
			}
			BigDecimal pnl = trade.pnl();
			total = total.add(pnl);
			if (pnl.signum() > 0) {
				wins++;
			} else if (pnl.signum() < 0) {
				losses++;
			}
			best = best == null || pnl.compareTo(best) > 0 ? pnl : best;
			worst = worst == null || pnl.compareTo(worst) < 0 ? pnl : worst;
		}
		double winRate = wins + losses == 0 ? 0.0 : (double) wins / (wins + losses);
		BigDecimal average = closed == 0 ? BigDecimal.ZERO
				: total.divide(BigDecimal.valueOf(closed), MC);
		return new PerformanceStats(closed, failed, wins, losses, winRate, total, average,
				best == null ? BigDecimal.ZERO : best, worst == null ? BigDecimal.ZERO : worst, degraded);
	}

	private Trade finish(Trade trade, BigDecimal exitPrice, ExitReason reason) {
		BigDecimal pnl = trade.direction().favourableMove(trade.entryPrice(), exitPrice)
				.multiply(trade.quantity(), MC);
		watcher.untrack(trade.id());
		coordinator.release(trade.id());
		closeReasons.remove(trade.id());
		Instant now = clock.instant();
		Trade closed = registry.update(trade.id(), current -> current.closed(exitPrice, pnl, reason, now))
				.orElseGet(() -> trade.closed(exitPrice, pnl, reason, now));
		LOGGER.info("EVENT=TRADE_CLOSED tradeId={} direction={} entry={} exit={} qty={} pnl={} reason={}",
				closed.id(), closed.direction(), closed.entryPrice(), exitPrice, closed.quantity(), pnl, reason);
		notifyClosed(closed);
		return closed;
	}

	private void cancelProtection(Trade trade) {
		if (trade.slOrder() != null) {
			placer.cancelQuietly(trade.id(), trade.symbol(), trade.slOrder().exchangeOrderId());
		}
		if (trade.tpOrder() != null) {
			placer.cancelQuietly(trade.id(), trade.symbol(), trade.tpOrder().exchangeOrderId());
		}
	}

	private Trade markFailed(String tradeId, String reason) {
		Instant now = clock.instant();
		LOGGER.warn("EVENT=TRADE_FAILED tradeId={} reason={}", tradeId, reason);
		return registry.update(tradeId, trade -> trade.failed(reason, now)).orElse(null);
	}

	private BigDecimal rebase(Direction direction, BigDecimal fillPrice, BigDecimal distance, boolean target) {
		boolean up = (direction == Direction.LONG) == target;
		BigDecimal level = up ? fillPrice.add(distance) : fillPrice.subtract(distance);
		SymbolRules rules = symbolRules;
		if (rules == null) {
			return level;
		}
		return rules.roundPrice(level, up ? RoundingMode.UP : RoundingMode.DOWN);
	}

	static boolean levelsOrdered(Direction direction, BigDecimal entry, BigDecimal stop, BigDecimal target) {
		if (entry == null || stop == null || target == null) {
			return false;
		}
		return direction == Direction.LONG
				? stop.compareTo(entry) < 0 && entry.compareTo(target) < 0
				: target.compareTo(entry) < 0 && entry.compareTo(stop) < 0;
	}

	private String nextTradeId(String symbol) {
		return symbol + "-" + clock.millis() + "-" + sequence.incrementAndGet();
	}

	private boolean pause(Duration delay) {
		try {
			sleeper.sleep(delay);
			return true;
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	private void notifyOpened(Trade trade) {
		for (TradeLifecycleSink sink : sinks) {
			try {
				sink.onTradeOpened(trade);
			} catch (RuntimeException ex) {
				LOGGER.error("EVENT=SINK_FAILED sink={} event=opened reason={}", sink.getClass().getSimpleName(),
						ex.getMessage(), ex);
			}
		}
	}

	private void notifyClosed(Trade trade) {
		for (TradeLifecycleSink sink : sinks) {
			try {
				sink.onTradeClosed(trade);
			} catch (RuntimeException ex) {
				LOGGER.error("EVENT=SINK_FAILED sink={} event=closed reason={}", sink.getClass().getSimpleName(),
						ex.getMessage(), ex);
			}
		}
	}
}
