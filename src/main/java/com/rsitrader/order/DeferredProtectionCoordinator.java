package com.rsitrader.order;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rsitrader.common.OperationResult;
import com.rsitrader.config.TradingProperties;
import com.rsitrader.exchange.ExchangeException;
import com.rsitrader.exchange.ExchangeGateway;
import com.rsitrader.exchange.SymbolRules;
import com.rsitrader.order.ProtectionPlacer.ProtectionPair;
import com.rsitrader.order.ProtectionPriceAdjuster.Levels;
import com.rsitrader.risk.EmergencySwitch;
import com.rsitrader.signal.Direction;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Places protection for trades whose entry candle has to close first. Each pending entry is placed at most once,
 * however many monitor ticks and manual triggers race for it.
 *
 * <p>Claims are taken and released under one mutex; price reads and order placement happen outside it. A claim
 * older than the processing timeout is considered lost and released for the next cycle. A late finisher whose
 * claim was released cancels the orders it placed.
 */
@Component
public class DeferredProtectionCoordinator {

	private static final Logger LOGGER = LoggerFactory.getLogger(DeferredProtectionCoordinator.class);

	private final ExchangeGateway gateway;
	private final ProtectionPlacer placer;
	private final ProtectionPriceAdjuster adjuster;
	private final EmergencySwitch emergencySwitch;
	private final TradingProperties.Protection settings;
	private final Clock clock;
	private final Object mutex = new Object();
	private final Map<String, PendingProtection> pending = new LinkedHashMap<>();
	private final AtomicReference<Disposable> monitor = new AtomicReference<>();
	private final Scheduler scheduler = Schedulers.newBoundedElastic(2, 100, "deferred-protection");
	private volatile SymbolRules symbolRules;

	public DeferredProtectionCoordinator(ExchangeGateway gateway, ProtectionPlacer placer,
			ProtectionPriceAdjuster adjuster, EmergencySwitch emergencySwitch, TradingProperties tradingProperties,
			Clock clock) {
		this.gateway = gateway;
		this.placer = placer;
		this.adjuster = adjuster;
		this.emergencySwitch = emergencySwitch;
		this.settings = tradingProperties.protection();
		this.clock = clock;
	}

	public void applySymbolRules(SymbolRules rules) {
		this.symbolRules = rules;
	}

	public void start() {
		Disposable loop = Flux.interval(settings.checkInterval(), scheduler)
				.onBackpressureDrop()
				.subscribe(tick -> runCycle(), error -> LOGGER.error("EVENT=DEFERRED_LOOP_ERROR reason={}",
						error.getMessage(), error));
		Disposable previous = monitor.getAndSet(loop);
		if (previous != null) {
			previous.dispose();
		}
		LOGGER.info("EVENT=DEFERRED_MONITOR_STARTED interval={}", settings.checkInterval());
	}

	@PreDestroy
	public void stop() {
		Disposable loop = monitor.getAndSet(null);
		if (loop != null) {
			loop.dispose();
		}
		scheduler.dispose();
	}

	private void runCycle() {
		try {
			processDue();
			cleanup();
		} catch (RuntimeException ex) {
			LOGGER.error("EVENT=DEFERRED_CYCLE_FAILED reason={}", ex.getMessage(), ex);
		}
	}

	public void schedule(Trade trade, Instant deadline, PlacementCallback callback) {
		synchronized (mutex) {
			if (pending.containsKey(trade.id())) {
				LOGGER.warn("EVENT=DEFERRED_ALREADY_SCHEDULED tradeId={}", trade.id());
				return;
			}
			pending.put(trade.id(), new PendingProtection(trade, deadline, callback));
		}
		LOGGER.info("EVENT=DEFERRED_SCHEDULED tradeId={} direction={} qty={} stop={} target={} deadline={}",
				trade.id(), trade.direction(), trade.quantity(), trade.stopLoss(), trade.takeProfit(), deadline);
	}

	/**
	 * Processes every entry whose deadline has passed.
	 *
	 * @return number of entries placed by this call
	 */
	public int processDue() {
		if (emergencySwitch.isTripped()) {
			LOGGER.warn("EVENT=DEFERRED_SKIPPED reason=emergency_stop");
			return 0;
		}
		List<Claim> claims = claim(null);
		int placed = 0;
		for (Claim claim : claims) {
			if (process(claim)) {
				placed++;
			}
		}
		return placed;
	}

	/**
	 * Processes one entry regardless of its deadline. An entry already placed or in flight is left alone.
	 */
	public OperationResult<Boolean> forceProcess(String tradeId) {
		synchronized (mutex) {
			if (!pending.containsKey(tradeId)) {
				return OperationResult.validation("no deferred protection for trade " + tradeId);
			}
		}
		List<Claim> claims = claim(tradeId);
		if (claims.isEmpty()) {
			return OperationResult.success(Boolean.FALSE);
		}
		LOGGER.info("EVENT=DEFERRED_FORCED tradeId={}", tradeId);
		return OperationResult.success(process(claims.get(0)));
	}

	/**
	 * Drops an entry that has not been placed yet.
	 */
	public boolean cancel(String tradeId) {
		synchronized (mutex) {
			PendingProtection entry = pending.get(tradeId);
			if (entry == null || entry.placed) {
				return false;
			}
			pending.remove(tradeId);
		}
		LOGGER.info("EVENT=DEFERRED_CANCELLED tradeId={}", tradeId);
		return true;
	}

	/**
	 * Forgets the entry once its trade is closed.
	 */
	public void release(String tradeId) {
		PendingProtection removed;
		synchronized (mutex) {
			removed = pending.remove(tradeId);
		}
		if (removed != null) {
			LOGGER.info("EVENT=DEFERRED_RELEASED tradeId={} placed={}", tradeId, removed.placed);
		}
	}

	public List<ProtectionStatus> status() {
		synchronized (mutex) {
			List<ProtectionStatus> statuses = new ArrayList<>(pending.size());
			for (PendingProtection entry : pending.values()) {
				statuses.add(entry.toStatus());
			}
			return statuses;
		}
	}

	/**
	 * Removes placed entries that completed longer ago than the retention window.
	 */
	public int cleanup() {
		Instant cutoff = clock.instant().minus(settings.retention());
		int removed = 0;
		synchronized (mutex) {
			Iterator<PendingProtection> iterator = pending.values().iterator();
			while (iterator.hasNext()) {
				PendingProtection entry = iterator.next();
				if (entry.placed && entry.completedAt != null && entry.completedAt.isBefore(cutoff)) {
					iterator.remove();
					removed++;
				}
			}
		}
		if (removed > 0) {
			LOGGER.info("EVENT=DEFERRED_CLEANUP removed={}", removed);
		}
		return removed;
	}

	private List<Claim> claim(String onlyTradeId) {
		Instant now = clock.instant();
		Duration timeout = settings.processingTimeout();
		List<Claim> claims = new ArrayList<>();
		synchronized (mutex) {
			for (PendingProtection entry : pending.values()) {
				if (onlyTradeId != null && !onlyTradeId.equals(entry.tradeId)) {
					continue;
				}
				if (entry.placed) {
					continue;
				}
				if (entry.inFlight()) {
					if (Duration.between(entry.processingStartedAt, now).compareTo(timeout) >= 0) {
						LOGGER.warn("EVENT=DEFERRED_PROCESSING_TIMEOUT tradeId={} startedAt={}", entry.tradeId,
								entry.processingStartedAt);
						entry.clearClaim();
					}
					continue;
				}
				if (onlyTradeId == null && now.isBefore(entry.entryCandleCloseDeadline)) {
					continue;
				}
				entry.processingStartedAt = now;
				entry.lockToken = UUID.randomUUID().toString();
				entry.attempts++;
				claims.add(new Claim(entry.tradeId, entry.lockToken, entry.symbol, entry.direction, entry.quantity,
						entry.originalStop, entry.originalTarget, entry.callback, entry.attempts));
			}
		}
		return claims;
	}

	private boolean process(Claim claim) {
		Levels levels;
		OperationResult<ProtectionPair> result;
		try {
			BigDecimal price = gateway.fetchLastPrice(claim.symbol());
			levels = adjuster.adjust(claim.direction(), price, claim.stop(), claim.target(), symbolRules);
			if (levels.stopCrossed() || levels.targetCrossed()) {
				LOGGER.warn("EVENT=DEFERRED_LEVELS_ADJUSTED tradeId={} price={} stop={}->{} target={}->{}",
						claim.tradeId(), price, claim.stop(), levels.stop(), claim.target(), levels.target());
			}
			result = placer.place(claim.tradeId(), claim.symbol(), claim.direction(), claim.quantity(), levels.stop(),
					levels.target());
		} catch (ExchangeException ex) {
			result = OperationResult.failure(ex.kind(), ex.getMessage());
			levels = null;
		}
		if (!result.isSuccess()) {
			synchronized (mutex) {
				PendingProtection entry = pending.get(claim.tradeId());
				if (entry != null && claim.token().equals(entry.lockToken)) {
					entry.clearClaim();
				}
			}
			LOGGER.warn("EVENT=DEFERRED_ATTEMPT_FAILED tradeId={} attempt={} kind={} reason={}", claim.tradeId(),
					claim.attempt(), result.failureKind(), result.reason());
			return false;
		}
		ProtectionPair pair = result.value();
		boolean owner;
		synchronized (mutex) {
			PendingProtection entry = pending.get(claim.tradeId());
			owner = entry != null && !entry.placed && claim.token().equals(entry.lockToken);
			if (owner) {
				entry.placed = true;
				entry.finalStop = levels.stop();
				entry.finalTarget = levels.target();
				entry.completedAt = clock.instant();
				entry.clearClaim();
			}
		}
		if (!owner) {
			LOGGER.warn("EVENT=DEFERRED_STALE_PLACEMENT tradeId={} stopOrderId={} targetOrderId={}", claim.tradeId(),
					pair.stopOrder().exchangeOrderId(), pair.targetOrder().exchangeOrderId());
			placer.cancel(claim.tradeId(), claim.symbol(), pair);
			return false;
		}
		LOGGER.info("EVENT=DEFERRED_PLACED tradeId={} stop={} target={} attempt={}", claim.tradeId(), levels.stop(),
				levels.target(), claim.attempt());
		try {
			claim.callback().onPlaced(claim.tradeId(), pair, levels.stop(), levels.target());
		} catch (RuntimeException ex) {
			LOGGER.error("EVENT=DEFERRED_CALLBACK_FAILED tradeId={} reason={}", claim.tradeId(), ex.getMessage(), ex);
		}
		return true;
	}

	@FunctionalInterface
	public interface PlacementCallback {

		void onPlaced(String tradeId, ProtectionPair pair, BigDecimal stop, BigDecimal target);
	}

	private record Claim(
			String tradeId,
			String token,
			String symbol,
			Direction direction,
			BigDecimal quantity,
			BigDecimal stop,
			BigDecimal target,
			PlacementCallback callback,
			int attempt) {
	}
}
