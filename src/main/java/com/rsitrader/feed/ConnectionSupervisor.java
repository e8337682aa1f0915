package com.rsitrader.feed;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rsitrader.common.Sleeper;
import com.rsitrader.config.TradingProperties;
import com.rsitrader.exchange.ExchangeException;
import com.rsitrader.exchange.ExchangeGateway;
import com.rsitrader.exchange.FeedListener;
import com.rsitrader.exchange.FeedSubscription;
import com.rsitrader.exchange.PositionSnapshot;
import com.rsitrader.market.Candle;
import com.rsitrader.notify.NotificationLevel;
import com.rsitrader.notify.Notifier;
import com.rsitrader.order.OrderManager;
import com.rsitrader.order.Trade;
import com.rsitrader.order.TradeStatus;
import com.rsitrader.risk.EmergencySwitch;

import jakarta.annotation.PreDestroy;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Keeps the candle stream alive. A dropped stream is reopened with exponential backoff; after a successful
 * reconnect the supervisor stays in SAFE_MODE for a while and then reconciles local trades with the exchange
 * position.
 */
@Component
public class ConnectionSupervisor {

	private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionSupervisor.class);

	private final ExchangeGateway gateway;
	private final OrderManager orderManager;
	private final EmergencySwitch emergencySwitch;
	private final Notifier notifier;
	private final TradingProperties tradingProperties;
	private final TradingProperties.Connection settings;
	private final ReconnectionPolicy policy;
	private final Clock clock;
	private final Sleeper sleeper;
	private final Scheduler scheduler = Schedulers.newBoundedElastic(1, 10, "feed-supervisor");

	private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
	private final AtomicReference<FeedSubscription> subscription = new AtomicReference<>();
	private final AtomicReference<CandleSink> sink = new AtomicReference<>();
	private final AtomicLong generation = new AtomicLong();
	private final AtomicBoolean reconnecting = new AtomicBoolean(false);
	private final AtomicBoolean reconnectRequested = new AtomicBoolean(false);
	private final AtomicBoolean stopped = new AtomicBoolean(false);
	private final AtomicInteger attempts = new AtomicInteger();
	private final AtomicLong totalReconnects = new AtomicLong();
	private final AtomicReference<String> blockReason = new AtomicReference<>();
	private volatile Instant lastConnectedAt;
	private volatile Instant lastDisconnectedAt;
	private volatile Instant safeModeUntil;

	public ConnectionSupervisor(ExchangeGateway gateway, OrderManager orderManager, EmergencySwitch emergencySwitch,
			Notifier notifier, TradingProperties tradingProperties, Clock clock, Sleeper sleeper) {
		this.gateway = gateway;
		this.orderManager = orderManager;
		this.emergencySwitch = emergencySwitch;
		this.notifier = notifier;
		this.tradingProperties = tradingProperties;
		this.settings = tradingProperties.connection();
		this.policy = new ReconnectionPolicy(settings.baseDelay(), settings.maxDelay(), settings.maxAttempts());
		this.clock = clock;
		this.sleeper = sleeper;
	}

	/**
	 * Opens the stream and starts delivering closed candles to {@code candleSink}. A failed first connection goes
	 * straight into the reconnect loop.
	 */
	public void start(CandleSink candleSink) {
		sink.set(candleSink);
		stopped.set(false);
		if (openAndAwait()) {
			state.set(ConnectionState.CONNECTED);
			lastConnectedAt = clock.instant();
			LOGGER.info("EVENT=FEED_CONNECTED symbol={} interval={}", tradingProperties.symbol(),
					tradingProperties.interval());
		} else {
			LOGGER.warn("EVENT=FEED_INITIAL_CONNECT_FAILED symbol={}", tradingProperties.symbol());
			triggerReconnect();
		}
	}

	@PreDestroy
	public void stop() {
		stopped.set(true);
		closeSubscription();
		state.set(ConnectionState.DISCONNECTED);
		scheduler.dispose();
	}

	public void forceReconnect() {
		LOGGER.warn("EVENT=FEED_FORCE_RECONNECT");
		closeSubscription();
		state.set(ConnectionState.RECONNECTING);
		triggerReconnect();
	}

	/**
	 * Requests a reconnect cycle. A request raised while a cycle is running, including its safe-mode wait, is
	 * served by that cycle once the current pass ends.
	 */
	private void triggerReconnect() {
		if (stopped.get()) {
			return;
		}
		reconnectRequested.set(true);
		if (!reconnecting.compareAndSet(false, true)) {
			return;
		}
		scheduler.schedule(this::runReconnectCycles);
	}

	private void runReconnectCycles() {
		try {
			while (reconnectRequested.getAndSet(false) && !stopped.get()) {
				if (reconnect()) {
					sleeper.sleep(settings.safeModeDuration());
					completeSafeMode();
				}
			}
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			LOGGER.warn("EVENT=FEED_RECONNECT_INTERRUPTED");
			return;
		} catch (RuntimeException ex) {
			LOGGER.error("EVENT=FEED_RECONNECT_CRASHED reason={}", ex.getMessage(), ex);
		} finally {
			reconnecting.set(false);
		}
		if (reconnectRequested.get() && !stopped.get() && !scheduler.isDisposed()) {
			triggerReconnect();
		}
	}

	/**
	 * Runs the backoff loop until the stream is back, the attempt budget is spent or the emergency switch trips.
	 * Blocks the calling thread.
	 *
	 * @return {@code true} when reconnected, which leaves the supervisor in SAFE_MODE
	 */
	boolean reconnect() throws InterruptedException {
		state.set(ConnectionState.RECONNECTING);
		attempts.set(0);
		while (!stopped.get()) {
			if (emergencySwitch.isTripped()) {
				LOGGER.warn("EVENT=RECONNECT_ABORTED reason=emergency_stop");
				return false;
			}
			int attempt = attempts.incrementAndGet();
			Duration delay = policy.delayFor(attempt);
			LOGGER.warn("EVENT=RECONNECT_ATTEMPT attempt={} delay={} maxAttempts={}", attempt, delay,
					policy.maxAttempts());
			sleeper.sleep(delay);
			if (openAndAwait()) {
				enterSafeMode(attempt);
				return true;
			}
			if (policy.isExhausted(attempt)) {
				state.set(ConnectionState.DISCONNECTED);
				String reason = "CONNECTIVITY_LOST after " + attempt + " reconnect attempts";
				LOGGER.error("EVENT=RECONNECT_EXHAUSTED attempts={}", attempt);
				notifier.notify(NotificationLevel.CRITICAL, "CONNECTIVITY_LOST", reason);
				emergencySwitch.trip(reason);
				return false;
			}
		}
		return false;
	}

	private void enterSafeMode(int attempt) {
		Instant now = clock.instant();
		lastConnectedAt = now;
		safeModeUntil = now.plus(settings.safeModeDuration());
		totalReconnects.incrementAndGet();
		state.set(ConnectionState.SAFE_MODE);
		LOGGER.warn("EVENT=FEED_RECONNECTED attempts={} safeModeUntil={}", attempt, safeModeUntil);
		notifier.notify(NotificationLevel.WARNING, "FEED_RECONNECTED",
				"stream restored after " + attempt + " attempts, safe mode until " + safeModeUntil);
	}

	/**
	 * Leaves SAFE_MODE and reconciles local trades with the exchange position.
	 */
	void completeSafeMode() {
		if (!state.compareAndSet(ConnectionState.SAFE_MODE, ConnectionState.CONNECTED)) {
			LOGGER.warn("EVENT=SAFE_MODE_END_SKIPPED state={}", state.get());
			return;
		}
		safeModeUntil = null;
		LOGGER.info("EVENT=SAFE_MODE_ENDED");
		reconcile();
	}

	/**
	 * Compares the tracked trade with the exchange position. An untracked position blocks new trades until an
	 * operator clears it; a tracked trade without a position is dropped as a ghost.
	 */
	public void reconcile() {
		String symbol = tradingProperties.symbol();
		PositionSnapshot position;
		try {
			position = gateway.fetchPosition(symbol);
		} catch (ExchangeException ex) {
			block("reconciliation failed: " + ex.getMessage());
			notifier.notify(NotificationLevel.CRITICAL, "RECONCILIATION_FAILED", ex.getMessage());
			return;
		}
		Optional<Trade> tracked = orderManager.activeTrade();
		if (tracked.isPresent() && tracked.get().status() == TradeStatus.OPENING) {
			LOGGER.info("EVENT=RECONCILE_SKIPPED tradeId={} reason=entry_in_flight position={}", tracked.get().id(),
					position.positionAmt());
			return;
		}
		if (!position.isFlat() && tracked.isEmpty()) {
			String reason = "untracked exchange position " + position.positionAmt() + " @ " + position.entryPrice();
			block(reason);
			notifier.notify(NotificationLevel.CRITICAL, "UNTRACKED_POSITION", reason);
			return;
		}
		if (position.isFlat() && tracked.isPresent()) {
			Trade ghost = tracked.get();
			LOGGER.warn("EVENT=GHOST_TRADE_DETECTED tradeId={} status={}", ghost.id(), ghost.status());
			orderManager.dropGhost(ghost.id());
			notifier.notify(NotificationLevel.WARNING, "GHOST_TRADE",
					"trade " + ghost.id() + " had no exchange position and was dropped");
			return;
		}
		LOGGER.info("EVENT=RECONCILED position={} trackedTrade={}", position.positionAmt(),
				tracked.map(Trade::id).orElse("none"));
	}

	/**
	 * @return the reason new trades are refused, empty when they are allowed
	 */
	public Optional<String> newTradeBlocker() {
		String blocked = blockReason.get();
		if (blocked != null) {
			return Optional.of("trading blocked: " + blocked);
		}
		ConnectionState current = state.get();
		if (current == ConnectionState.CONNECTED) {
			return Optional.empty();
		}
		if (current == ConnectionState.SAFE_MODE) {
			return confirmFlatTwice() ? Optional.empty()
					: Optional.of("safe mode: position reads were not consistently flat");
		}
		return Optional.of("feed " + current);
	}

	public boolean allowsNewTrades() {
		return newTradeBlocker().isEmpty();
	}

	private boolean confirmFlatTwice() {
		String symbol = tradingProperties.symbol();
		try {
			PositionSnapshot first = gateway.fetchPosition(symbol);
			sleeper.sleep(settings.safeModeRecheckPause());
			PositionSnapshot second = gateway.fetchPosition(symbol);
			boolean flat = first.isFlat() && second.isFlat();
			LOGGER.info("EVENT=SAFE_MODE_CHECK first={} second={} allowed={}", first.positionAmt(),
					second.positionAmt(), flat);
			return flat;
		} catch (ExchangeException ex) {
			LOGGER.warn("EVENT=SAFE_MODE_CHECK_FAILED reason={}", ex.getMessage());
			return false;
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	public void clearTradingBlock(String operator) {
		String previous = blockReason.getAndSet(null);
		if (previous != null) {
			LOGGER.warn("EVENT=TRADING_BLOCK_CLEARED operator={} previousReason={}", operator, previous);
		}
	}

	public ConnectionState state() {
		return state.get();
	}

	public boolean isConnected() {
		ConnectionState current = state.get();
		return current == ConnectionState.CONNECTED || current == ConnectionState.SAFE_MODE;
	}

	public ConnectionStatus status() {
		String blocked = blockReason.get();
		return new ConnectionStatus(state.get(), isConnected(), attempts.get(), totalReconnects.get(),
				lastConnectedAt, lastDisconnectedAt, safeModeUntil, blocked != null, blocked);
	}

	private void block(String reason) {
		blockReason.set(reason);
		LOGGER.error("EVENT=TRADING_BLOCKED reason={}", reason);
	}

	private boolean openAndAwait() {
		closeSubscription();
		StreamListener listener = new StreamListener(generation.incrementAndGet());
		try {
			subscription.set(gateway.openCandleStream(tradingProperties.symbol(), tradingProperties.interval(),
					listener));
		} catch (RuntimeException ex) {
			LOGGER.warn("EVENT=FEED_OPEN_FAILED reason={}", ex.getMessage());
			return false;
		}
		try {
			if (listener.connected.await(settings.connectWait().toMillis(), TimeUnit.MILLISECONDS)) {
				return true;
			}
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
		}
		LOGGER.warn("EVENT=FEED_CONNECT_TIMEOUT wait={}", settings.connectWait());
		closeSubscription();
		return false;
	}

	private void closeSubscription() {
		FeedSubscription previous = subscription.getAndSet(null);
		if (previous != null && !previous.isClosed()) {
			generation.incrementAndGet();
			previous.close();
		}
	}

	private void onStreamLost(long streamGeneration, Throwable cause) {
		if (stopped.get() || streamGeneration != generation.get()) {
			return;
		}
		lastDisconnectedAt = clock.instant();
		state.set(ConnectionState.RECONNECTING);
		LOGGER.warn("EVENT=FEED_DISCONNECTED reason={}", cause == null ? "completed" : cause.getMessage());
		notifier.notify(NotificationLevel.WARNING, "FEED_DISCONNECTED",
				cause == null ? "stream completed" : String.valueOf(cause.getMessage()));
		triggerReconnect();
	}

	private final class StreamListener implements FeedListener {

		private final long streamGeneration;
		private final CountDownLatch connected = new CountDownLatch(1);

		private StreamListener(long streamGeneration) {
			this.streamGeneration = streamGeneration;
		}

		@Override
		public void onConnected() {
			connected.countDown();
		}

		@Override
		public void onCandleClosed(Candle candle) {
			CandleSink target = sink.get();
			if (target != null && streamGeneration == generation.get()) {
				target.onCandleClosed(candle);
			}
		}

		@Override
		public void onDisconnected(Throwable cause) {
			onStreamLost(streamGeneration, cause);
		}
	}
}
