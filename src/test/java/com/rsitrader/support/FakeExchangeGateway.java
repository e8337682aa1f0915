package com.rsitrader.support;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.rsitrader.common.FailureKind;
import com.rsitrader.exchange.ExchangeException;
import com.rsitrader.exchange.ExchangeGateway;
import com.rsitrader.exchange.ExchangeOrderStatus;
import com.rsitrader.exchange.FeedListener;
import com.rsitrader.exchange.FeedSubscription;
import com.rsitrader.exchange.OrderSide;
import com.rsitrader.exchange.OrderSnapshot;
import com.rsitrader.exchange.PositionSnapshot;
import com.rsitrader.exchange.SymbolRules;
import com.rsitrader.market.Candle;

/**
 * In-memory exchange. Market orders fill at the last price and move the net position; stop and take-profit orders
 * rest until a test fills or removes them.
 */
public class FakeExchangeGateway implements ExchangeGateway {

	private final Map<Long, OrderSnapshot> orders = new ConcurrentHashMap<>();
	private final Map<String, Deque<FailureKind>> failures = new HashMap<>();
	private final Map<String, Runnable> beforeHooks = new ConcurrentHashMap<>();
	private final AtomicLong orderIds = new AtomicLong(1000);
	private final Deque<Boolean> streamOutcomes = new ArrayDeque<>();
	private final AtomicInteger streamOpens = new AtomicInteger();
	private final AtomicInteger protectionPlacements = new AtomicInteger();
	private final List<Long> cancelled = new CopyOnWriteArrayList<>();
	private final List<OrderSnapshot> marketOrders = new CopyOnWriteArrayList<>();
	private final List<Candle> candles = new ArrayList<>();

	private volatile BigDecimal balance = new BigDecimal("1000");
	private volatile BigDecimal lastPrice = new BigDecimal("100");
	private volatile BigDecimal positionAmt = BigDecimal.ZERO;
	private volatile BigDecimal positionEntry = BigDecimal.ZERO;
	private volatile boolean limitOrdersFill = true;
	private volatile long protectionPlacementDelayMs;
	private volatile long latencyMs = 25L;
	private volatile FeedListener streamListener;
	private volatile SymbolRules rules = new SymbolRules("BTCUSDC", new BigDecimal("0.1"), new BigDecimal("0.001"),
			new BigDecimal("0.001"), new BigDecimal("5"));

	public void setBalance(String value) {
		this.balance = new BigDecimal(value);
	}

	public void setLastPrice(String value) {
		this.lastPrice = new BigDecimal(value);
	}

	public void setPosition(String amount, String entryPrice) {
		synchronized (this) {
			this.positionAmt = new BigDecimal(amount);
			this.positionEntry = new BigDecimal(entryPrice);
		}
	}

	public void setRules(SymbolRules value) {
		this.rules = value;
	}

	public void setLimitOrdersFill(boolean value) {
		this.limitOrdersFill = value;
	}

	public void setProtectionPlacementDelayMs(long value) {
		this.protectionPlacementDelayMs = value;
	}

	public void setLatencyMs(long value) {
		this.latencyMs = value;
	}

	public void setCandles(List<Candle> value) {
		synchronized (candles) {
			candles.clear();
			candles.addAll(value);
		}
	}

	/**
	 * Makes the next call of {@code operation} (the gateway method name) fail with {@code kind}.
	 */
	public void failNext(String operation, FailureKind kind) {
		synchronized (failures) {
			failures.computeIfAbsent(operation, key -> new ArrayDeque<>()).addLast(kind);
		}
	}

	/**
	 * Runs {@code action} once, at the start of the next call of {@code operation}. Whatever it throws is thrown
	 * from that call.
	 */
	public void runBeforeNext(String operation, Runnable action) {
		beforeHooks.put(operation, action);
	}

	/**
	 * Queues outcomes for the next stream opens; once the queue is empty every open succeeds.
	 */
	public void queueStreamOutcomes(Boolean... outcomes) {
		synchronized (streamOutcomes) {
			Collections.addAll(streamOutcomes, outcomes);
		}
	}

	public void fillOrder(long orderId, String price) {
		OrderSnapshot order = orders.get(orderId);
		BigDecimal fillPrice = new BigDecimal(price);
		orders.put(orderId, withStatus(order, ExchangeOrderStatus.FILLED, order.origQty(), fillPrice));
		applyFill(order.side(), order.origQty(), true, fillPrice);
	}

	/**
	 * Drops an order from the open book without a fill, as an exchange side expiry would.
	 */
	public void expireOrder(long orderId) {
		OrderSnapshot order = orders.get(orderId);
		orders.put(orderId, withStatus(order, ExchangeOrderStatus.EXPIRED, BigDecimal.ZERO, BigDecimal.ZERO));
	}

	public OrderSnapshot order(long orderId) {
		return orders.get(orderId);
	}

	public List<Long> cancelledOrderIds() {
		return cancelled;
	}

	public List<OrderSnapshot> marketOrders() {
		return marketOrders;
	}

	public int protectionPlacements() {
		return protectionPlacements.get();
	}

	public int streamOpens() {
		return streamOpens.get();
	}

	public FeedListener streamListener() {
		return streamListener;
	}

	public synchronized BigDecimal positionAmount() {
		return positionAmt;
	}

	@Override
	public BigDecimal fetchAvailableBalance() {
		failIfQueued("fetchAvailableBalance");
		return balance;
	}

	@Override
	public SymbolRules fetchSymbolRules(String symbol) {
		failIfQueued("fetchSymbolRules");
		return rules;
	}

	@Override
	public BigDecimal fetchLastPrice(String symbol) {
		failIfQueued("fetchLastPrice");
		return lastPrice;
	}

	@Override
	public List<Candle> fetchRecentCandles(String symbol, String interval, int limit) {
		failIfQueued("fetchRecentCandles");
		synchronized (candles) {
			return new ArrayList<>(candles.subList(Math.max(0, candles.size() - limit), candles.size()));
		}
	}

	@Override
	public OrderSnapshot placeMarketOrder(String symbol, OrderSide side, BigDecimal quantity, boolean reduceOnly) {
		failIfQueued("placeMarketOrder");
		BigDecimal price = lastPrice;
		OrderSnapshot order = new OrderSnapshot(orderIds.incrementAndGet(), "MARKET", side, ExchangeOrderStatus.FILLED,
				quantity, quantity, price, BigDecimal.ZERO, BigDecimal.ZERO);
		orders.put(order.orderId(), order);
		marketOrders.add(order);
		applyFill(side, quantity, reduceOnly, price);
		return order;
	}

	@Override
	public OrderSnapshot placeLimitOrder(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price) {
		failIfQueued("placeLimitOrder");
		long id = orderIds.incrementAndGet();
		OrderSnapshot order;
		if (limitOrdersFill) {
			order = new OrderSnapshot(id, "LIMIT", side, ExchangeOrderStatus.FILLED, quantity, quantity, price, price,
					BigDecimal.ZERO);
			applyFill(side, quantity, false, price);
		} else {
			order = new OrderSnapshot(id, "LIMIT", side, ExchangeOrderStatus.NEW, quantity, BigDecimal.ZERO,
					BigDecimal.ZERO, price, BigDecimal.ZERO);
		}
		orders.put(id, order);
		return order;
	}

	@Override
	public OrderSnapshot placeStopMarketOrder(String symbol, OrderSide side, BigDecimal quantity,
			BigDecimal stopPrice) {
		failIfQueued("placeStopMarketOrder");
		protectionPlacements.incrementAndGet();
		pause(protectionPlacementDelayMs);
		OrderSnapshot order = new OrderSnapshot(orderIds.incrementAndGet(), "STOP_MARKET", side,
				ExchangeOrderStatus.NEW, quantity, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, stopPrice);
		orders.put(order.orderId(), order);
		return order;
	}

	@Override
	public OrderSnapshot placeTakeProfitLimitOrder(String symbol, OrderSide side, BigDecimal quantity,
			BigDecimal price) {
		failIfQueued("placeTakeProfitLimitOrder");
		OrderSnapshot order = new OrderSnapshot(orderIds.incrementAndGet(), "LIMIT", side, ExchangeOrderStatus.NEW,
				quantity, BigDecimal.ZERO, BigDecimal.ZERO, price, BigDecimal.ZERO);
		orders.put(order.orderId(), order);
		return order;
	}

	@Override
	public OrderSnapshot fetchOrder(String symbol, long orderId) {
		failIfQueued("fetchOrder");
		OrderSnapshot order = orders.get(orderId);
		if (order == null) {
			throw new ExchangeException(FailureKind.VALIDATION, "fetchOrder", "unknown order " + orderId, null);
		}
		return order;
	}

	@Override
	public boolean cancelOrder(String symbol, long orderId) {
		failIfQueued("cancelOrder");
		OrderSnapshot order = orders.get(orderId);
		if (order == null || !order.status().isOpen()) {
			return false;
		}
		orders.put(orderId, withStatus(order, ExchangeOrderStatus.CANCELED, order.executedQty(), order.avgPrice()));
		cancelled.add(orderId);
		return true;
	}

	@Override
	public Set<Long> fetchOpenOrderIds(String symbol) {
		failIfQueued("fetchOpenOrderIds");
		Set<Long> open = new LinkedHashSet<>();
		for (OrderSnapshot order : orders.values()) {
			if (order.status().isOpen()) {
				open.add(order.orderId());
			}
		}
		return open;
	}

	@Override
	public synchronized PositionSnapshot fetchPosition(String symbol) {
		failIfQueued("fetchPosition");
		return new PositionSnapshot(symbol, positionAmt, positionEntry);
	}

	@Override
	public long measureLatency() {
		failIfQueued("measureLatency");
		return latencyMs;
	}

	@Override
	public FeedSubscription openCandleStream(String symbol, String interval, FeedListener listener) {
		streamOpens.incrementAndGet();
		Boolean outcome;
		synchronized (streamOutcomes) {
			outcome = streamOutcomes.pollFirst();
		}
		if (Boolean.FALSE.equals(outcome)) {
			throw new ExchangeException(FailureKind.TRANSIENT, "openCandleStream", "handshake refused", null);
		}
		streamListener = listener;
		listener.onConnected();
		AtomicBoolean closed = new AtomicBoolean(false);
		return new FeedSubscription() {
			@Override
			public void close() {
				closed.set(true);
			}

			@Override
			public boolean isClosed() {
				return closed.get();
			}
		};
	}

	private synchronized void applyFill(OrderSide side, BigDecimal quantity, boolean reduceOnly, BigDecimal price) {
		BigDecimal signed = side == OrderSide.BUY ? quantity : quantity.negate();
		BigDecimal next = positionAmt.add(signed);
		if (reduceOnly && (positionAmt.signum() == 0 || next.signum() == -positionAmt.signum())) {
			next = BigDecimal.ZERO;
		}
		if (positionAmt.signum() == 0 && next.signum() != 0) {
			positionEntry = price;
		}
		positionAmt = next;
		if (next.signum() == 0) {
			positionEntry = BigDecimal.ZERO;
		}
	}

	private void failIfQueued(String operation) {
		Runnable hook = beforeHooks.remove(operation);
		if (hook != null) {
			hook.run();
		}
		FailureKind kind;
		synchronized (failures) {
			Deque<FailureKind> queued = failures.get(operation);
			kind = queued == null ? null : queued.pollFirst();
		}
		if (kind != null) {
			throw new ExchangeException(kind, operation, "injected failure", null);
		}
	}

	private static OrderSnapshot withStatus(OrderSnapshot order, ExchangeOrderStatus status, BigDecimal executed,
			BigDecimal avgPrice) {
		return new OrderSnapshot(order.orderId(), order.type(), order.side(), status, order.origQty(), executed,
				avgPrice, order.price(), order.stopPrice());
	}

	private static void pause(long millis) {
		if (millis <= 0) {
			return;
		}
		try {
			Thread.sleep(millis);
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
		}
	}
}
