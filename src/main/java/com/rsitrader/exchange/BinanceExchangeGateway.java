package com.rsitrader.exchange;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import com.rsitrader.common.FailureKind;
import com.rsitrader.config.TradingProperties;
import com.rsitrader.exchange.BinanceFuturesClient.NewOrder;
import com.rsitrader.market.Candle;

import jakarta.annotation.PreDestroy;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

@Component
public class BinanceExchangeGateway implements ExchangeGateway {

	private static final Logger LOGGER = LoggerFactory.getLogger(BinanceExchangeGateway.class);
	private static final Duration CALL_TIMEOUT = Duration.ofSeconds(30);

	private final BinanceFuturesClient client;
	private final KlineStreamClient klineStreamClient;
	private final TradingProperties tradingProperties;
	private final RequestThrottle throttle;
	private final Scheduler retryScheduler;
	private final AtomicLong lastLatencyMs = new AtomicLong(-1L);

	public BinanceExchangeGateway(BinanceFuturesClient client, KlineStreamClient klineStreamClient,
			TradingProperties tradingProperties) {
		this.client = client;
		this.klineStreamClient = klineStreamClient;
		this.tradingProperties = tradingProperties;
		this.throttle = new RequestThrottle(tradingProperties.retry().maxConcurrentRequests(),
				tradingProperties.retry().minRequestSpacing());
		this.retryScheduler = Schedulers.newBoundedElastic(4, 1000, "exchange-retry");
	}

	@PreDestroy
	public void shutdown() {
		retryScheduler.dispose();
	}

	@Override
	public BigDecimal fetchAvailableBalance() {
		String asset = tradingProperties.quoteAsset();
		return execute("fetchBalance", retry().defaults(), () -> client.fetchBalances()
				.map(balances -> balances.stream()
						.filter(balance -> asset.equalsIgnoreCase(balance.asset()))
						.findFirst()
						.map(BinanceFuturesClient.AssetBalance::availableBalance)
						.orElse(BigDecimal.ZERO)));
	}

	@Override
	public SymbolRules fetchSymbolRules(String symbol) {
		return execute("fetchSymbolRules", retry().defaults(), () -> client.fetchSymbolRules(symbol));
	}

	@Override
	public BigDecimal fetchLastPrice(String symbol) {
		return execute("fetchLastPrice", retry().status(), () -> client.fetchTickerPrice(symbol));
	}

	@Override
	public List<Candle> fetchRecentCandles(String symbol, String interval, int limit) {
		return execute("fetchKlines", retry().defaults(), () -> client.fetchKlines(symbol, interval, limit));
	}

	@Override
	public OrderSnapshot placeMarketOrder(String symbol, OrderSide side, BigDecimal quantity, boolean reduceOnly) {
		NewOrder order = new NewOrder(symbol, side, "MARKET", quantity, null, null, reduceOnly, null);
		return placeIdempotent("placeMarketOrder", order);
	}

	@Override
	public OrderSnapshot placeLimitOrder(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price) {
		NewOrder order = new NewOrder(symbol, side, "LIMIT", quantity, price, null, false, null);
		return placeIdempotent("placeLimitOrder", order);
	}

	@Override
	public OrderSnapshot placeStopMarketOrder(String symbol, OrderSide side, BigDecimal quantity,
			BigDecimal stopPrice) {
		NewOrder order = new NewOrder(symbol, side, "STOP_MARKET", quantity, null, stopPrice, true, null);
		return placeIdempotent("placeStopMarketOrder", order);
	}

	@Override
	public OrderSnapshot placeTakeProfitLimitOrder(String symbol, OrderSide side, BigDecimal quantity,
			BigDecimal price) {
		NewOrder order = new NewOrder(symbol, side, "LIMIT", quantity, price, null, true, null);
		return placeIdempotent("placeTakeProfitOrder", order);
	}

	@Override
	public OrderSnapshot fetchOrder(String symbol, long orderId) {
		return execute("fetchOrder", retry().status(), () -> client.fetchOrder(symbol, orderId)
				.map(OrderSnapshot::from));
	}

	@Override
	public boolean cancelOrder(String symbol, long orderId) {
		try {
			execute("cancelOrder", retry().cancel(), () -> client.cancelOrder(symbol, orderId));
			LOGGER.info("EVENT=ORDER_CANCELLED symbol={} orderId={}", symbol, orderId);
			return true;
		} catch (ExchangeException ex) {
			if (ex.getCause() instanceof BinanceApiException apiException
					&& (apiException.hasCode(BinanceApiException.UNKNOWN_ORDER)
							|| apiException.hasCode(BinanceApiException.NO_SUCH_ORDER))) {
				LOGGER.info("EVENT=ORDER_CANCEL_NOOP symbol={} orderId={} code={}", symbol, orderId,
						apiException.code());
				return false;
			}
			throw ex;
		}
	}

	@Override
	public Set<Long> fetchOpenOrderIds(String symbol) {
		return execute("fetchOpenOrders", retry().status(), () -> client.fetchOpenOrders(symbol)
				.map(orders -> (Set<Long>) new LinkedHashSet<>(orders.keySet())));
	}

	@Override
	public PositionSnapshot fetchPosition(String symbol) {
		return execute("fetchPosition", retry().status(), () -> client.fetchPosition(symbol)
				.map(position -> new PositionSnapshot(position.symbol(), position.positionAmt(),
						position.entryPrice())));
	}

	@Override
	public long measureLatency() {
		long started = System.nanoTime();
		execute("ping", retry().status(), () -> client.ping().thenReturn(Boolean.TRUE));
		long latency = Duration.ofNanos(System.nanoTime() - started).toMillis();
		lastLatencyMs.set(latency);
		return latency;
	}

	public long lastLatencyMs() {
		return lastLatencyMs.get();
	}

	@Override
	public FeedSubscription openCandleStream(String symbol, String interval, FeedListener listener) {
		return klineStreamClient.connect(symbol, interval, listener);
	}

	/**
	 * Order placement carries a fixed client order id across retries so a request that reached the exchange but
	 * lost its response cannot create a second order. When a retry is rejected as a duplicate, the order the
	 * earlier attempt created is looked up and returned.
	 */
	private OrderSnapshot placeIdempotent(String operation, NewOrder order) {
		String clientOrderId = "rt-" + UUID.randomUUID().toString().substring(0, 30);
		NewOrder stable = new NewOrder(order.symbol(), order.side(), order.type(), order.quantity(), order.price(),
				order.stopPrice(), order.reduceOnly(), clientOrderId);
		OrderSnapshot snapshot;
		try {
			snapshot = execute(operation, retry().placement(), () -> client.placeOrder(stable)
					.map(OrderSnapshot::from));
		} catch (ExchangeException ex) {
			if (!isDuplicateClientOrder(ex.getCause())) {
				throw ex;
			}
			LOGGER.warn("EVENT=ORDER_DUPLICATE_RECOVERED op={} symbol={} clientOrderId={}", operation,
					order.symbol(), clientOrderId);
			snapshot = execute("fetchOrder", retry().status(),
					() -> client.fetchOrderByClientId(order.symbol(), clientOrderId).map(OrderSnapshot::from));
		}
		LOGGER.info("EVENT=ORDER_PLACED op={} symbol={} side={} qty={} price={} stopPrice={} orderId={} status={}",
				operation, order.symbol(), order.side(), order.quantity(), order.price(), order.stopPrice(),
				snapshot.orderId(), snapshot.status());
		return snapshot;
	}

	private TradingProperties.Retry retry() {
		return tradingProperties.retry();
	}

	<T> T execute(String operation, TradingProperties.RetrySpec spec, Supplier<Mono<T>> call) {
		Mono<T> attempt = Mono.defer(() -> {
			try {
				throttle.acquire();
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				return Mono.error(ex);
			}
			return call.get().doFinally(signal -> throttle.release());
		});
		try {
			T result = attempt
					.retryWhen(Retry.backoff(spec.maxRetries(), spec.delay())
							.maxBackoff(spec.maxDelay())
							.jitter(spec.jitter())
							.scheduler(retryScheduler)
							.filter(BinanceExchangeGateway::isTransient)
							.doBeforeRetry(signal -> LOGGER.warn("EVENT=EXCHANGE_RETRY op={} attempt={} reason={}",
									operation, signal.totalRetries() + 1, signal.failure().getMessage()))
							.onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
					.block(CALL_TIMEOUT.plus(spec.maxDelay().multipliedBy(spec.maxRetries() + 1L)));
			if (result == null) {
				throw new ExchangeException(FailureKind.TRANSIENT, operation, "empty response", null);
			}
			return result;
		} catch (ExchangeException ex) {
			throw ex;
		} catch (RuntimeException ex) {
			Throwable cause = Exceptions.unwrap(ex);
			FailureKind kind = isTransient(cause) ? FailureKind.TRANSIENT : FailureKind.VALIDATION;
			LOGGER.error("EVENT=EXCHANGE_CALL_FAILED op={} kind={} reason={}", operation, kind, cause.getMessage());
			throw new ExchangeException(kind, operation, String.valueOf(cause.getMessage()), cause);
		}
	}

	static boolean isDuplicateClientOrder(Throwable error) {
		return error instanceof BinanceApiException apiException
				&& apiException.hasCode(BinanceApiException.DUPLICATE_CLIENT_ORDER_ID);
	}

	static boolean isTransient(Throwable error) {
		if (error instanceof BinanceApiException apiException) {
			return apiException.isTransient();
		}
		if (error instanceof WebClientRequestException || error instanceof TimeoutException
				|| error instanceof IOException) {
			return true;
		}
		// block(timeout) reports an exhausted wait as IllegalStateException wrapping a TimeoutException
		return error != null && error.getCause() instanceof TimeoutException;
	}
}
