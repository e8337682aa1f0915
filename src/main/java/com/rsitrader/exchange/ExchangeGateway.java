package com.rsitrader.exchange;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import com.rsitrader.market.Candle;

/**
 * Blocking, retrying view of the exchange used by the trading components. Implementations retry transient
 * failures internally and surface anything left as {@link ExchangeException}.
 */
public interface ExchangeGateway {

	BigDecimal fetchAvailableBalance();

	SymbolRules fetchSymbolRules(String symbol);

	BigDecimal fetchLastPrice(String symbol);

	List<Candle> fetchRecentCandles(String symbol, String interval, int limit);

	OrderSnapshot placeMarketOrder(String symbol, OrderSide side, BigDecimal quantity, boolean reduceOnly);

	OrderSnapshot placeLimitOrder(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price);

	/** Reduce-only stop-market order. */
	OrderSnapshot placeStopMarketOrder(String symbol, OrderSide side, BigDecimal quantity, BigDecimal stopPrice);

	/** Reduce-only resting limit order. */
	OrderSnapshot placeTakeProfitLimitOrder(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price);

	OrderSnapshot fetchOrder(String symbol, long orderId);

	/**
	 * @return {@code false} when the exchange no longer knows the order as open
	 */
	boolean cancelOrder(String symbol, long orderId);

	Set<Long> fetchOpenOrderIds(String symbol);

	PositionSnapshot fetchPosition(String symbol);

	/** Round trip time of a lightweight request, in milliseconds. */
	long measureLatency();

	FeedSubscription openCandleStream(String symbol, String interval, FeedListener listener);
}
