package com.rsitrader.order;

/**
 * Receives trade lifecycle events. Called on the thread that made the transition, never under a lock.
 */
public interface TradeLifecycleSink {

	void onTradeOpened(Trade trade);

	void onTradeClosed(Trade trade);
}
