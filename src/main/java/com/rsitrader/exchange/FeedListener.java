package com.rsitrader.exchange;

import com.rsitrader.market.Candle;

/**
 * Receives the lifecycle and payload of one candle stream connection.
 */
public interface FeedListener {

	void onConnected();

	void onCandleClosed(Candle candle);

	/**
	 * Called once when the connection ends, with {@code null} when the server completed the stream normally.
	 */
	void onDisconnected(Throwable cause);
}
