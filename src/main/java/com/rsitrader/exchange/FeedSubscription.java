package com.rsitrader.exchange;

public interface FeedSubscription {

	void close();

	boolean isClosed();
}
