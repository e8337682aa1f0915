package com.rsitrader.feed;

public enum ConnectionState {
	DISCONNECTED,
	CONNECTED,
	RECONNECTING,
	/** Reconnected recently; new trades need two consistent flat position reads. */
	SAFE_MODE
}
