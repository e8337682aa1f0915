package com.rsitrader.order;

public enum TradeStatus {
	OPENING,
	OPEN,
	CLOSING,
	CLOSED,
	FAILED;

	public boolean isTerminal() {
		return this == CLOSED || this == FAILED;
	}
}
