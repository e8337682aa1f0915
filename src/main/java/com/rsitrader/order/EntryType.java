package com.rsitrader.order;

public enum EntryType {
	MARKET,
	LIMIT
}
