package com.rsitrader.order;

import com.rsitrader.exchange.ExchangeOrderStatus;

public enum OrderStatus {
	PENDING,
	FILLED,
	CANCELLED,
	FAILED;

	static OrderStatus fromExchange(ExchangeOrderStatus status) {
		if (status == null) {
			return PENDING;
		}
		return switch (status) {
			case FILLED -> FILLED;
			case CANCELED, EXPIRED -> CANCELLED;
			case REJECTED -> FAILED;
			default -> PENDING;
		};
	}
}
