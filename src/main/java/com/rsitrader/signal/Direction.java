package com.rsitrader.signal;

import java.math.BigDecimal;

import com.rsitrader.exchange.OrderSide;

public enum Direction {
	LONG(OrderSide.BUY),
	SHORT(OrderSide.SELL);

	private final OrderSide entrySide;

	Direction(OrderSide entrySide) {
		this.entrySide = entrySide;
	}

	public OrderSide entrySide() {
		return entrySide;
	}

	public OrderSide exitSide() {
		return entrySide.opposite();
	}

	public Direction opposite() {
		return this == LONG ? SHORT : LONG;
	}

	/**
	 * Signed price move in favour of this direction.
	 */
	public BigDecimal favourableMove(BigDecimal from, BigDecimal to) {
		BigDecimal move = to.subtract(from);
		return this == LONG ? move : move.negate();
	}
}
