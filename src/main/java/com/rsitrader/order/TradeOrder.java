package com.rsitrader.order;

import java.math.BigDecimal;

import com.rsitrader.exchange.OrderSide;
import com.rsitrader.exchange.OrderSnapshot;

public record TradeOrder(
		long exchangeOrderId,
		OrderSide side,
		String type,
		BigDecimal quantity,
		BigDecimal price,
		BigDecimal stopPrice,
		OrderStatus status,
		BigDecimal filledQty,
		BigDecimal avgFillPrice) {

	public static TradeOrder from(OrderSnapshot snapshot) {
		return new TradeOrder(
				snapshot.orderId(),
				snapshot.side(),
				snapshot.type(),
				snapshot.origQty(),
				snapshot.price(),
				snapshot.stopPrice(),
				OrderStatus.fromExchange(snapshot.status()),
				snapshot.executedQty(),
				snapshot.avgPrice());
	}

	public TradeOrder withStatus(OrderStatus newStatus) {
		return new TradeOrder(exchangeOrderId, side, type, quantity, price, stopPrice, newStatus, filledQty,
				avgFillPrice);
	}

	public TradeOrder filled(BigDecimal qty, BigDecimal fillPrice) {
		return new TradeOrder(exchangeOrderId, side, type, quantity, price, stopPrice, OrderStatus.FILLED, qty,
				fillPrice);
	}
}
