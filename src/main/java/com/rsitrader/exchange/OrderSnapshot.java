package com.rsitrader.exchange;

import java.math.BigDecimal;

import com.rsitrader.exchange.dto.OrderResponse;

/**
 * Exchange view of a single order at the time it was read.
 */
public record OrderSnapshot(
		long orderId,
		String type,
		OrderSide side,
		ExchangeOrderStatus status,
		BigDecimal origQty,
		BigDecimal executedQty,
		BigDecimal avgPrice,
		BigDecimal price,
		BigDecimal stopPrice) {

	public static OrderSnapshot from(OrderResponse response) {
		return new OrderSnapshot(
				response.orderId() == null ? -1L : response.orderId(),
				response.type(),
				response.side() == null ? null : OrderSide.valueOf(response.side()),
				ExchangeOrderStatus.parse(response.status()),
				zeroIfNull(response.origQty()),
				zeroIfNull(response.executedQty()),
				zeroIfNull(response.avgPrice()),
				zeroIfNull(response.price()),
				zeroIfNull(response.stopPrice()));
	}

	public boolean isFilled() {
		return status == ExchangeOrderStatus.FILLED;
	}

	/**
	 * Average fill price when the exchange reports one, otherwise the given fallback.
	 */
	public BigDecimal fillPriceOr(BigDecimal fallback) {
		if (avgPrice != null && avgPrice.signum() > 0) {
			return avgPrice;
		}
		return fallback;
	}

	private static BigDecimal zeroIfNull(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}
}
