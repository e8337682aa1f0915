package com.rsitrader.exchange.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderResponse(
		Long orderId,
		String clientOrderId,
		String symbol,
		String status,
		String side,
		String type,
		BigDecimal origQty,
		BigDecimal executedQty,
		BigDecimal avgPrice,
		BigDecimal price,
		BigDecimal stopPrice,
		boolean reduceOnly,
		long updateTime) {
}
