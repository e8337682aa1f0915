package com.rsitrader.order;

import java.math.BigDecimal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rsitrader.common.OperationResult;
import com.rsitrader.exchange.ExchangeException;
import com.rsitrader.exchange.ExchangeGateway;
import com.rsitrader.exchange.OrderSnapshot;
import com.rsitrader.signal.Direction;

/**
 * Places the reduce-only stop-loss / take-profit pair. Either both orders rest on the exchange or neither does.
 */
@Component
public class ProtectionPlacer {

	private static final Logger LOGGER = LoggerFactory.getLogger(ProtectionPlacer.class);

	private final ExchangeGateway gateway;

	public ProtectionPlacer(ExchangeGateway gateway) {
		this.gateway = gateway;
	}

	public OperationResult<ProtectionPair> place(String tradeId, String symbol, Direction direction,
			BigDecimal quantity, BigDecimal stop, BigDecimal target) {
		OrderSnapshot stopOrder;
		try {
			stopOrder = gateway.placeStopMarketOrder(symbol, direction.exitSide(), quantity, stop);
		} catch (ExchangeException ex) {
			LOGGER.error("EVENT=PROTECTION_FAILED tradeId={} leg=STOP kind={} reason={}", tradeId, ex.kind(),
					ex.getMessage());
			return OperationResult.failure(ex.kind(), "stop-loss placement failed: " + ex.getMessage());
		}
		OrderSnapshot targetOrder;
		try {
			targetOrder = gateway.placeTakeProfitLimitOrder(symbol, direction.exitSide(), quantity, target);
		} catch (ExchangeException ex) {
			LOGGER.error("EVENT=PROTECTION_FAILED tradeId={} leg=TARGET kind={} reason={}", tradeId, ex.kind(),
					ex.getMessage());
			cancelQuietly(tradeId, symbol, stopOrder.orderId());
			return OperationResult.failure(ex.kind(), "take-profit placement failed: " + ex.getMessage());
		}
		LOGGER.info("EVENT=PROTECTION_PLACED tradeId={} symbol={} stop={} target={} stopOrderId={} targetOrderId={}",
				tradeId, symbol, stop, target, stopOrder.orderId(), targetOrder.orderId());
		return OperationResult.success(new ProtectionPair(TradeOrder.from(stopOrder), TradeOrder.from(targetOrder)));
	}

	/**
	 * Cancels both legs. Orders the exchange no longer knows count as cancelled.
	 */
	public void cancel(String tradeId, String symbol, ProtectionPair pair) {
		cancelQuietly(tradeId, symbol, pair.stopOrder().exchangeOrderId());
		cancelQuietly(tradeId, symbol, pair.targetOrder().exchangeOrderId());
	}

	boolean cancelQuietly(String tradeId, String symbol, long orderId) {
		try {
			return gateway.cancelOrder(symbol, orderId);
		} catch (ExchangeException ex) {
			LOGGER.error("EVENT=PROTECTION_CANCEL_FAILED tradeId={} orderId={} reason={}", tradeId, orderId,
					ex.getMessage());
			return false;
		}
	}

	public record ProtectionPair(TradeOrder stopOrder, TradeOrder targetOrder) {
	}
}
