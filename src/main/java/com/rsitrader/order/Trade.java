package com.rsitrader.order;

import java.math.BigDecimal;
import java.time.Instant;

import com.rsitrader.signal.Direction;

/**
 * One position from entry request to exit. Immutable; every state change produces a new version that
 * {@link TradeRegistry} swaps in under its lock.
 */
public record Trade(
		String id,
		String symbol,
		Direction direction,
		TradeStatus status,
		BigDecimal quantity,
		BigDecimal entryPrice,
		BigDecimal stopLoss,
		BigDecimal takeProfit,
		TradeOrder entryOrder,
		TradeOrder slOrder,
		TradeOrder tpOrder,
		BigDecimal exitPrice,
		BigDecimal pnl,
		ExitReason exitReason,
		Instant createdAt,
		Instant openedAt,
		Instant closedAt,
		boolean degradedFill,
		boolean protectionDeferred,
		String failureReason) {

	public static Trade opening(String id, String symbol, Direction direction, BigDecimal quantity,
			BigDecimal entryEstimate, BigDecimal stopLoss, BigDecimal takeProfit, Instant createdAt) {
		return new Trade(id, symbol, direction, TradeStatus.OPENING, quantity, entryEstimate, stopLoss, takeProfit,
				null, null, null, null, null, null, createdAt, null, null, false, false, null);
	}

	public boolean isActive() {
		return !status.isTerminal();
	}

	public boolean hasProtection() {
		return slOrder != null && tpOrder != null;
	}

	public Trade withStatus(TradeStatus newStatus) {
		return new Trade(id, symbol, direction, newStatus, quantity, entryPrice, stopLoss, takeProfit, entryOrder,
				slOrder, tpOrder, exitPrice, pnl, exitReason, createdAt, openedAt, closedAt, degradedFill,
				protectionDeferred, failureReason);
	}

	public Trade opened(TradeOrder fill, BigDecimal filledQty, BigDecimal fillPrice, BigDecimal stop,
			BigDecimal target, boolean degraded, boolean deferred, Instant at) {
		return new Trade(id, symbol, direction, TradeStatus.OPEN, filledQty, fillPrice, stop, target, fill, slOrder,
				tpOrder, exitPrice, pnl, exitReason, createdAt, at, closedAt, degraded, deferred, failureReason);
	}

	public Trade withProtection(TradeOrder stopOrder, TradeOrder targetOrder, BigDecimal stop, BigDecimal target) {
		return new Trade(id, symbol, direction, status, quantity, entryPrice, stop, target, entryOrder, stopOrder,
				targetOrder, exitPrice, pnl, exitReason, createdAt, openedAt, closedAt, degradedFill,
				protectionDeferred, failureReason);
	}

	public Trade closed(BigDecimal exit, BigDecimal realizedPnl, ExitReason reason, Instant at) {
		return new Trade(id, symbol, direction, TradeStatus.CLOSED, quantity, entryPrice, stopLoss, takeProfit,
				entryOrder, slOrder, tpOrder, exit, realizedPnl, reason, createdAt, openedAt, at, degradedFill,
				protectionDeferred, failureReason);
	}

	public Trade failed(String reason, Instant at) {
		return new Trade(id, symbol, direction, TradeStatus.FAILED, quantity, entryPrice, stopLoss, takeProfit,
				entryOrder, slOrder, tpOrder, exitPrice, pnl, exitReason, createdAt, openedAt, at, degradedFill,
				protectionDeferred, reason);
	}
}
