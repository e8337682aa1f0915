package com.rsitrader.order;

import java.math.BigDecimal;
import java.time.Instant;

import com.rsitrader.signal.Direction;

/**
 * Deferred stop-loss / take-profit request for one trade. Mutable; only touched under the coordinator's mutex.
 */
final class PendingProtection {

	final String tradeId;
	final String symbol;
	final Direction direction;
	final BigDecimal quantity;
	final BigDecimal originalStop;
	final BigDecimal originalTarget;
	final Instant entryCandleCloseDeadline;
	final DeferredProtectionCoordinator.PlacementCallback callback;
	boolean placed;
	Instant processingStartedAt;
	String lockToken;
	BigDecimal finalStop;
	BigDecimal finalTarget;
	Instant completedAt;
	int attempts;

	PendingProtection(Trade trade, Instant deadline, DeferredProtectionCoordinator.PlacementCallback callback) {
		this.tradeId = trade.id();
		this.symbol = trade.symbol();
		this.direction = trade.direction();
		this.quantity = trade.quantity();
		this.originalStop = trade.stopLoss();
		this.originalTarget = trade.takeProfit();
		this.entryCandleCloseDeadline = deadline;
		this.callback = callback;
	}

	boolean inFlight() {
		return processingStartedAt != null;
	}

	void clearClaim() {
		processingStartedAt = null;
		lockToken = null;
	}

	ProtectionStatus toStatus() {
		return new ProtectionStatus(tradeId, direction, entryCandleCloseDeadline, placed, inFlight(), attempts,
				originalStop, originalTarget, finalStop, finalTarget, completedAt);
	}
}
