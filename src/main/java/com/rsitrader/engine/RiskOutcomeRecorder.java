package com.rsitrader.engine;

import org.springframework.stereotype.Component;

import com.rsitrader.order.ExitReason;
import com.rsitrader.order.Trade;
import com.rsitrader.order.TradeLifecycleSink;
import com.rsitrader.order.TradeStatus;
import com.rsitrader.risk.RiskManager;
import com.rsitrader.risk.TradeResult;

/**
 * Feeds realized trade outcomes into the risk counters. Failed entries and dropped ghosts carry no realized PnL
 * and are skipped.
 */
@Component
public class RiskOutcomeRecorder implements TradeLifecycleSink {

	private final RiskManager riskManager;

	public RiskOutcomeRecorder(RiskManager riskManager) {
		this.riskManager = riskManager;
	}

	@Override
	public void onTradeOpened(Trade trade) {
		// counted when the outcome is known
	}

	@Override
	public void onTradeClosed(Trade trade) {
		if (trade.status() != TradeStatus.CLOSED || trade.exitReason() == ExitReason.GHOST || trade.pnl() == null) {
			return;
		}
		riskManager.recordOutcome(trade.direction(), trade.entryPrice(), trade.quantity(),
				TradeResult.fromPnl(trade.pnl()), trade.pnl());
	}
}
