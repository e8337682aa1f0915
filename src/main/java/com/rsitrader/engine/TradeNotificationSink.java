package com.rsitrader.engine;

import org.springframework.stereotype.Component;

import com.rsitrader.notify.NotificationLevel;
import com.rsitrader.notify.Notifier;
import com.rsitrader.order.ExitReason;
import com.rsitrader.order.Trade;
import com.rsitrader.order.TradeLifecycleSink;
import com.rsitrader.order.TradeStatus;

@Component
public class TradeNotificationSink implements TradeLifecycleSink {

	private final Notifier notifier;

	public TradeNotificationSink(Notifier notifier) {
		this.notifier = notifier;
	}

	@Override
	public void onTradeOpened(Trade trade) {
		notifier.notify(trade.degradedFill() ? NotificationLevel.WARNING : NotificationLevel.INFO,
				trade.degradedFill() ? "TRADE_OPENED_DEGRADED" : "TRADE_OPENED",
				trade.id() + " " + trade.direction() + " qty=" + trade.quantity() + " entry=" + trade.entryPrice()
						+ " stop=" + trade.stopLoss() + " target=" + trade.takeProfit());
	}

	@Override
	public void onTradeClosed(Trade trade) {
		if (trade.status() == TradeStatus.FAILED) {
			notifier.notify(NotificationLevel.WARNING, "TRADE_FAILED", trade.id() + " " + trade.failureReason());
			return;
		}
		NotificationLevel level = trade.exitReason() == ExitReason.FORCED || trade.exitReason() == ExitReason.EMERGENCY
				? NotificationLevel.CRITICAL
				: NotificationLevel.INFO;
		notifier.notify(level, "TRADE_CLOSED_" + trade.exitReason(), trade.id() + " " + trade.direction() + " exit="
				+ trade.exitPrice() + " pnl=" + trade.pnl());
	}
}
