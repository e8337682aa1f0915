package com.rsitrader.order;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rsitrader.exchange.ExchangeGateway;

/**
 * Tracks protection orders per trade and diffs them against the exchange's open orders.
 */
@Component
public class OrderWatcher {

	private static final Logger LOGGER = LoggerFactory.getLogger(OrderWatcher.class);

	private final ExchangeGateway gateway;
	private final Map<String, TrackedPair> pairsByTrade = new ConcurrentHashMap<>();

	public OrderWatcher(ExchangeGateway gateway) {
		this.gateway = gateway;
	}

	public void track(String tradeId, long stopOrderId, long targetOrderId) {
		pairsByTrade.put(tradeId, new TrackedPair(stopOrderId, targetOrderId));
	}

	public void untrack(String tradeId) {
		pairsByTrade.remove(tradeId);
	}

	public boolean isTracking(String tradeId) {
		return pairsByTrade.containsKey(tradeId);
	}

	/**
	 * Reads the open orders of {@code symbol} once and reports which tracked protection orders are gone.
	 */
	public ProtectionState inspect(String symbol, String tradeId) {
		TrackedPair pair = pairsByTrade.get(tradeId);
		if (pair == null) {
			return ProtectionState.UNTRACKED;
		}
		Set<Long> open = gateway.fetchOpenOrderIds(symbol);
		boolean stopOpen = open.contains(pair.stopOrderId());
		boolean targetOpen = open.contains(pair.targetOrderId());
		ProtectionState state;
		if (stopOpen && targetOpen) {
			state = ProtectionState.BOTH_OPEN;
		} else if (!stopOpen && !targetOpen) {
			state = ProtectionState.BOTH_GONE;
		} else {
			state = stopOpen ? ProtectionState.TARGET_GONE : ProtectionState.STOP_GONE;
		}
		if (state != ProtectionState.BOTH_OPEN) {
			LOGGER.info("EVENT=PROTECTION_CHANGE tradeId={} state={} stopOrderId={} targetOrderId={} openOrders={}",
					tradeId, state, pair.stopOrderId(), pair.targetOrderId(), open.size());
		}
		return state;
	}

	public enum ProtectionState {
		BOTH_OPEN,
		STOP_GONE,
		TARGET_GONE,
		BOTH_GONE,
		UNTRACKED
	}

	private record TrackedPair(long stopOrderId, long targetOrderId) {
	}
}
