package com.rsitrader.order;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import org.springframework.stereotype.Component;

/**
 * Owns every {@link Trade}. All reads and swaps go through one lock so that at most one trade is ever
 * non-terminal. No I/O happens while the lock is held.
 */
@Component
public class TradeRegistry {

	private static final int HISTORY_LIMIT = 500;

	private final Object lock = new Object();
	private final Map<String, Trade> active = new LinkedHashMap<>();
	private final List<Trade> history = new ArrayList<>();

	/**
	 * Registers a new OPENING trade unless another trade is still non-terminal.
	 */
	public boolean tryBegin(Trade trade) {
		synchronized (lock) {
			if (!active.isEmpty()) {
				return false;
			}
			active.put(trade.id(), trade);
			return true;
		}
	}

	/**
	 * Swaps the trade to {@code target} only if it is currently in {@code expected}.
	 *
	 * @return the new version, or empty when another caller already moved the trade on
	 */
	public Optional<Trade> compareAndTransition(String id, TradeStatus expected, TradeStatus target) {
		synchronized (lock) {
			Trade current = active.get(id);
			if (current == null || current.status() != expected) {
				return Optional.empty();
			}
			Trade updated = current.withStatus(target);
			active.put(id, updated);
			return Optional.of(updated);
		}
	}

	/**
	 * Applies {@code change} to the live version of the trade. Terminal results move the trade into history.
	 */
	public Optional<Trade> update(String id, UnaryOperator<Trade> change) {
		synchronized (lock) {
			Trade current = active.get(id);
			if (current == null) {
				return Optional.empty();
			}
			Trade updated = change.apply(current);
			if (updated.status().isTerminal()) {
				active.remove(id);
				history.add(updated);
				if (history.size() > HISTORY_LIMIT) {
					history.remove(0);
				}
			} else {
				active.put(id, updated);
			}
			return Optional.of(updated);
		}
	}

	public Optional<Trade> find(String id) {
		synchronized (lock) {
			Trade current = active.get(id);
			if (current != null) {
				return Optional.of(current);
			}
			for (int i = history.size() - 1; i >= 0; i--) {
				if (history.get(i).id().equals(id)) {
					return Optional.of(history.get(i));
				}
			}
			return Optional.empty();
		}
	}

	public Optional<Trade> active() {
		synchronized (lock) {
			return active.values().stream().findFirst();
		}
	}

	public List<Trade> activeTrades() {
		synchronized (lock) {
			return List.copyOf(active.values());
		}
	}

	public boolean hasActiveTrade() {
		synchronized (lock) {
			return !active.isEmpty();
		}
	}

	public List<Trade> history() {
		synchronized (lock) {
			return List.copyOf(history);
		}
	}
}
