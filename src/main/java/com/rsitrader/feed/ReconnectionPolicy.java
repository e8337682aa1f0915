package com.rsitrader.feed;

import java.time.Duration;

/**
 * Exponential reconnect backoff: {@code min(base * 2^(attempt - 1), max)}. A max attempt count of zero means
 * unlimited.
 */
public class ReconnectionPolicy {

	private final Duration baseDelay;
	private final Duration maxDelay;
	private final int maxAttempts;

	public ReconnectionPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {
		if (baseDelay.isNegative() || baseDelay.isZero()) {
			throw new IllegalArgumentException("Base delay must be positive");
		}
		if (baseDelay.compareTo(maxDelay) > 0) {
			throw new IllegalArgumentException("Base delay cannot exceed max delay");
		}
		if (maxAttempts < 0) {
			throw new IllegalArgumentException("Max attempts must not be negative");
		}
		this.baseDelay = baseDelay;
		this.maxDelay = maxDelay;
		this.maxAttempts = maxAttempts;
	}

	public Duration delayFor(int attempt) {
		if (attempt < 1) {
			throw new IllegalArgumentException("Attempt numbers start at 1");
		}
		// 2^62 already overflows any realistic cap
		int exponent = Math.min(attempt - 1, 62);
		long factor = 1L << exponent;
		long baseMillis = baseDelay.toMillis();
		if (baseMillis > maxDelay.toMillis() / factor) {
			return maxDelay;
		}
		return Duration.ofMillis(Math.min(baseMillis * factor, maxDelay.toMillis()));
	}

	public boolean isExhausted(int attemptsMade) {
		return maxAttempts > 0 && attemptsMade >= maxAttempts;
	}

	public int maxAttempts() {
		return maxAttempts;
	}
}
