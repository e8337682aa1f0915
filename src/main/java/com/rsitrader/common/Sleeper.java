package com.rsitrader.common;

import java.time.Duration;

/**
 * Blocking pause used by polling and backoff loops. Tests substitute an implementation that advances a clock.
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper THREAD = duration -> Thread.sleep(Math.max(0L, duration.toMillis()));

	void sleep(Duration duration) throws InterruptedException;
}
