package com.rsitrader.exchange;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caps concurrent exchange calls and spaces their start times. Blocking; callers run on threads that are allowed
 * to block.
 */
public class RequestThrottle {

	private final Semaphore permits;
	private final long minSpacingNanos;
	private final AtomicLong nextSlotNanos = new AtomicLong(System.nanoTime());

	public RequestThrottle(int maxConcurrent, Duration minSpacing) {
		this.permits = new Semaphore(Math.max(1, maxConcurrent), true);
		this.minSpacingNanos = Math.max(0L, minSpacing.toNanos());
	}

	public void acquire() throws InterruptedException {
		if (!permits.tryAcquire(30, TimeUnit.SECONDS)) {
			throw new IllegalStateException("Timed out waiting for an exchange request permit");
		}
		long now = System.nanoTime();
		long slot = nextSlotNanos.getAndUpdate(previous -> Math.max(previous, now) + minSpacingNanos);
		long waitNanos = Math.max(slot, now) - now;
		if (waitNanos > 0) {
			try {
				TimeUnit.NANOSECONDS.sleep(waitNanos);
			} catch (InterruptedException ex) {
				permits.release();
				throw ex;
			}
		}
	}

	public void release() {
		permits.release();
	}

	public int availablePermits() {
		return permits.availablePermits();
	}
}
