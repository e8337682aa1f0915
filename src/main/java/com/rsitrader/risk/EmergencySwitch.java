package com.rsitrader.risk;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide one-way stop. Once tripped it stays tripped until an operator overrides it; every loop checks it
 * on each iteration.
 */
@Component
public class EmergencySwitch {

	private static final Logger LOGGER = LoggerFactory.getLogger(EmergencySwitch.class);

	private final Clock clock;
	private final AtomicReference<Trip> trip = new AtomicReference<>();
	private final List<Consumer<String>> listeners = new CopyOnWriteArrayList<>();

	public EmergencySwitch(Clock clock) {
		this.clock = clock;
	}

	/**
	 * @return {@code true} when this call tripped the switch, {@code false} when it was already tripped
	 */
	public boolean trip(String reason) {
		Trip created = new Trip(reason, clock.instant());
		if (!trip.compareAndSet(null, created)) {
			LOGGER.warn("EVENT=EMERGENCY_ALREADY_TRIPPED reason={} original={}", reason, trip.get().reason());
			return false;
		}
		LOGGER.error("EVENT=EMERGENCY_TRIPPED reason={}", reason);
		for (Consumer<String> listener : listeners) {
			try {
				listener.accept(reason);
			} catch (RuntimeException ex) {
				LOGGER.error("EVENT=EMERGENCY_LISTENER_FAILED reason={}", ex.getMessage(), ex);
			}
		}
		return true;
	}

	public boolean isTripped() {
		return trip.get() != null;
	}

	public Optional<String> reason() {
		Trip current = trip.get();
		return current == null ? Optional.empty() : Optional.of(current.reason());
	}

	public Optional<Instant> trippedAt() {
		Trip current = trip.get();
		return current == null ? Optional.empty() : Optional.of(current.at());
	}

	public boolean override(String operator) {
		Trip previous = trip.getAndSet(null);
		if (previous == null) {
			return false;
		}
		LOGGER.warn("EVENT=EMERGENCY_OVERRIDE operator={} previousReason={} trippedAt={}", operator,
				previous.reason(), previous.at());
		return true;
	}

	public void addListener(Consumer<String> listener) {
		listeners.add(listener);
	}

	private record Trip(String reason, Instant at) {
	}
}
