package com.rsitrader.signal;

public enum LatchPolicy {
	/** Once armed, a direction stays pending until confirmed, replaced or reset. */
	LATCHED,
	/** A pending direction is dropped as soon as its oscillator condition stops holding. */
	RECONFIRM
}
