package com.rsitrader.exchange;

import com.rsitrader.common.FailureKind;

/**
 * Gateway level failure after retries, classified so callers can decide between rejecting, retrying later and
 * escalating.
 */
public class ExchangeException extends RuntimeException {

	private final FailureKind kind;
	private final String operation;

	public ExchangeException(FailureKind kind, String operation, String message, Throwable cause) {
		super(operation + ": " + message, cause);
		this.kind = kind;
		this.operation = operation;
	}

	public FailureKind kind() {
		return kind;
	}

	public String operation() {
		return operation;
	}

	public boolean isTransient() {
		return kind == FailureKind.TRANSIENT;
	}
}
