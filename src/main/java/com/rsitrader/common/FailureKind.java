package com.rsitrader.common;

public enum FailureKind {
	/** Rejected by a rule; retrying with the same input cannot succeed. */
	VALIDATION,
	/** Network or exchange hiccup that outlived the retry budget. */
	TRANSIENT,
	/** Global safety condition; requires operator action. */
	SYSTEMIC
}
