package com.rsitrader.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an operation that can fail for expected reasons. Either carries a value or a classified failure
 * with a human readable reason.
 */
public final class OperationResult<T> {

	private final T value;
	private final FailureKind failureKind;
	private final String reason;

	private OperationResult(T value, FailureKind failureKind, String reason) {
		this.value = value;
		this.failureKind = failureKind;
		this.reason = reason;
	}

	public static <T> OperationResult<T> success(T value) {
		return new OperationResult<>(Objects.requireNonNull(value, "value"), null, null);
	}

	public static <T> OperationResult<T> failure(FailureKind kind, String reason) {
		return new OperationResult<>(null, Objects.requireNonNull(kind, "kind"), reason);
	}

	public static <T> OperationResult<T> validation(String reason) {
		return failure(FailureKind.VALIDATION, reason);
	}

	public static <T> OperationResult<T> transientFailure(String reason) {
		return failure(FailureKind.TRANSIENT, reason);
	}

	public static <T> OperationResult<T> systemic(String reason) {
		return failure(FailureKind.SYSTEMIC, reason);
	}

	public boolean isSuccess() {
		return failureKind == null;
	}

	public T value() {
		if (!isSuccess()) {
			throw new IllegalStateException("No value for failed result: " + failureKind + " " + reason);
		}
		return value;
	}

	public Optional<T> toOptional() {
		return Optional.ofNullable(value);
	}

	public FailureKind failureKind() {
		return failureKind;
	}

	public String reason() {
		return reason;
	}

	public <R> OperationResult<R> map(Function<T, R> mapper) {
		if (!isSuccess()) {
			return new OperationResult<>(null, failureKind, reason);
		}
		return success(mapper.apply(value));
	}

	public <R> OperationResult<R> propagate() {
		if (isSuccess()) {
			throw new IllegalStateException("Cannot propagate a successful result");
		}
		return new OperationResult<>(null, failureKind, reason);
	}

	@Override
	public String toString() {
		return isSuccess() ? "OperationResult[success=" + value + "]"
				: "OperationResult[" + failureKind + " reason=" + reason + "]";
	}
}
