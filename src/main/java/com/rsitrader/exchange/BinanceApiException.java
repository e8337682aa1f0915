package com.rsitrader.exchange;

import java.util.Set;

public class BinanceApiException extends RuntimeException {

	public static final int TIMESTAMP_OUTSIDE_RECV_WINDOW = -1021;
	public static final int UNKNOWN_ORDER = -2011;
	public static final int NO_SUCH_ORDER = -2013;
	public static final int DUPLICATE_CLIENT_ORDER_ID = -4116;

	private static final Set<Integer> TRANSIENT_CODES = Set.of(-1000, -1001, -1003, -1007,
			TIMESTAMP_OUTSIDE_RECV_WINDOW);

	private final Integer code;
	private final int httpStatus;

	public BinanceApiException(Integer code, int httpStatus, String message) {
		super(message);
		this.code = code;
		this.httpStatus = httpStatus;
	}

	public Integer code() {
		return code;
	}

	public int httpStatus() {
		return httpStatus;
	}

	public boolean hasCode(int expected) {
		return code != null && code == expected;
	}

	/**
	 * Server side failures, rate limiting and the listed exchange codes are worth another attempt. Everything
	 * else is a rejection of the request itself.
	 */
	public boolean isTransient() {
		if (httpStatus >= 500 || httpStatus == 429 || httpStatus == 418) {
			return true;
		}
		return code != null && TRANSIENT_CODES.contains(code);
	}
}
