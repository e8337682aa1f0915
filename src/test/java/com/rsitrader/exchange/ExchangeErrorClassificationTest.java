package com.rsitrader.exchange;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;

class ExchangeErrorClassificationTest {

	@Test
	void extractsBinanceErrorCodeFromBody() {
		BinanceApiException exception = BinanceFuturesClient.toBinanceException("Order failed", 400,
				"{\"code\":-2019,\"msg\":\"Margin is insufficient.\"}");

		assertThat(exception.code()).isEqualTo(-2019);
		assertThat(exception.httpStatus()).isEqualTo(400);
		assertThat(exception.getMessage()).contains("Margin is insufficient.");
		assertThat(BinanceFuturesClient.extractCode("<html>bad gateway</html>")).isNull();
	}

	@Test
	void serverErrorsAndRateLimitsAreTransient() {
		assertThat(new BinanceApiException(null, 502, "bad gateway").isTransient()).isTrue();
		assertThat(new BinanceApiException(-1003, 429, "too many requests").isTransient()).isTrue();
		assertThat(new BinanceApiException(BinanceApiException.TIMESTAMP_OUTSIDE_RECV_WINDOW, 400, "timestamp")
				.isTransient()).isTrue();
	}

	@Test
	void rejectionsAreNotTransient() {
		assertThat(new BinanceApiException(-2019, 400, "margin").isTransient()).isFalse();
		assertThat(new BinanceApiException(-1111, 400, "precision").isTransient()).isFalse();
	}

	@Test
	void gatewayTreatsIoAndTimeoutsAsTransient() {
		assertThat(BinanceExchangeGateway.isTransient(new IOException("connection reset"))).isTrue();
		assertThat(BinanceExchangeGateway.isTransient(new TimeoutException())).isTrue();
		assertThat(BinanceExchangeGateway.isTransient(new IllegalStateException("timeout", new TimeoutException())))
				.isTrue();
		assertThat(BinanceExchangeGateway.isTransient(new IllegalArgumentException("bad quantity"))).isFalse();
		assertThat(BinanceExchangeGateway.isTransient(new BinanceApiException(-2011, 400, "unknown order")))
				.isFalse();
	}

	@Test
	void duplicateClientOrderIdIsRecognisedAsAlreadyPlaced() {
		BinanceApiException duplicate = BinanceFuturesClient.toBinanceException("Order failed", 400,
				"{\"code\":-4116,\"msg\":\"ClientOrderId is duplicated.\"}");

		assertThat(duplicate.isTransient()).isFalse();
		assertThat(BinanceExchangeGateway.isDuplicateClientOrder(duplicate)).isTrue();
		assertThat(BinanceExchangeGateway.isDuplicateClientOrder(new BinanceApiException(-2019, 400, "margin")))
				.isFalse();
		assertThat(BinanceExchangeGateway.isDuplicateClientOrder(new IOException("connection reset"))).isFalse();
	}
}
