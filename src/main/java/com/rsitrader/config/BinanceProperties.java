package com.rsitrader.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

@Validated
@ConfigurationProperties(prefix = "binance")
public record BinanceProperties(
		@NotBlank String baseUrl,
		@NotBlank String testnetBaseUrl,
		@NotBlank String streamBaseUrl,
		@NotBlank String testnetStreamBaseUrl,
		boolean useTestnet,
		String apiKey,
		String secretKey,
		long recvWindowMillis,
		int connectTimeoutMs,
		long responseTimeoutMs,
		long handshakeTimeoutMs) {

	public String resolvedBaseUrl() {
		return useTestnet ? testnetBaseUrl : baseUrl;
	}

	public String resolvedStreamBaseUrl() {
		return useTestnet ? testnetStreamBaseUrl : streamBaseUrl;
	}
}
