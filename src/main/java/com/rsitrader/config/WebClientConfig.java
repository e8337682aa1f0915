package com.rsitrader.config;

import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rsitrader.common.Sleeper;

import io.netty.channel.ChannelOption;
import reactor.netty.http.Http11SslContextSpec;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

	private static final int DEFAULT_CONNECT_TIMEOUT_MS = 5000;
	private static final long DEFAULT_RESPONSE_TIMEOUT_MS = 10000;
	private static final long DEFAULT_HANDSHAKE_TIMEOUT_MS = 10000;

	@Bean
	public WebClient.Builder webClientBuilder() {
		return WebClient.builder();
	}

	@Bean
	public WebClient futuresWebClient(BinanceProperties properties, WebClient.Builder builder, DataSize maxInMemorySize) {
		ReactorClientHttpConnector connector = new ReactorClientHttpConnector(configureHttpClient(properties));
		return builder
				.baseUrl(properties.resolvedBaseUrl())
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.clientConnector(connector)
				.exchangeStrategies(exchangeStrategies(maxInMemorySize))
				.build();
	}

	@Bean
	public ReactorNettyWebSocketClient klineWebSocketClient(BinanceProperties properties) {
		return new ReactorNettyWebSocketClient(HttpClient.create()
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout(properties)));
	}

	ExchangeStrategies exchangeStrategies(DataSize maxInMemorySize) {
		return ExchangeStrategies.builder()
				.codecs(configurer -> configurer.defaultCodecs()
						.maxInMemorySize((int) maxInMemorySize.toBytes()))
				.build();
	}

	@Bean
	public DataSize maxInMemorySize(@Value("${spring.codec.max-in-memory-size:5MB}") DataSize maxInMemorySize) {
		return maxInMemorySize;
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public Sleeper sleeper() {
		return Sleeper.THREAD;
	}

	@Bean
	public ObjectMapper objectMapper() {
		return new ObjectMapper().findAndRegisterModules();
	}

	HttpClient configureHttpClient(BinanceProperties properties) {
		long responseTimeout = properties.responseTimeoutMs() > 0
				? properties.responseTimeoutMs()
				: DEFAULT_RESPONSE_TIMEOUT_MS;
		long handshakeTimeout = properties.handshakeTimeoutMs() > 0
				? properties.handshakeTimeoutMs()
				: DEFAULT_HANDSHAKE_TIMEOUT_MS;
		return HttpClient.create()
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout(properties))
				.responseTimeout(Duration.ofMillis(responseTimeout))
				.secure(ssl -> ssl.sslContext(Http11SslContextSpec.forClient())
						.handshakeTimeout(Duration.ofMillis(handshakeTimeout)));
	}

	private int connectTimeout(BinanceProperties properties) {
		return properties.connectTimeoutMs() > 0 ? properties.connectTimeoutMs() : DEFAULT_CONNECT_TIMEOUT_MS;
	}
}
