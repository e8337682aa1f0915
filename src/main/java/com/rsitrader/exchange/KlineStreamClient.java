package com.rsitrader.exchange;

import java.net.URI;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rsitrader.config.BinanceProperties;
import com.rsitrader.market.Candle;
import com.rsitrader.market.dto.KlineEvent;

import reactor.core.Disposable;

/**
 * Opens a single kline websocket connection. It does not reconnect on its own: the connection supervisor owns
 * reconnection so that backoff and reconciliation happen in one place.
 */
@Component
public class KlineStreamClient {

	private static final Logger LOGGER = LoggerFactory.getLogger(KlineStreamClient.class);

	private final BinanceProperties binanceProperties;
	private final ObjectMapper objectMapper;
	private final ReactorNettyWebSocketClient webSocketClient;

	public KlineStreamClient(BinanceProperties binanceProperties, ObjectMapper objectMapper,
			ReactorNettyWebSocketClient klineWebSocketClient) {
		this.binanceProperties = binanceProperties;
		this.objectMapper = objectMapper;
		this.webSocketClient = klineWebSocketClient;
	}

	public FeedSubscription connect(String symbol, String interval, FeedListener listener) {
		URI uri = URI.create(streamUrl(symbol, interval));
		AtomicBoolean finished = new AtomicBoolean(false);
		LOGGER.info("EVENT=KLINE_STREAM_CONNECT symbol={} interval={} uri={}", symbol, interval, uri);
		Disposable disposable = webSocketClient.execute(uri, session -> {
			listener.onConnected();
			return session.receive()
					.filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
					.map(WebSocketMessage::getPayloadAsText)
					.doOnNext(payload -> handlePayload(payload, listener))
					.then();
		}).subscribe(
				ignored -> { },
				error -> {
					if (finished.compareAndSet(false, true)) {
						LOGGER.warn("EVENT=KLINE_STREAM_ERROR symbol={} reason={}", symbol, error.getMessage());
						listener.onDisconnected(error);
					}
				},
				() -> {
					if (finished.compareAndSet(false, true)) {
						LOGGER.warn("EVENT=KLINE_STREAM_CLOSED symbol={}", symbol);
						listener.onDisconnected(null);
					}
				});
		return new DisposableSubscription(disposable, finished);
	}

	void handlePayload(String payload, FeedListener listener) {
		try {
			JsonNode node = objectMapper.readTree(payload);
			JsonNode dataNode = node.has("data") ? node.get("data") : node;
			KlineEvent event = objectMapper.treeToValue(dataNode, KlineEvent.class);
			if (event == null || event.kline() == null || !event.kline().closed()) {
				return;
			}
			Candle candle = event.kline().toCandle();
			listener.onCandleClosed(candle);
		} catch (Exception ex) {
			LOGGER.warn("EVENT=KLINE_PARSE_FAIL reason={}", ex.getMessage());
		}
	}

	String streamUrl(String symbol, String interval) {
		String base = binanceProperties.resolvedStreamBaseUrl();
		if (!base.endsWith("/")) {
			base = base + "/";
		}
		return base + "ws/" + symbol.toLowerCase(Locale.ROOT) + "@kline_" + interval;
	}

	private static final class DisposableSubscription implements FeedSubscription {

		private final Disposable disposable;
		private final AtomicBoolean finished;

		private DisposableSubscription(Disposable disposable, AtomicBoolean finished) {
			this.disposable = disposable;
			this.finished = finished;
		}

		@Override
		public void close() {
			// a deliberate close is not reported as a disconnect
			finished.set(true);
			disposable.dispose();
		}

		@Override
		public boolean isClosed() {
			return finished.get() || disposable.isDisposed();
		}
	}
}
