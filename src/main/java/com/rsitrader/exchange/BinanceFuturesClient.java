package com.rsitrader.exchange;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.rsitrader.config.BinanceProperties;
import com.rsitrader.exchange.dto.OrderResponse;
import com.rsitrader.market.Candle;

import reactor.core.publisher.Mono;

/**
 * Reactive client for the USDⓈ-M futures REST API. Every signed call carries the server-time corrected
 * timestamp and is replayed once after a clock resync when the exchange rejects the timestamp.
 */
@Component
public class BinanceFuturesClient {

	private static final long DEFAULT_RECV_WINDOW_MS = 10_000L;
	private static final Pattern BINANCE_CODE_PATTERN = Pattern.compile("\"code\"\\s*:\\s*(-?\\d+)");

	private final WebClient futuresWebClient;
	private final BinanceProperties properties;
	private final SignatureUtil signatureUtil;
	private final ServerTimeSync serverTimeSync;

	public BinanceFuturesClient(WebClient futuresWebClient, BinanceProperties properties, SignatureUtil signatureUtil,
			ServerTimeSync serverTimeSync) {
		this.futuresWebClient = futuresWebClient;
		this.properties = properties;
		this.signatureUtil = signatureUtil;
		this.serverTimeSync = serverTimeSync;
	}

	public Mono<OrderResponse> placeOrder(NewOrder order) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("symbol", order.symbol());
		params.put("side", order.side().name());
		params.put("type", order.type());
		params.put("quantity", order.quantity().toPlainString());
		if (order.price() != null) {
			params.put("price", order.price().toPlainString());
			params.put("timeInForce", "GTC");
		}
		if (order.stopPrice() != null) {
			params.put("stopPrice", order.stopPrice().toPlainString());
			params.put("workingType", "MARK_PRICE");
		}
		if (order.reduceOnly()) {
			params.put("reduceOnly", "true");
		}
		params.put("newClientOrderId", order.clientOrderId() == null || order.clientOrderId().isBlank()
				? UUID.randomUUID().toString()
				: order.clientOrderId());
		params.put("newOrderRespType", "RESULT");
		return signed(HttpMethod.POST, "/fapi/v1/order", params, "Binance order failed", OrderResponse.class);
	}

	public Mono<OrderResponse> fetchOrder(String symbol, long orderId) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("symbol", symbol);
		params.put("orderId", Long.toString(orderId));
		return signed(HttpMethod.GET, "/fapi/v1/order", params, "Binance order query failed", OrderResponse.class);
	}

	public Mono<OrderResponse> fetchOrderByClientId(String symbol, String clientOrderId) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("symbol", symbol);
		params.put("origClientOrderId", clientOrderId);
		return signed(HttpMethod.GET, "/fapi/v1/order", params, "Binance order query failed", OrderResponse.class);
	}

	public Mono<OrderResponse> cancelOrder(String symbol, long orderId) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("symbol", symbol);
		params.put("orderId", Long.toString(orderId));
		return signed(HttpMethod.DELETE, "/fapi/v1/order", params, "Binance cancel failed", OrderResponse.class);
	}

	public Mono<Map<Long, OpenOrder>> fetchOpenOrders(String symbol) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("symbol", symbol);
		return signedFlux(HttpMethod.GET, "/fapi/v1/openOrders", params, "Binance open orders failed",
				new ParameterizedTypeReference<List<OpenOrder>>() { })
				.map(orders -> {
					Map<Long, OpenOrder> byId = new LinkedHashMap<>();
					orders.forEach(order -> byId.put(order.orderId(), order));
					return byId;
				});
	}

	public Mono<ExchangePosition> fetchPosition(String symbol) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("symbol", symbol);
		return signedFlux(HttpMethod.GET, "/fapi/v2/positionRisk", params, "Binance position query failed",
				new ParameterizedTypeReference<List<ExchangePosition>>() { })
				.map(positions -> positions.stream()
						.filter(position -> symbol.equalsIgnoreCase(position.symbol()))
						.reduce(ExchangePosition::merge)
						.orElseGet(() -> new ExchangePosition(symbol, BigDecimal.ZERO, BigDecimal.ZERO, "BOTH")));
	}

	public Mono<List<AssetBalance>> fetchBalances() {
		return signedFlux(HttpMethod.GET, "/fapi/v2/balance", new LinkedHashMap<>(), "Binance balance query failed",
				new ParameterizedTypeReference<List<AssetBalance>>() { });
	}

	public Mono<ExchangeInfoResponse> fetchExchangeInfo() {
		return futuresWebClient
				.get()
				.uri("/fapi/v1/exchangeInfo")
				.retrieve()
				.onStatus(status -> status.isError(), response -> response
						.bodyToMono(String.class)
						.defaultIfEmpty("<empty>")
						.flatMap(body -> Mono.error(toBinanceException("Binance exchange info failed",
								response.statusCode().value(), body))))
				.bodyToMono(ExchangeInfoResponse.class);
	}

	public Mono<SymbolRules> fetchSymbolRules(String symbol) {
		return fetchExchangeInfo()
				.flatMap(response -> response.symbols().stream()
						.filter(info -> symbol.equalsIgnoreCase(info.symbol()))
						.findFirst()
						.map(info -> Mono.just(resolveSymbolRules(info)))
						.orElseGet(() -> Mono.error(new IllegalArgumentException("Symbol not found: " + symbol))));
	}

	public Mono<BigDecimal> fetchTickerPrice(String symbol) {
		return futuresWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/fapi/v1/ticker/price")
						.queryParam("symbol", symbol)
						.build())
				.retrieve()
				.onStatus(status -> status.isError(), response -> response
						.bodyToMono(String.class)
						.defaultIfEmpty("<empty>")
						.flatMap(body -> Mono.error(toBinanceException("Binance ticker failed",
								response.statusCode().value(), body))))
				.bodyToMono(TickerPrice.class)
				.map(TickerPrice::price);
	}

	public Mono<List<Candle>> fetchKlines(String symbol, String interval, int limit) {
		return futuresWebClient
				.get()
				.uri(uriBuilder -> uriBuilder
						.path("/fapi/v1/klines")
						.queryParam("symbol", symbol)
						.queryParam("interval", interval)
						.queryParam("limit", limit)
						.build())
				.retrieve()
				.onStatus(status -> status.isError(), response -> response
						.bodyToMono(String.class)
						.defaultIfEmpty("<empty>")
						.flatMap(body -> Mono.error(toBinanceException("Binance klines failed",
								response.statusCode().value(), body))))
				.bodyToMono(JsonNode.class)
				.map(BinanceFuturesClient::parseKlines);
	}

	public Mono<Void> ping() {
		return futuresWebClient
				.get()
				.uri("/fapi/v1/ping")
				.retrieve()
				.onStatus(status -> status.isError(), response -> response
						.bodyToMono(String.class)
						.defaultIfEmpty("<empty>")
						.flatMap(body -> Mono.error(toBinanceException("Binance ping failed",
								response.statusCode().value(), body))))
				.bodyToMono(Void.class);
	}

	static List<Candle> parseKlines(JsonNode node) {
		if (node == null || !node.isArray()) {
			return List.of();
		}
		List<Candle> candles = new ArrayList<>();
		for (JsonNode entry : node) {
			if (!entry.isArray() || entry.size() < 7) {
				continue;
			}
			candles.add(new Candle(
					entry.get(0).asLong(),
					entry.get(1).asDouble(),
					entry.get(2).asDouble(),
					entry.get(3).asDouble(),
					entry.get(4).asDouble(),
					entry.get(5).asDouble(),
					entry.get(6).asLong()));
		}
		return candles;
	}

	public static SymbolRules resolveSymbolRules(SymbolInfo info) {
		BigDecimal minQty = null;
		BigDecimal minNotional = null;
		BigDecimal stepSize = null;
		BigDecimal tickSize = null;
		if (info.filters() != null) {
			for (ExchangeFilter filter : info.filters()) {
				if ("LOT_SIZE".equalsIgnoreCase(filter.filterType())) {
					minQty = filter.minQty();
					stepSize = filter.stepSize();
				}
				if ("MIN_NOTIONAL".equalsIgnoreCase(filter.filterType())
						|| "NOTIONAL".equalsIgnoreCase(filter.filterType())) {
					minNotional = filter.minNotional() != null ? filter.minNotional() : filter.notional();
				}
				if ("PRICE_FILTER".equalsIgnoreCase(filter.filterType())) {
					tickSize = filter.tickSize();
				}
			}
		}
		return new SymbolRules(info.symbol(), tickSize, stepSize, minQty, minNotional);
	}

	private <T> Mono<T> signed(HttpMethod method, String path, Map<String, String> params, String errorPrefix,
			Class<T> responseType) {
		return withCredentials(() -> withTimestampRetry(() -> signedSpec(method, path, params, errorPrefix)
				.bodyToMono(responseType)));
	}

	private <T> Mono<T> signedFlux(HttpMethod method, String path, Map<String, String> params, String errorPrefix,
			ParameterizedTypeReference<T> responseType) {
		return withCredentials(() -> withTimestampRetry(() -> signedSpec(method, path, params, errorPrefix)
				.bodyToMono(responseType)));
	}

	private WebClient.ResponseSpec signedSpec(HttpMethod method, String path, Map<String, String> params,
			String errorPrefix) {
		Map<String, String> stamped = new LinkedHashMap<>(params);
		long recvWindow = properties.recvWindowMillis() > 0 ? properties.recvWindowMillis() : DEFAULT_RECV_WINDOW_MS;
		stamped.put("recvWindow", Long.toString(recvWindow));
		stamped.put("timestamp", Long.toString(serverTimeSync.currentTimestampMillis()));
		String signedQuery = signatureUtil.signedQuery(stamped, properties.secretKey());
		return futuresWebClient
				.method(method)
				.uri(uriBuilder -> uriBuilder
						.path(path)
						.query(signedQuery)
						.build())
				.header(HttpHeaders.CONTENT_TYPE, "application/x-www-form-urlencoded")
				.header("X-MBX-APIKEY", properties.apiKey())
				.retrieve()
				.onStatus(status -> status.isError(), response -> response
						.bodyToMono(String.class)
						.defaultIfEmpty("<empty>")
						.flatMap(body -> Mono.error(toBinanceException(errorPrefix,
								response.statusCode().value(), body))));
	}

	private <T> Mono<T> withCredentials(Supplier<Mono<T>> requestSupplier) {
		if (properties.apiKey() == null || properties.apiKey().isBlank()
				|| properties.secretKey() == null || properties.secretKey().isBlank()) {
			return Mono.error(new IllegalStateException(
					"Binance API key/secret is not configured. Set BINANCE_API_KEY and BINANCE_SECRET_KEY."));
		}
		return Mono.defer(requestSupplier);
	}

	private <T> Mono<T> withTimestampRetry(Supplier<Mono<T>> requestSupplier) {
		return Mono.defer(requestSupplier)
				.onErrorResume(error -> {
					if (!isTimestampError(error)) {
						return Mono.error(error);
					}
					return serverTimeSync.syncNow()
							.then(Mono.defer(requestSupplier));
				});
	}

	private boolean isTimestampError(Throwable error) {
		if (error instanceof BinanceApiException exception) {
			return exception.hasCode(BinanceApiException.TIMESTAMP_OUTSIDE_RECV_WINDOW);
		}
		return false;
	}

	static BinanceApiException toBinanceException(String prefix, int status, String body) {
		return new BinanceApiException(extractCode(body), status,
				prefix + " with status=" + status + ", body=" + body);
	}

	static Integer extractCode(String body) {
		if (body == null) {
			return null;
		}
		Matcher matcher = BINANCE_CODE_PATTERN.matcher(body);
		if (!matcher.find()) {
			return null;
		}
		try {
			return Integer.parseInt(matcher.group(1));
		} catch (NumberFormatException ignored) {
			return null;
		}
	}

	public record NewOrder(
			String symbol,
			OrderSide side,
			String type,
			BigDecimal quantity,
			BigDecimal price,
			BigDecimal stopPrice,
			boolean reduceOnly,
			String clientOrderId) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ExchangePosition(
			String symbol,
			BigDecimal positionAmt,
			BigDecimal entryPrice,
			String positionSide) {

		ExchangePosition merge(ExchangePosition other) {
			BigDecimal amount = positionAmt.add(other.positionAmt());
			BigDecimal price = positionAmt.signum() != 0 ? entryPrice : other.entryPrice();
			return new ExchangePosition(symbol, amount, price, positionSide);
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record OpenOrder(
			String symbol,
			long orderId,
			String clientOrderId,
			String status,
			String side,
			String type,
			BigDecimal origQty,
			BigDecimal executedQty,
			long updateTime,
			boolean reduceOnly) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record AssetBalance(
			String asset,
			BigDecimal balance,
			BigDecimal availableBalance) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	private record TickerPrice(String symbol, BigDecimal price) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ExchangeInfoResponse(
			List<SymbolInfo> symbols) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record SymbolInfo(
			String symbol,
			String quoteAsset,
			List<ExchangeFilter> filters) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ExchangeFilter(
			String filterType,
			BigDecimal minQty,
			BigDecimal minNotional,
			BigDecimal notional,
			BigDecimal stepSize,
			BigDecimal tickSize) {
	}
}
