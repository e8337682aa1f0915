package com.rsitrader.order;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rsitrader.common.OperationResult;
import com.rsitrader.common.Sleeper;
import com.rsitrader.config.TradingProperties;
import com.rsitrader.exchange.ExchangeException;
import com.rsitrader.exchange.ExchangeGateway;
import com.rsitrader.exchange.OrderSnapshot;
import com.rsitrader.exchange.SymbolRules;
import com.rsitrader.signal.Direction;

/**
 * Gets a position on. LIMIT entries rest slightly inside the current price and are polled until the fill timeout;
 * after that they are cancelled and, when allowed, completed at market as a degraded fill.
 */
@Component
public class EntryOrderExecutor {

	private static final Logger LOGGER = LoggerFactory.getLogger(EntryOrderExecutor.class);
	private static final MathContext MC = MathContext.DECIMAL64;
	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	private final ExchangeGateway gateway;
	private final PositionFlattener flattener;
	private final TradingProperties.Order settings;
	private final Clock clock;
	private final Sleeper sleeper;

	public EntryOrderExecutor(ExchangeGateway gateway, PositionFlattener flattener,
			TradingProperties tradingProperties, Clock clock, Sleeper sleeper) {
		this.gateway = gateway;
		this.flattener = flattener;
		this.settings = tradingProperties.order();
		this.clock = clock;
		this.sleeper = sleeper;
	}

	public OperationResult<EntryFill> execute(String symbol, Direction direction, BigDecimal quantity,
			SymbolRules rules) {
		try {
			return settings.entryType() == EntryType.MARKET
					? marketEntry(symbol, direction, quantity)
					: limitEntry(symbol, direction, quantity, rules);
		} catch (ExchangeException ex) {
			LOGGER.error("EVENT=ENTRY_FAILED symbol={} direction={} kind={} reason={}", symbol, direction, ex.kind(),
					ex.getMessage());
			return OperationResult.failure(ex.kind(), ex.getMessage());
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			return OperationResult.transientFailure("interrupted while waiting for entry fill");
		}
	}

	private OperationResult<EntryFill> marketEntry(String symbol, Direction direction, BigDecimal quantity)
			throws InterruptedException {
		OrderSnapshot placed = gateway.placeMarketOrder(symbol, direction.entrySide(), quantity, false);
		OrderSnapshot result = placed.isFilled() ? placed : awaitTerminal(symbol, placed);
		if (!result.isFilled()) {
			LOGGER.error("EVENT=ENTRY_MARKET_UNFILLED symbol={} orderId={} status={}", symbol, result.orderId(),
					result.status());
			return OperationResult.transientFailure("market entry " + result.orderId() + " ended " + result.status());
		}
		BigDecimal price = result.fillPriceOr(gateway.fetchLastPrice(symbol));
		BigDecimal filled = filledQuantity(result, quantity);
		LOGGER.info("EVENT=ENTRY_FILLED type=MARKET symbol={} direction={} qty={} price={}", symbol, direction,
				filled, price);
		return OperationResult.success(new EntryFill(TradeOrder.from(result).filled(filled, price), filled, price,
				false));
	}

	private OperationResult<EntryFill> limitEntry(String symbol, Direction direction, BigDecimal quantity,
			SymbolRules rules) throws InterruptedException {
		BigDecimal reference = gateway.fetchLastPrice(symbol);
		BigDecimal limitPrice = limitPrice(direction, reference, rules);
		OrderSnapshot placed = gateway.placeLimitOrder(symbol, direction.entrySide(), quantity, limitPrice);
		LOGGER.info("EVENT=ENTRY_LIMIT_PLACED symbol={} direction={} qty={} price={} reference={} orderId={}", symbol,
				direction, quantity, limitPrice, reference, placed.orderId());
		OrderSnapshot result = placed.isFilled() ? placed : awaitTerminal(symbol, placed);
		if (result.isFilled()) {
			BigDecimal price = result.fillPriceOr(limitPrice);
			LOGGER.info("EVENT=ENTRY_FILLED type=LIMIT symbol={} direction={} qty={} price={}", symbol, direction,
					quantity, price);
			return OperationResult.success(new EntryFill(TradeOrder.from(result).filled(quantity, price), quantity,
					price, false));
		}
		if (result.status().isOpen()) {
			boolean cancelled = gateway.cancelOrder(symbol, placed.orderId());
			result = gateway.fetchOrder(symbol, placed.orderId());
			LOGGER.warn("EVENT=ENTRY_LIMIT_TIMEOUT symbol={} orderId={} cancelled={} status={} executedQty={}", symbol,
					placed.orderId(), cancelled, result.status(), result.executedQty());
			if (result.isFilled()) {
				BigDecimal price = result.fillPriceOr(limitPrice);
				return OperationResult.success(new EntryFill(TradeOrder.from(result).filled(quantity, price),
						quantity, price, false));
			}
		}
		BigDecimal partial = result.executedQty() == null ? BigDecimal.ZERO : result.executedQty();
		if (!settings.marketFallback()) {
			if (partial.signum() > 0) {
				flattener.exit(symbol, direction, partial, "limit entry partially filled, fallback disabled");
			}
			LOGGER.warn("EVENT=ENTRY_REJECTED symbol={} orderId={} reason=limit_not_filled fallback=false", symbol,
					placed.orderId());
			return OperationResult.validation("limit entry " + placed.orderId() + " not filled within "
					+ settings.fillTimeout() + " and market fallback is disabled");
		}
		return marketFallback(symbol, direction, quantity, limitPrice, result, partial);
	}

	private OperationResult<EntryFill> marketFallback(String symbol, Direction direction, BigDecimal quantity,
			BigDecimal limitPrice, OrderSnapshot limitResult, BigDecimal partial) throws InterruptedException {
		BigDecimal remaining = quantity.subtract(partial);
		OrderSnapshot market = gateway.placeMarketOrder(symbol, direction.entrySide(), remaining, false);
		if (!market.isFilled()) {
			market = awaitTerminal(symbol, market);
		}
		BigDecimal marketPrice = market.fillPriceOr(gateway.fetchLastPrice(symbol));
		BigDecimal averagePrice = partial.signum() > 0
				? partial.multiply(limitResult.fillPriceOr(limitPrice), MC)
						.add(remaining.multiply(marketPrice, MC), MC)
						.divide(quantity, MC)
				: marketPrice;
		BigDecimal slippagePct = averagePrice.subtract(limitPrice).abs()
				.multiply(HUNDRED, MC)
				.divide(limitPrice, MC);
		LOGGER.warn("EVENT=ENTRY_MARKET_FALLBACK symbol={} direction={} qty={} limitPrice={} avgPrice={} slippagePct={}",
				symbol, direction, quantity, limitPrice, averagePrice, slippagePct);
		if (slippagePct.compareTo(settings.maxSlippagePercent()) > 0) {
			flattener.exit(symbol, direction, quantity, "fallback slippage " + slippagePct + "%");
			LOGGER.error("EVENT=ENTRY_SLIPPAGE_EXCEEDED symbol={} slippagePct={} max={}", symbol, slippagePct,
					settings.maxSlippagePercent());
			return OperationResult.validation("fallback slippage " + slippagePct.setScale(4, RoundingMode.HALF_UP)
					+ "% exceeds " + settings.maxSlippagePercent() + "%");
		}
		TradeOrder order = TradeOrder.from(market).filled(quantity, averagePrice);
		return OperationResult.success(new EntryFill(order, quantity, averagePrice, true));
	}

	/**
	 * Polls the order until it fills, dies or the fill timeout passes. Individual poll failures are tolerated.
	 */
	private OrderSnapshot awaitTerminal(String symbol, OrderSnapshot placed) throws InterruptedException {
		Instant deadline = clock.instant().plus(settings.fillTimeout());
		OrderSnapshot last = placed;
		while (clock.instant().isBefore(deadline)) {
			sleeper.sleep(settings.fillPollInterval());
			try {
				last = gateway.fetchOrder(symbol, placed.orderId());
			} catch (ExchangeException ex) {
				LOGGER.warn("EVENT=ENTRY_POLL_FAILED symbol={} orderId={} reason={}", symbol, placed.orderId(),
						ex.getMessage());
				continue;
			}
			if (last.isFilled() || last.status().isDead()) {
				return last;
			}
		}
		return last;
	}

	BigDecimal limitPrice(Direction direction, BigDecimal reference, SymbolRules rules) {
		BigDecimal offset = reference.multiply(settings.limitOffsetPercent(), MC).divide(HUNDRED, MC);
		BigDecimal price = direction == Direction.LONG ? reference.subtract(offset) : reference.add(offset);
		if (rules == null) {
			return price;
		}
		return rules.roundPrice(price, direction == Direction.LONG ? RoundingMode.DOWN : RoundingMode.UP);
	}

	private static BigDecimal filledQuantity(OrderSnapshot snapshot, BigDecimal requested) {
		BigDecimal executed = snapshot.executedQty();
		return executed != null && executed.signum() > 0 ? executed : requested;
	}

	public record EntryFill(TradeOrder order, BigDecimal quantity, BigDecimal price, boolean degraded) {
	}
}
