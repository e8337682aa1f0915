package com.rsitrader.order;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import org.springframework.stereotype.Component;

import com.rsitrader.config.TradingProperties;
import com.rsitrader.exchange.SymbolRules;
import com.rsitrader.signal.Direction;

/**
 * Recomputes protection levels against the price at placement time so that neither order would trigger
 * immediately.
 */
@Component
public class ProtectionPriceAdjuster {

	private static final MathContext MC = MathContext.DECIMAL64;
	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	private final BigDecimal offsetPercent;
	private final BigDecimal minDistancePercent;

	public ProtectionPriceAdjuster(TradingProperties tradingProperties) {
		this.offsetPercent = tradingProperties.protection().priceOffsetPercent();
		this.minDistancePercent = tradingProperties.protection().minDistancePercent();
	}

	public Levels adjust(Direction direction, BigDecimal price, BigDecimal stop, BigDecimal target,
			SymbolRules rules) {
		BigDecimal offset = price.multiply(offsetPercent, MC).divide(HUNDRED, MC);
		BigDecimal minDistance = price.multiply(minDistancePercent, MC).divide(HUNDRED, MC);
		BigDecimal newStop;
		BigDecimal newTarget;
		boolean stopCrossed;
		boolean targetCrossed;
		if (direction == Direction.LONG) {
			stopCrossed = price.compareTo(stop) <= 0;
			targetCrossed = price.compareTo(target) >= 0;
			newStop = stopCrossed
					? price.subtract(offset.max(minDistance))
					: stop.min(price.subtract(minDistance));
			newTarget = targetCrossed
					? price.add(offset)
					: target.max(price.add(minDistance));
		} else {
			stopCrossed = price.compareTo(stop) >= 0;
			targetCrossed = price.compareTo(target) <= 0;
			newStop = stopCrossed
					? price.add(offset.max(minDistance))
					: stop.max(price.add(minDistance));
			newTarget = targetCrossed
					? price.subtract(offset)
					: target.min(price.subtract(minDistance));
		}
		if (rules != null) {
			// away from the current price
			newStop = rules.roundPrice(newStop, direction == Direction.LONG ? RoundingMode.DOWN : RoundingMode.UP);
			newTarget = rules.roundPrice(newTarget, direction == Direction.LONG ? RoundingMode.UP : RoundingMode.DOWN);
		}
		return new Levels(newStop, newTarget, stopCrossed, targetCrossed);
	}

	public record Levels(BigDecimal stop, BigDecimal target, boolean stopCrossed, boolean targetCrossed) {
	}
}
