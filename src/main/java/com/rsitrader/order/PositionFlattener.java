package com.rsitrader.order;

import java.math.BigDecimal;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rsitrader.exchange.ExchangeException;
import com.rsitrader.exchange.ExchangeGateway;
import com.rsitrader.exchange.OrderSnapshot;
import com.rsitrader.exchange.PositionSnapshot;
import com.rsitrader.risk.EmergencySwitch;
import com.rsitrader.signal.Direction;

/**
 * Closes whatever position the exchange reports with a reduce-only market order. A position that cannot be
 * flattened is a systemic condition and trips the emergency switch.
 */
@Component
public class PositionFlattener {

	private static final Logger LOGGER = LoggerFactory.getLogger(PositionFlattener.class);

	private final ExchangeGateway gateway;
	private final EmergencySwitch emergencySwitch;

	public PositionFlattener(ExchangeGateway gateway, EmergencySwitch emergencySwitch) {
		this.gateway = gateway;
		this.emergencySwitch = emergencySwitch;
	}

	/**
	 * @return the exit order, or empty when the exchange already reported a flat position
	 */
	public Optional<OrderSnapshot> flatten(String symbol, Direction direction, String reason) {
		PositionSnapshot position;
		try {
			position = gateway.fetchPosition(symbol);
		} catch (ExchangeException ex) {
			LOGGER.error("EVENT=FLATTEN_FAILED symbol={} reason={} error={}", symbol, reason, ex.getMessage());
			emergencySwitch.trip("FLATTEN_FAILED " + symbol + ": " + ex.getMessage());
			throw ex;
		}
		if (position.isFlat()) {
			LOGGER.info("EVENT=FLATTEN_NOOP symbol={} reason={}", symbol, reason);
			return Optional.empty();
		}
		Direction held = position.positionAmt().signum() > 0 ? Direction.LONG : Direction.SHORT;
		if (held != direction) {
			LOGGER.warn("EVENT=FLATTEN_DIRECTION_MISMATCH symbol={} expected={} held={}", symbol, direction, held);
		}
		return Optional.of(exit(symbol, held, position.absoluteAmount(), reason));
	}

	/**
	 * Exits a known quantity without reading the position first.
	 */
	public OrderSnapshot exit(String symbol, Direction direction, BigDecimal quantity, String reason) {
		OrderSnapshot exit;
		try {
			exit = gateway.placeMarketOrder(symbol, direction.exitSide(), quantity, true);
		} catch (ExchangeException ex) {
			LOGGER.error("EVENT=FLATTEN_FAILED symbol={} qty={} reason={} error={}", symbol, quantity, reason,
					ex.getMessage());
			emergencySwitch.trip("FLATTEN_FAILED " + symbol + ": " + ex.getMessage());
			throw ex;
		}
		LOGGER.warn("EVENT=POSITION_FLATTENED symbol={} direction={} qty={} orderId={} avgPrice={} reason={}", symbol,
				direction, quantity, exit.orderId(), exit.avgPrice(), reason);
		return exit;
	}
}
