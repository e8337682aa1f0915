package com.rsitrader.risk;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rsitrader.common.OperationResult;
import com.rsitrader.config.TradingProperties;
import com.rsitrader.exchange.SymbolRules;
import com.rsitrader.signal.Direction;
import com.rsitrader.signal.Signal;

/**
 * Sizes positions from account balance and stop distance and runs the daily and lifetime circuit breakers.
 * All counters live in one {@link RiskState} guarded by a single lock.
 */
@Component
public class RiskManager {

	private static final Logger LOGGER = LoggerFactory.getLogger(RiskManager.class);
	private static final MathContext MC = MathContext.DECIMAL64;
	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	private final TradingProperties.Risk settings;
	private final EmergencySwitch emergencySwitch;
	private final Clock clock;
	private final Object lock = new Object();
	private final RiskState state;
	private volatile SymbolRules symbolRules;

	public RiskManager(TradingProperties tradingProperties, EmergencySwitch emergencySwitch, Clock clock) {
		this.settings = tradingProperties.risk();
		this.emergencySwitch = emergencySwitch;
		this.clock = clock;
		this.state = new RiskState(today());
	}

	public void applySymbolRules(SymbolRules rules) {
		this.symbolRules = rules;
	}

	public OperationResult<PositionSize> size(Signal signal, BigDecimal balance, BigDecimal stop) {
		BigDecimal entryEstimate = BigDecimal.valueOf(signal.indicatorSnapshot().close());
		return size(signal, balance, entryEstimate, stop);
	}

	public OperationResult<PositionSize> size(Signal signal, BigDecimal balance, BigDecimal entryEstimate,
			BigDecimal stop) {
		Optional<String> halt = tradingHaltReason();
		if (halt.isPresent()) {
			return refuse(signal, halt.get(), true);
		}
		if (signal.confidence() < settings.minConfidence()) {
			return refuse(signal, "confidence " + signal.confidence() + " below minimum " + settings.minConfidence(),
					false);
		}
		if (balance == null || balance.signum() <= 0) {
			return refuse(signal, "no available balance", false);
		}
		if (entryEstimate == null || entryEstimate.signum() <= 0 || stop == null || stop.signum() <= 0) {
			return refuse(signal, "missing entry or stop price", false);
		}
		Direction direction = signal.direction();
		BigDecimal distance = direction.favourableMove(stop, entryEstimate);
		if (distance.signum() <= 0) {
			return refuse(signal, "stop " + stop + " is not on the protective side of entry " + entryEstimate, false);
		}

		BigDecimal riskBudget = balance.multiply(settings.maxRiskFraction(), MC);
		BigDecimal quantity = riskBudget.divide(distance, MC);
		if (quantity.multiply(entryEstimate, MC).compareTo(settings.maxNotional()) > 0) {
			quantity = settings.maxNotional().divide(entryEstimate, MC);
			LOGGER.info("EVENT=POSITION_CLAMPED maxNotional={} qty={}", settings.maxNotional(), quantity);
		}
		SymbolRules rules = symbolRules;
		if (rules != null) {
			quantity = rules.roundQuantityDown(quantity);
		}
		BigDecimal notional = quantity.multiply(entryEstimate, MC);
		BigDecimal minimum = settings.minNotional();
		if (rules != null && rules.minNotional() != null && rules.minNotional().compareTo(minimum) > 0) {
			minimum = rules.minNotional();
		}
		if (quantity.signum() <= 0 || notional.compareTo(minimum) < 0
				|| (rules != null && !rules.meetsMinimums(quantity, entryEstimate))) {
			return refuse(signal, "notional " + notional.setScale(4, RoundingMode.HALF_UP) + " below minimum "
					+ minimum, false);
		}

		BigDecimal takeProfit = takeProfitFor(direction, entryEstimate, distance);
		if (rules != null) {
			takeProfit = rules.roundPrice(takeProfit, RoundingMode.HALF_UP);
		}
		BigDecimal riskAmount = quantity.multiply(distance, MC);
		PositionSize size = new PositionSize(quantity, entryEstimate, stop, takeProfit, riskAmount);
		LOGGER.info("EVENT=POSITION_SIZED direction={} qty={} entry={} stop={} takeProfit={} risk={} balance={}",
				direction, quantity, entryEstimate, stop, takeProfit, riskAmount, balance);
		return OperationResult.success(size);
	}

	BigDecimal takeProfitFor(Direction direction, BigDecimal entry, BigDecimal stopDistance) {
		BigDecimal offset = settings.takeProfitMode() == TakeProfitMode.RATIO
				? stopDistance.multiply(settings.tpRatio(), MC)
				: entry.multiply(settings.takeProfitPercent(), MC).divide(HUNDRED, MC);
		return direction == Direction.LONG ? entry.add(offset) : entry.subtract(offset);
	}

	/**
	 * Reason new trades are currently refused, if any.
	 */
	public Optional<String> tradingHaltReason() {
		if (emergencySwitch.isTripped()) {
			return Optional.of("emergency stop active: " + emergencySwitch.reason().orElse("unknown"));
		}
		synchronized (lock) {
			rollDayIfNeeded();
			if (state.dailyTradeCount >= settings.maxDailyTrades()) {
				return Optional.of("daily trade limit reached (" + state.dailyTradeCount + ")");
			}
			if (state.dailyPnl.negate().compareTo(settings.maxDailyLoss()) >= 0) {
				return Optional.of("daily loss limit reached (" + state.dailyPnl + ")");
			}
			if (state.consecutiveLosses >= settings.maxConsecutiveLosses()) {
				return Optional.of("consecutive loss limit reached (" + state.consecutiveLosses + ")");
			}
		}
		return Optional.empty();
	}

	public void recordOutcome(Direction direction, BigDecimal entry, BigDecimal quantity, TradeResult result,
			BigDecimal pnl) {
		BigDecimal realized = pnl == null ? BigDecimal.ZERO : pnl;
		String ceilingBreach = null;
		synchronized (lock) {
			rollDayIfNeeded();
			state.dailyTradeCount++;
			state.dailyPnl = state.dailyPnl.add(realized);
			state.totalPnl = state.totalPnl.add(realized);
			if (state.balance != null) {
				state.balance = state.balance.add(realized);
				if (state.peakBalance == null || state.balance.compareTo(state.peakBalance) > 0) {
					state.peakBalance = state.balance;
				}
				BigDecimal drawdown = state.peakBalance.subtract(state.balance);
				if (drawdown.compareTo(state.maxDrawdown) > 0) {
					state.maxDrawdown = drawdown;
				}
			}
			if (result == TradeResult.LOSS) {
				state.consecutiveLosses++;
				state.losses++;
			} else {
				state.consecutiveLosses = 0;
				if (result == TradeResult.WIN) {
					state.wins++;
				}
			}
			BigDecimal ceiling = settings.emergencyStopLoss();
			if (state.totalPnl.negate().compareTo(ceiling) >= 0) {
				ceilingBreach = "cumulative loss " + state.totalPnl + " reached ceiling " + ceiling;
			} else if (state.maxDrawdown.compareTo(ceiling) >= 0) {
				ceilingBreach = "drawdown " + state.maxDrawdown + " reached ceiling " + ceiling;
			}
			LOGGER.info("EVENT=RISK_OUTCOME direction={} entry={} qty={} result={} pnl={} dailyPnl={} dailyTrades={} "
					+ "consecutiveLosses={} totalPnl={}", direction, entry, quantity, result, realized, state.dailyPnl,
					state.dailyTradeCount, state.consecutiveLosses, state.totalPnl);
		}
		if (ceilingBreach != null) {
			emergencySwitch.trip("RISK_CEILING " + ceilingBreach);
		}
	}

	public void updateBalance(BigDecimal balance) {
		if (balance == null) {
			return;
		}
		synchronized (lock) {
			if (state.initialBalance == null) {
				state.initialBalance = balance;
			}
			state.balance = balance;
			if (state.peakBalance == null || balance.compareTo(state.peakBalance) > 0) {
				state.peakBalance = balance;
			}
			BigDecimal drawdown = state.peakBalance.subtract(balance);
			if (drawdown.compareTo(state.maxDrawdown) > 0) {
				state.maxDrawdown = drawdown;
			}
		}
	}

	/**
	 * Clears the emergency latch. Loss counters are kept as they are.
	 */
	public boolean overrideEmergencyStop(String operator) {
		boolean cleared = emergencySwitch.override(operator);
		if (cleared) {
			synchronized (lock) {
				LOGGER.warn("EVENT=RISK_EMERGENCY_OVERRIDE operator={} totalPnl={} maxDrawdown={}", operator,
						state.totalPnl, state.maxDrawdown);
			}
		}
		return cleared;
	}

	/**
	 * Resets the daily counters. Refused while the emergency stop is active.
	 */
	public boolean resetDailyLimits() {
		if (emergencySwitch.isTripped()) {
			LOGGER.warn("EVENT=DAILY_RESET_SKIPPED reason=emergency_stop_active");
			return false;
		}
		synchronized (lock) {
			resetDaily(today());
		}
		return true;
	}

	public TradeImpact simulateImpact(PositionSize size, TradeResult result) {
		BigDecimal pnl = result == TradeResult.WIN
				? size.quantity().multiply(size.targetDistance(), MC)
				: result == TradeResult.LOSS ? size.riskAmount().negate() : BigDecimal.ZERO;
		synchronized (lock) {
			BigDecimal balance = state.balance == null ? BigDecimal.ZERO : state.balance;
			BigDecimal dailyPnl = state.dailyPnl.add(pnl);
			BigDecimal totalPnl = state.totalPnl.add(pnl);
			int consecutive = result == TradeResult.LOSS ? state.consecutiveLosses + 1 : 0;
			return new TradeImpact(
					balance.add(pnl),
					dailyPnl,
					consecutive,
					totalPnl.negate().compareTo(settings.emergencyStopLoss()) >= 0,
					dailyPnl.negate().compareTo(settings.maxDailyLoss()) >= 0);
		}
	}

	public RiskMetrics metrics() {
		synchronized (lock) {
			rollDayIfNeeded();
			int decided = state.wins + state.losses;
			double winRate = decided == 0 ? 0.0 : (double) state.wins / decided;
			return new RiskMetrics(
					state.balance,
					state.initialBalance,
					state.dailyPnl,
					state.dailyTradeCount,
					state.consecutiveLosses,
					state.peakBalance,
					state.maxDrawdown,
					state.totalPnl,
					state.wins,
					state.losses,
					winRate,
					emergencySwitch.isTripped(),
					emergencySwitch.reason().orElse(null),
					state.tradingDay);
		}
	}

	private void rollDayIfNeeded() {
		LocalDate today = today();
		if (today.equals(state.tradingDay)) {
			return;
		}
		if (emergencySwitch.isTripped()) {
			return;
		}
		resetDaily(today);
	}

	private void resetDaily(LocalDate day) {
		LOGGER.info("EVENT=DAILY_LIMITS_RESET previousDay={} day={} dailyPnl={} dailyTrades={}", state.tradingDay, day,
				state.dailyPnl, state.dailyTradeCount);
		state.tradingDay = day;
		state.dailyPnl = BigDecimal.ZERO;
		state.dailyTradeCount = 0;
	}

	private LocalDate today() {
		return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
	}

	private OperationResult<PositionSize> refuse(Signal signal, String reason, boolean systemic) {
		LOGGER.warn("EVENT=POSITION_REFUSED direction={} reason={}", signal.direction(), reason);
		return systemic ? OperationResult.systemic(reason) : OperationResult.validation(reason);
	}

	static final class RiskState {

		private BigDecimal balance;
		private BigDecimal initialBalance;
		private BigDecimal dailyPnl = BigDecimal.ZERO;
		private int dailyTradeCount;
		private int consecutiveLosses;
		private BigDecimal peakBalance;
		private BigDecimal maxDrawdown = BigDecimal.ZERO;
		private BigDecimal totalPnl = BigDecimal.ZERO;
		private int wins;
		private int losses;
		private LocalDate tradingDay;

		private RiskState(LocalDate tradingDay) {
			this.tradingDay = tradingDay;
		}
	}
}
