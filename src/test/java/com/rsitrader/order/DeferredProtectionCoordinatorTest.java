package com.rsitrader.order;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.rsitrader.common.FailureKind;
import com.rsitrader.common.OperationResult;
import com.rsitrader.order.DeferredProtectionCoordinator.PlacementCallback;
import com.rsitrader.signal.Direction;
import com.rsitrader.support.TestProperties;
import com.rsitrader.support.TradingHarness;

class DeferredProtectionCoordinatorTest {

	private final TradingHarness harness = new TradingHarness(TestProperties.builder().deferred(true).build());
	private final DeferredProtectionCoordinator coordinator = harness.coordinator;
	private final List<String> placedTrades = new CopyOnWriteArrayList<>();
	private final PlacementCallback callback = (tradeId, pair, stop, target) -> placedTrades.add(tradeId);

	@Test
	void concurrentTriggersPlaceProtectionExactlyOnce() throws Exception {
		coordinator.schedule(trade("T-1"), harness.clock.instant(), callback);
		harness.gateway.setProtectionPlacementDelayMs(50);
		int callers = 8;
		ExecutorService executor = Executors.newFixedThreadPool(callers);
		CountDownLatch start = new CountDownLatch(1);
		try {
			List<Future<?>> futures = new CopyOnWriteArrayList<>();
			for (int i = 0; i < callers; i++) {
				boolean forced = i % 2 == 0;
				futures.add(executor.submit(() -> {
					start.await();
					return forced ? coordinator.forceProcess("T-1") : coordinator.processDue();
				}));
			}
			start.countDown();
			for (Future<?> future : futures) {
				future.get(5, TimeUnit.SECONDS);
			}
		} finally {
			executor.shutdownNow();
		}

		assertThat(harness.gateway.protectionPlacements()).isEqualTo(1);
		assertThat(placedTrades).containsExactly("T-1");
		assertThat(coordinator.status()).singleElement().satisfies(status -> {
			assertThat(status.placed()).isTrue();
			assertThat(status.inFlight()).isFalse();
			assertThat(status.attempts()).isEqualTo(1);
		});
	}

	@Test
	void waitsForDeadlineUnlessForced() {
		Instant deadline = harness.clock.instant().plusSeconds(30);
		coordinator.schedule(trade("T-1"), deadline, callback);

		assertThat(coordinator.processDue()).isZero();

		OperationResult<Boolean> forced = coordinator.forceProcess("T-1");

		assertThat(forced.value()).isTrue();
		assertThat(placedTrades).containsExactly("T-1");
		assertThat(coordinator.forceProcess("T-1").value()).isFalse();
	}

	@Test
	void forcingUnknownTradeIsRejected() {
		OperationResult<Boolean> result = coordinator.forceProcess("missing");

		assertThat(result.failureKind()).isEqualTo(FailureKind.VALIDATION);
	}

	@Test
	void failedPlacementIsRetriedOnNextCycle() {
		coordinator.schedule(trade("T-1"), harness.clock.instant(), callback);
		harness.gateway.failNext("placeTakeProfitLimitOrder", FailureKind.TRANSIENT);

		assertThat(coordinator.processDue()).isZero();
		assertThat(harness.gateway.cancelledOrderIds()).hasSize(1);
		assertThat(coordinator.status().get(0).inFlight()).isFalse();

		assertThat(coordinator.processDue()).isEqualTo(1);
		assertThat(coordinator.status().get(0).attempts()).isEqualTo(2);
	}

	@Test
	void lateFinisherAfterTimeoutCancelsItsOrders() throws Exception {
		coordinator.schedule(trade("T-1"), harness.clock.instant(), callback);
		harness.gateway.setProtectionPlacementDelayMs(300);
		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			Future<Integer> slow = executor.submit(coordinator::processDue);
			while (harness.gateway.protectionPlacements() == 0) {
				Thread.sleep(5);
			}
			harness.gateway.setProtectionPlacementDelayMs(0);
			harness.clock.advance(Duration.ofSeconds(31));

			assertThat(coordinator.processDue()).isZero();
			assertThat(coordinator.processDue()).isEqualTo(1);
			assertThat(slow.get(5, TimeUnit.SECONDS)).isZero();
		} finally {
			executor.shutdownNow();
		}

		assertThat(harness.gateway.protectionPlacements()).isEqualTo(2);
		assertThat(harness.gateway.cancelledOrderIds()).hasSize(2);
		assertThat(placedTrades).containsExactly("T-1");
	}

	@Test
	void emergencyStopSuspendsProcessing() {
		coordinator.schedule(trade("T-1"), harness.clock.instant(), callback);
		harness.emergencySwitch.trip("test");

		assertThat(coordinator.processDue()).isZero();
		assertThat(harness.gateway.protectionPlacements()).isZero();
	}

	@Test
	void crossedStopIsAdjustedBeforePlacement() {
		coordinator.schedule(trade("T-1"), harness.clock.instant(), callback);
		harness.gateway.setLastPrice("98.5");

		coordinator.processDue();

		assertThat(coordinator.status().get(0).finalStop()).isEqualByComparingTo("98.4");
		assertThat(coordinator.status().get(0).originalStop()).isEqualByComparingTo("99");
	}

	@Test
	void cancelOnlyBeforePlacementAndCleanupAfterRetention() {
		coordinator.schedule(trade("T-1"), harness.clock.instant(), callback);
		coordinator.schedule(trade("T-2"), harness.clock.instant().plusSeconds(600), callback);
		coordinator.forceProcess("T-1");

		assertThat(coordinator.cancel("T-1")).isFalse();
		assertThat(coordinator.cancel("T-2")).isTrue();
		assertThat(coordinator.cleanup()).isZero();

		harness.clock.advance(Duration.ofHours(25));

		assertThat(coordinator.cleanup()).isEqualTo(1);
		assertThat(coordinator.status()).isEmpty();
	}

	private Trade trade(String id) {
		return Trade.opening(id, "BTCUSDC", Direction.LONG, new BigDecimal("20"), new BigDecimal("100"),
				new BigDecimal("99"), new BigDecimal("101.2"), harness.clock.instant());
	}
}
