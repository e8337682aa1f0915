package com.rsitrader.signal.indicators;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class EmaIndicatorTest {

	@Test
	void valueAndSlopeAppearOnceWarm() {
		EmaIndicator ema = new EmaIndicator(3, 2);

		assertThat(ema.update(10.0)).isNaN();
		assertThat(ema.update(12.0)).isNaN();
		assertThat(ema.update(14.0)).isCloseTo(12.5, within(1e-9));
		assertThat(ema.slope()).isCloseTo(2.5, within(1e-9));
	}

	@Test
	void slopeTurnsNegativeOnFallingPrices() {
		EmaIndicator ema = new EmaIndicator(2, 1);
		ema.update(20.0);
		ema.update(20.0);

		ema.update(14.0);

		assertThat(ema.slope()).isNegative();
	}
}
