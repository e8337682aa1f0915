package com.rsitrader.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Component
public class TradingEngineStarter implements ApplicationListener<ApplicationReadyEvent> {

	private static final Logger LOGGER = LoggerFactory.getLogger(TradingEngineStarter.class);

	private final TradingEngine engine;

	public TradingEngineStarter(TradingEngine engine) {
		this.engine = engine;
	}

	@Override
	public void onApplicationEvent(ApplicationReadyEvent event) {
		try {
			engine.start();
		} catch (RuntimeException ex) {
			LOGGER.error("EVENT=ENGINE_START_FAILED reason={}", ex.getMessage(), ex);
			throw ex;
		}
	}
}
