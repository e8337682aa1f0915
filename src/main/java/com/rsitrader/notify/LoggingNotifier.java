package com.rsitrader.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingNotifier implements Notifier {

	private static final Logger LOGGER = LoggerFactory.getLogger("com.rsitrader.notifications");

	@Override
	public void notify(NotificationLevel level, String event, String message) {
		switch (level) {
			case CRITICAL -> LOGGER.error("EVENT=NOTIFY level={} name={} message={}", level, event, message);
			case WARNING -> LOGGER.warn("EVENT=NOTIFY level={} name={} message={}", level, event, message);
			default -> LOGGER.info("EVENT=NOTIFY level={} name={} message={}", level, event, message);
		}
	}
}
