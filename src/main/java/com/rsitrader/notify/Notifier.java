package com.rsitrader.notify;

/**
 * Outbound operator notifications. Each distinct condition uses its own event name.
 */
public interface Notifier {

	void notify(NotificationLevel level, String event, String message);
}
