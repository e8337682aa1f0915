package com.rsitrader.notify;

public enum NotificationLevel {
	INFO,
	WARNING,
	CRITICAL
}
