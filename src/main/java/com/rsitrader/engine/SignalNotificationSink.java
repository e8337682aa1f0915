package com.rsitrader.engine;

import java.util.Locale;

import org.springframework.stereotype.Component;

import com.rsitrader.notify.NotificationLevel;
import com.rsitrader.notify.Notifier;
import com.rsitrader.signal.Signal;

@Component
public class SignalNotificationSink implements SignalSink {

	private final Notifier notifier;

	public SignalNotificationSink(Notifier notifier) {
		this.notifier = notifier;
	}

	@Override
	public void onSignal(Signal signal) {
		notifier.notify(NotificationLevel.INFO, "SIGNAL_" + signal.direction().name(),
				String.format(Locale.ROOT, "close=%.4f confidence=%.2f reasons=%s",
						signal.indicatorSnapshot().close(), signal.confidence(), signal.reasons()));
	}
}
