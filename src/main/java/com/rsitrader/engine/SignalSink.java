package com.rsitrader.engine;

import com.rsitrader.signal.Signal;

/**
 * Observer of confirmed signals, called before the engine decides whether to trade them.
 */
public interface SignalSink {

	void onSignal(Signal signal);
}
