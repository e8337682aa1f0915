package com.rsitrader.market.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rsitrader.market.Candle;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KlineEvent(
		@JsonProperty("E") long eventTime,
		@JsonProperty("s") String symbol,
		@JsonProperty("k") Kline kline) {

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Kline(
			@JsonProperty("t") long openTime,
			@JsonProperty("T") long closeTime,
			@JsonProperty("i") String interval,
			@JsonProperty("o") double open,
			@JsonProperty("h") double high,
			@JsonProperty("l") double low,
			@JsonProperty("c") double close,
			@JsonProperty("v") double volume,
			@JsonProperty("x") boolean closed) {

		public Candle toCandle() {
			return new Candle(openTime, open, high, low, close, volume, closeTime);
		}
	}
}
