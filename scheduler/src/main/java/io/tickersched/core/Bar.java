package io.tickersched.core;

import java.time.Instant;

/** One OHLCV bar. Prices may be NaN when the provider omitted them. */
public record Bar(Instant timestamp, double open, double high, double low, double close, long volume) {}
