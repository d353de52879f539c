package io.tickersched.marketdata;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.tickersched.config.SchedulerConfig;
import io.tickersched.core.StaticTickerUniverse;
import io.tickersched.core.TickerUniverse;
import io.tickersched.core.TimeSeriesFetcher;
import io.tickersched.core.TimeSeriesSink;

import java.time.Clock;
import java.util.List;

/**
 * Binds the HTTP fetcher, the counting sink and a fixed ticker universe; install together with
 * {@link io.tickersched.inject.SchedulerModule}.
 */
public class MarketDataModule extends AbstractModule {
    private final List<String> tickers;
    private final String baseUrl;

    public MarketDataModule(List<String> tickers, String baseUrl) {
        this.tickers = List.copyOf(tickers);
        this.baseUrl = baseUrl;
    }

    @Provides @Singleton TickerUniverse universe() { return new StaticTickerUniverse(tickers); }

    @Provides @Singleton TimeSeriesFetcher fetcher(SchedulerConfig config, Clock clock) {
        return new HttpChartFetcher(baseUrl, config.fetchTimeout(), clock);
    }

    @Provides @Singleton TimeSeriesSink sink(MetricRegistry registry) { return new BarCountingSink(registry); }
}
