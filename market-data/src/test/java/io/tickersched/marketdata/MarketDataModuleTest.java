package io.tickersched.marketdata;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.tickersched.config.SchedulerConfig;
import io.tickersched.core.TickerUniverse;
import io.tickersched.core.TimeSeries;
import io.tickersched.core.TimeSeriesFetcher;
import io.tickersched.core.TimeSeriesSink;
import io.tickersched.core.WorkItem;
import io.tickersched.inject.SchedulerModule;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketDataModuleTest {
    @Test
    void bindsHttpFetcherAndCountingSink() throws Exception {
        SchedulerConfig config = SchedulerConfig.builder().stateDir(Files.createTempDirectory("md-module")).build();
        Injector injector = Guice.createInjector(new SchedulerModule(config),
                new MarketDataModule(List.of("SPY", "QQQ"), "http://127.0.0.1:1"));

        assertInstanceOf(HttpChartFetcher.class, injector.getInstance(TimeSeriesFetcher.class));
        assertEquals(List.of("SPY", "QQQ"), injector.getInstance(TickerUniverse.class).entities("1h"));

        TimeSeriesSink sink = injector.getInstance(TimeSeriesSink.class);
        sink.accept(new WorkItem("SPY", "1d"), new ChartResponseParser().parse("SPY", "1d", FakeChartServer.TWO_BARS));
        sink.accept(new WorkItem("QQQ", "1d"), TimeSeries.empty("QQQ", "1d"));
        assertEquals(2, injector.getInstance(MetricRegistry.class).counter("marketdata.bars.1d").getCount());
    }
}
