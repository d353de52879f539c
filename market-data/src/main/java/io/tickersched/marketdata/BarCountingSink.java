package io.tickersched.marketdata;

import com.codahale.metrics.MetricRegistry;
import io.tickersched.core.TimeSeries;
import io.tickersched.core.TimeSeriesSink;
import io.tickersched.core.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink for the command line: counts received bars per interval and discards them.
 */
public class BarCountingSink implements TimeSeriesSink {
    private static final Logger log = LoggerFactory.getLogger(BarCountingSink.class);

    private final MetricRegistry registry;

    public BarCountingSink(MetricRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void accept(WorkItem item, TimeSeries series) {
        registry.counter(MetricRegistry.name("marketdata.bars", item.interval())).inc(series.size());
        log.debug("{}: {} bars", item, series.size());
    }
}
