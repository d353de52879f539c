package io.tickersched.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class SchedulerMetrics {
    public static final String FETCH_TIME = "scheduler.fetch.time";
    public static final String FETCH_SUCCESS = "scheduler.fetch.success";
    public static final String FETCH_FAILURE_RETRYABLE = "scheduler.fetch.failure.retryable";
    public static final String FETCH_FAILURE_PERMANENT = "scheduler.fetch.failure.permanent";
    public static final String FETCH_TIMEOUT = "scheduler.fetch.timeout";
    public static final String COOLDOWN_ENTERED = "scheduler.cooldown.entered";
    public static final String ITEMS_RATE = "scheduler.items.rate";
    public static final String RATELIMIT_WAIT = "scheduler.ratelimit.wait.ms";

    private final MetricRegistry registry;

    public SchedulerMetrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
    public Histogram histogram(String name) { return registry.histogram(name); }

    public Counter intervalSuccess(String interval) { return registry.counter(intervalName(interval, "success")); }
    public Counter intervalFailure(String interval) { return registry.counter(intervalName(interval, "failure")); }

    public static String intervalName(String interval, String outcome) {
        return MetricRegistry.name("scheduler.interval", interval, outcome);
    }
}
