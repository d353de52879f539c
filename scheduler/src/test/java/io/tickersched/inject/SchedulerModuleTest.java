package io.tickersched.inject;

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.tickersched.config.SchedulerConfig;
import io.tickersched.core.StaticTickerUniverse;
import io.tickersched.core.TickerUniverse;
import io.tickersched.core.TimeSeriesFetcher;
import io.tickersched.core.TimeSeriesSink;
import io.tickersched.metadata.EntityMetadataStore;
import io.tickersched.ratelimit.RateLimiter;
import io.tickersched.runtime.PassRunnerFactory;
import io.tickersched.strategy.ExecutionStrategy;
import io.tickersched.strategy.RunState;
import io.tickersched.strategy.RunSummary;
import io.tickersched.strategy.Strategies;
import io.tickersched.support.ScriptedFetcher;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerModuleTest {
    @Test
    void wiresStoresUnderStateDirAndRunsAStrategy() throws Exception {
        Path dir = Files.createTempDirectory("module");
        SchedulerConfig config = SchedulerConfig.builder()
                .intervals(List.of("1d"))
                .minDelay(Duration.ZERO)
                .maxDelay(Duration.ofMillis(50))
                .stateDir(dir)
                .build();
        ScriptedFetcher fetcher = new ScriptedFetcher();
        Injector injector = Guice.createInjector(new SchedulerModule(config), new AbstractModule() {
            @Override
            protected void configure() {
                bind(TickerUniverse.class).toInstance(new StaticTickerUniverse(List.of("A", "B")));
                bind(TimeSeriesFetcher.class).toInstance(fetcher);
                bind(TimeSeriesSink.class).toInstance(TimeSeriesSink.NO_OP);
            }
        });

        assertSame(injector.getInstance(EntityMetadataStore.class), injector.getInstance(EntityMetadataStore.class));
        RateLimiter limiter = injector.getInstance(RateLimiter.class);
        RunSummary summary;
        try (ExecutionStrategy s = Strategies.create("resume", injector.getInstance(PassRunnerFactory.class), limiter)) {
            summary = s.run();
        }

        assertEquals(RunState.DONE, summary.state());
        assertEquals(2, summary.totalSuccesses());
        assertTrue(Files.exists(config.metadataFile()));
        assertTrue(Files.isDirectory(config.progressDir().resolve("archive")));
        assertTrue(Files.exists(config.diagnosticsFile()));
    }
}
