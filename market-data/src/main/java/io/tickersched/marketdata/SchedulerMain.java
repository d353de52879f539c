package io.tickersched.marketdata;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Snapshot;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.tickersched.config.SchedulerConfig;
import io.tickersched.core.EntityHealth;
import io.tickersched.core.EntityState;
import io.tickersched.error.FetchDiagnostics;
import io.tickersched.error.PersistenceFailure;
import io.tickersched.inject.SchedulerModule;
import io.tickersched.metadata.JsonFileEntityMetadataStore;
import io.tickersched.metrics.SchedulerMetrics;
import io.tickersched.progress.JsonFileProgressStateStore;
import io.tickersched.ratelimit.RateLimitStateFile;
import io.tickersched.ratelimit.RateLimiter;
import io.tickersched.runtime.IntervalStats;
import io.tickersched.runtime.PassRunnerFactory;
import io.tickersched.strategy.ExecutionStrategy;
import io.tickersched.strategy.RunState;
import io.tickersched.strategy.RunSummary;
import io.tickersched.strategy.Strategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command line entry point for running a strategy over a ticker list and for inspecting or adjusting scheduler state.
 */
@CommandLine.Command(name = "ticker-scheduler", mixinStandardHelpOptions = true,
        description = "Rate-limited, resumable ticker time-series fetch scheduler",
        subcommands = {SchedulerMain.Run.class, SchedulerMain.Status.class, SchedulerMain.ClearCooldown.class})
public final class SchedulerMain implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_INTERRUPTED = 1;
    static final int EXIT_BAD_INPUT = 2;
    static final int EXIT_PERSISTENCE = 3;

    private static final Logger log = LoggerFactory.getLogger(SchedulerMain.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new SchedulerMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_BAD_INPUT;
    }

    static SchedulerConfig baseConfig(Path stateDir) {
        SchedulerConfig env = SchedulerConfig.fromEnv();
        return stateDir == null ? env : env.toBuilder().stateDir(stateDir).build();
    }

    @CommandLine.Command(name = "run", mixinStandardHelpOptions = true, description = "Fetch the stalest tickers first using one execution strategy")
    static final class Run implements Callable<Integer> {
        @CommandLine.Option(names = {"-s", "--strategy"}, description = "resume, cross, quota or parallel", defaultValue = "resume")
        String strategy;

        @CommandLine.Option(names = {"-t", "--ticker"}, split = ",", description = "Tickers (comma-separated or repeat option)")
        List<String> tickers = new ArrayList<>();

        @CommandLine.Option(names = {"-f", "--tickers-file"}, description = "File with one ticker per line; # starts a comment")
        Path tickersFile;

        @CommandLine.Option(names = {"-i", "--interval"}, split = ",", description = "Intervals in pass order; default from configuration")
        List<String> intervals = new ArrayList<>();

        @CommandLine.Option(names = {"-d", "--state-dir"}, description = "Directory for metadata, progress and rate-limit state")
        Path stateDir;

        @CommandLine.Option(names = {"-b", "--batch-size"}, description = "Items per batch")
        Integer batchSize;

        @CommandLine.Option(names = {"-m", "--max-batches"}, description = "Batch budget per run for the cross and quota strategies")
        Integer maxBatches;

        @CommandLine.Option(names = {"--base-url"}, description = "Chart API base URL", defaultValue = HttpChartFetcher.DEFAULT_BASE_URL)
        String baseUrl;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            SchedulerConfig config;
            List<String> universe;
            try {
                SchedulerConfig.Builder b = baseConfig(stateDir).toBuilder();
                if (!intervals.isEmpty()) b.intervals(intervals);
                if (batchSize != null) b.batchSize(batchSize);
                if (maxBatches != null) b.maxBatchesPerRun(maxBatches);
                config = b.build();
                universe = readTickers(tickers, tickersFile);
            } catch (IllegalArgumentException | IOException e) {
                spec.commandLine().getErr().println("Invalid input: " + e.getMessage());
                return EXIT_BAD_INPUT;
            }
            if (universe.isEmpty()) {
                spec.commandLine().getErr().println("No tickers given; use --ticker or --tickers-file");
                return EXIT_BAD_INPUT;
            }
            if (!Strategies.NAMES.contains(strategy.trim().toLowerCase(Locale.ROOT))) {
                spec.commandLine().getErr().println("Unknown strategy '" + strategy + "', expected one of " + Strategies.NAMES);
                return EXIT_BAD_INPUT;
            }

            Injector injector;
            try {
                injector = Guice.createInjector(new SchedulerModule(config), new MarketDataModule(universe, baseUrl));
                injector.getInstance(PassRunnerFactory.class);
            } catch (ProvisionException | com.google.inject.CreationException e) {
                log.error("Could not open scheduler state in {}", config.stateDir(), e);
                return EXIT_PERSISTENCE;
            }
            RateLimiter limiter = injector.getInstance(RateLimiter.class);
            MetricRegistry registry = injector.getInstance(MetricRegistry.class);
            GracefulShutdown shutdown = GracefulShutdown.install(Thread.currentThread());
            int code = EXIT_INTERRUPTED;
            try (FetchDiagnostics ignored = injector.getInstance(FetchDiagnostics.class);
                 ExecutionStrategy s = Strategies.create(strategy, injector.getInstance(PassRunnerFactory.class), limiter)) {
                RateLimitStateFile.load(config.rateLimitsFile(), limiter);
                log.info("Running {} over {} tickers, intervals {}", s.name(), universe.size(), config.intervals());
                RunSummary summary = s.run();
                RateLimitStateFile.save(config.rateLimitsFile(), limiter);
                logSummary(summary, registry);
                code = summary.state() == RunState.DONE ? EXIT_OK : EXIT_INTERRUPTED;
            } catch (PersistenceFailure e) {
                log.error("Scheduler state could not be persisted; rerun to resume", e);
                code = EXIT_PERSISTENCE;
            } finally {
                shutdown.finished(code);
            }
            return code;
        }
    }

    @CommandLine.Command(name = "status", mixinStandardHelpOptions = true, description = "Entity health per interval and unfinished passes")
    static final class Status implements Callable<Integer> {
        @CommandLine.Option(names = {"-d", "--state-dir"}, description = "Scheduler state directory")
        Path stateDir;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            SchedulerConfig config = baseConfig(stateDir);
            PrintWriter out = spec.commandLine().getOut();
            try {
                var metadata = new JsonFileEntityMetadataStore(config.metadataFile(), config.maxConsecutiveErrors(),
                        config.errorCooldown(), false);
                var progress = new JsonFileProgressStateStore(config.progressDir(), Clock.systemUTC());
                Instant now = Instant.now();
                Set<String> intervals = new TreeSet<>(metadata.intervals());
                if (intervals.isEmpty()) out.println("No entity metadata in " + config.stateDir());
                for (String interval : intervals) {
                    Map<EntityHealth, Integer> counts = new EnumMap<>(EntityHealth.class);
                    for (EntityHealth h : EntityHealth.values()) counts.put(h, 0);
                    for (EntityState st : metadata.snapshot(interval).values()) counts.merge(st.health(now), 1, Integer::sum);
                    out.printf("%-4s healthy=%d degraded=%d cooldown=%d%n", interval,
                            counts.get(EntityHealth.HEALTHY), counts.get(EntityHealth.DEGRADED), counts.get(EntityHealth.COOLDOWN));
                }
                Set<String> active = progress.activePassIds();
                out.println("Active passes: " + (active.isEmpty() ? "none" : String.join(", ", active)));
                out.flush();
                return EXIT_OK;
            } catch (PersistenceFailure e) {
                spec.commandLine().getErr().println("Could not read state: " + e.getMessage());
                return EXIT_PERSISTENCE;
            }
        }
    }

    @CommandLine.Command(name = "clear-cooldown", mixinStandardHelpOptions = true, description = "Make a ticker eligible again before its cooldown expires")
    static final class ClearCooldown implements Callable<Integer> {
        @CommandLine.Option(names = {"-d", "--state-dir"}, description = "Scheduler state directory")
        Path stateDir;

        @CommandLine.Option(names = {"-t", "--ticker"}, required = true)
        String ticker;

        @CommandLine.Option(names = {"-i", "--interval"}, required = true)
        String interval;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            SchedulerConfig config = baseConfig(stateDir);
            try {
                var metadata = new JsonFileEntityMetadataStore(config.metadataFile(), config.maxConsecutiveErrors(),
                        config.errorCooldown(), true);
                boolean cleared = metadata.clearCooldown(ticker, interval);
                metadata.flush();
                spec.commandLine().getOut().println(cleared
                        ? "Cleared cooldown for " + ticker + " " + interval
                        : ticker + " " + interval + " was not in cooldown");
                spec.commandLine().getOut().flush();
                return EXIT_OK;
            } catch (PersistenceFailure e) {
                spec.commandLine().getErr().println("Could not update state: " + e.getMessage());
                return EXIT_PERSISTENCE;
            }
        }
    }

    static List<String> readTickers(List<String> given, Path file) throws IOException {
        List<String> out = new ArrayList<>();
        for (String t : given) {
            if (t != null && !t.isBlank()) out.add(t.trim());
        }
        if (file != null) {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String t = line.strip();
                if (t.isEmpty() || t.startsWith("#")) continue;
                out.add(t);
            }
        }
        return out;
    }

    private static void logSummary(RunSummary summary, MetricRegistry r) {
        for (Map.Entry<String, IntervalStats> e : summary.intervals().entrySet()) {
            IntervalStats s = e.getValue();
            log.info("  {}: batches={} ok={} retryable={} permanent={} cooldowns={} completed={}", e.getKey(),
                    s.batches(), s.successes(), s.retryableFailures(), s.permanentFailures(), s.cooldownsEntered(), s.completed());
        }
        Timer fetch = r.timer(SchedulerMetrics.FETCH_TIME);
        Snapshot snap = fetch.getSnapshot();
        log.info("Run {}: fetches={} p50={}ms p99={}ms timeouts={} waitedP50={}ms items/s(1m)={}",
                summary.state(), fetch.getCount(),
                fmt(snap.getMedian() / 1_000_000.0), fmt(snap.get99thPercentile() / 1_000_000.0),
                r.counter(SchedulerMetrics.FETCH_TIMEOUT).getCount(),
                fmt(r.histogram(SchedulerMetrics.RATELIMIT_WAIT).getSnapshot().getMedian()),
                fmt(r.meter(SchedulerMetrics.ITEMS_RATE).getOneMinuteRate()));
    }

    private static String fmt(double v) { return String.format("%.3f", v); }
}
