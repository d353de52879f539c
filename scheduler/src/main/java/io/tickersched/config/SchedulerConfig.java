package io.tickersched.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

public record SchedulerConfig(
        List<String> intervals,
        int batchSize,
        Map<String, Integer> batchSizes,
        int maxBatchesPerRun,
        int maxConsecutiveErrors,
        Duration errorCooldown,
        Map<String, Integer> entityCounts,
        Duration minDelay,
        Duration maxDelay,
        double delayIncreaseFactor,
        Duration delayIncreaseStep,
        double delayDecayFactor,
        Duration fetchTimeout,
        int maxAttemptsPerItem,
        long retryBaseMillis,
        long retryMaxMillis,
        boolean metadataWriteThrough,
        int parallelism,
        Path stateDir
) {
    public static final List<String> DEFAULT_INTERVALS = List.of("1m", "5m", "15m", "30m", "1h", "1d");

    public SchedulerConfig {
        Objects.requireNonNull(stateDir, "stateDir");
        intervals = List.copyOf(intervals);
        batchSizes = Map.copyOf(batchSizes);
        entityCounts = Map.copyOf(entityCounts);
        if (intervals.isEmpty()) throw new IllegalArgumentException("intervals must not be empty");
        if (new LinkedHashSet<>(intervals).size() != intervals.size()) throw new IllegalArgumentException("duplicate interval in " + intervals);
        for (String i : intervals) {
            if (i.isBlank()) throw new IllegalArgumentException("blank interval");
        }
        positive("batchSize", batchSize);
        batchSizes.forEach((k, v) -> positive("batchSizes." + k, v));
        entityCounts.forEach((k, v) -> {
            if (v < 0) throw new IllegalArgumentException("entityCounts." + k + " must be >= 0");
        });
        positive("maxBatchesPerRun", maxBatchesPerRun);
        positive("maxConsecutiveErrors", maxConsecutiveErrors);
        positive("maxAttemptsPerItem", maxAttemptsPerItem);
        if (errorCooldown.isNegative()) throw new IllegalArgumentException("errorCooldown must be >= 0");
        if (minDelay.isNegative()) throw new IllegalArgumentException("minDelay must be >= 0");
        if (maxDelay.compareTo(minDelay) < 0) throw new IllegalArgumentException("maxDelay must be >= minDelay");
        if (delayIncreaseFactor < 1.0) throw new IllegalArgumentException("delayIncreaseFactor must be >= 1");
        if (delayIncreaseStep.isNegative() || delayIncreaseStep.isZero()) throw new IllegalArgumentException("delayIncreaseStep must be > 0");
        if (delayDecayFactor <= 0.0 || delayDecayFactor >= 1.0) throw new IllegalArgumentException("delayDecayFactor must be in (0, 1)");
        if (fetchTimeout.isNegative() || fetchTimeout.isZero()) throw new IllegalArgumentException("fetchTimeout must be > 0");
        if (retryBaseMillis < 0 || retryMaxMillis < 0) throw new IllegalArgumentException("retry backoff must be >= 0");
        if (parallelism < 0) throw new IllegalArgumentException("parallelism must be >= 0");
    }

    public int batchSizeFor(String interval) {
        return batchSizes.getOrDefault(interval, batchSize);
    }

    /** Pool size for the parallel strategy; 0 means one thread per interval. */
    public int effectiveParallelism() {
        return parallelism == 0 ? intervals.size() : parallelism;
    }

    public Path metadataFile() { return stateDir.resolve("entity-metadata.json"); }
    public Path progressDir() { return stateDir.resolve("progress"); }
    public Path rateLimitsFile() { return stateDir.resolve("rate-limits.json"); }
    public Path diagnosticsFile() { return stateDir.resolve("diagnostics.jsonl"); }

    public Builder toBuilder() { return new Builder(this); }

    public static Builder builder() { return new Builder(); }

    public static SchedulerConfig defaults() { return builder().build(); }

    /**
     * Reads {@code -Dscheduler.*} system properties, falling back to {@code SCHEDULER_*} environment variables.
     */
    public static SchedulerConfig fromEnv() {
        return fromLookup(SchedulerConfig::lookupEnv);
    }

    static SchedulerConfig fromLookup(Function<String, String> lookup) {
        Builder b = builder();
        String v;
        if ((v = lookup.apply("intervals")) != null) b.intervals(splitList(v));
        if ((v = lookup.apply("batchSize")) != null) b.batchSize(parseInt("batchSize", v));
        if ((v = lookup.apply("batchSizes")) != null) b.batchSizes(parseIntMap("batchSizes", v));
        if ((v = lookup.apply("maxBatchesPerRun")) != null) b.maxBatchesPerRun(parseInt("maxBatchesPerRun", v));
        if ((v = lookup.apply("maxConsecutiveErrors")) != null) b.maxConsecutiveErrors(parseInt("maxConsecutiveErrors", v));
        if ((v = lookup.apply("errorCooldown")) != null) b.errorCooldown(parseDuration("errorCooldown", v));
        if ((v = lookup.apply("entityCounts")) != null) b.entityCounts(parseIntMap("entityCounts", v));
        if ((v = lookup.apply("minDelay")) != null) b.minDelay(parseDuration("minDelay", v));
        if ((v = lookup.apply("maxDelay")) != null) b.maxDelay(parseDuration("maxDelay", v));
        if ((v = lookup.apply("delayIncreaseFactor")) != null) b.delayIncreaseFactor(parseDouble("delayIncreaseFactor", v));
        if ((v = lookup.apply("delayIncreaseStep")) != null) b.delayIncreaseStep(parseDuration("delayIncreaseStep", v));
        if ((v = lookup.apply("delayDecayFactor")) != null) b.delayDecayFactor(parseDouble("delayDecayFactor", v));
        if ((v = lookup.apply("fetchTimeout")) != null) b.fetchTimeout(parseDuration("fetchTimeout", v));
        if ((v = lookup.apply("maxAttemptsPerItem")) != null) b.maxAttemptsPerItem(parseInt("maxAttemptsPerItem", v));
        if ((v = lookup.apply("retryBaseMillis")) != null) b.retryBaseMillis(parseLong("retryBaseMillis", v));
        if ((v = lookup.apply("retryMaxMillis")) != null) b.retryMaxMillis(parseLong("retryMaxMillis", v));
        if ((v = lookup.apply("metadataWriteThrough")) != null) b.metadataWriteThrough(Boolean.parseBoolean(v.trim()));
        if ((v = lookup.apply("parallelism")) != null) b.parallelism(parseInt("parallelism", v));
        if ((v = lookup.apply("stateDir")) != null) b.stateDir(Path.of(v.trim()));
        return b.build();
    }

    private static String lookupEnv(String key) {
        String env = "SCHEDULER_" + key.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase();
        return System.getProperty("scheduler." + key, System.getenv(env));
    }

    /** Accepts ISO-8601 ({@code PT1H}) or a number with an ms/s/m/h/d suffix ({@code 250ms}, {@code 1h}). */
    public static Duration parseDuration(String name, String raw) {
        String s = raw.trim().toLowerCase();
        try {
            if (s.startsWith("pt") || s.startsWith("p")) return Duration.parse(s.toUpperCase());
            if (s.endsWith("ms")) return Duration.ofMillis(Long.parseLong(s.substring(0, s.length() - 2)));
            if (s.endsWith("s")) return Duration.ofSeconds(Long.parseLong(s.substring(0, s.length() - 1)));
            if (s.endsWith("m")) return Duration.ofMinutes(Long.parseLong(s.substring(0, s.length() - 1)));
            if (s.endsWith("h")) return Duration.ofHours(Long.parseLong(s.substring(0, s.length() - 1)));
            if (s.endsWith("d")) return Duration.ofDays(Long.parseLong(s.substring(0, s.length() - 1)));
            return Duration.ofMillis(Long.parseLong(s));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid duration for " + name + ": " + raw, e);
        }
    }

    public static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        for (String p : raw.split(",")) {
            String t = p.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /** {@code 1m=20,1d=5} */
    static Map<String, Integer> parseIntMap(String name, String raw) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (String pair : splitList(raw)) {
            int eq = pair.indexOf('=');
            if (eq <= 0) throw new IllegalArgumentException("invalid entry for " + name + ": " + pair);
            out.put(pair.substring(0, eq).trim(), parseInt(name, pair.substring(eq + 1)));
        }
        return out;
    }

    private static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid integer for " + name + ": " + raw, e);
        }
    }

    private static long parseLong(String name, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid integer for " + name + ": " + raw, e);
        }
    }

    private static double parseDouble(String name, String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number for " + name + ": " + raw, e);
        }
    }

    private static void positive(String name, int value) {
        if (value <= 0) throw new IllegalArgumentException(name + " must be > 0");
    }

    public static final class Builder {
        private List<String> intervals = DEFAULT_INTERVALS;
        private int batchSize = 15;
        private Map<String, Integer> batchSizes = Map.of();
        private int maxBatchesPerRun = 10;
        private int maxConsecutiveErrors = 5;
        private Duration errorCooldown = Duration.ofHours(1);
        private Map<String, Integer> entityCounts = Map.of();
        private Duration minDelay = Duration.ofMillis(250);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double delayIncreaseFactor = 2.0;
        private Duration delayIncreaseStep = Duration.ofMillis(500);
        private double delayDecayFactor = 0.9;
        private Duration fetchTimeout = Duration.ofSeconds(30);
        private int maxAttemptsPerItem = 1;
        private long retryBaseMillis = 500;
        private long retryMaxMillis = 5000;
        private boolean metadataWriteThrough = true;
        private int parallelism = 0;
        private Path stateDir = Path.of("./scheduler-state");

        private Builder() {}

        private Builder(SchedulerConfig c) {
            intervals = c.intervals;
            batchSize = c.batchSize;
            batchSizes = c.batchSizes;
            maxBatchesPerRun = c.maxBatchesPerRun;
            maxConsecutiveErrors = c.maxConsecutiveErrors;
            errorCooldown = c.errorCooldown;
            entityCounts = c.entityCounts;
            minDelay = c.minDelay;
            maxDelay = c.maxDelay;
            delayIncreaseFactor = c.delayIncreaseFactor;
            delayIncreaseStep = c.delayIncreaseStep;
            delayDecayFactor = c.delayDecayFactor;
            fetchTimeout = c.fetchTimeout;
            maxAttemptsPerItem = c.maxAttemptsPerItem;
            retryBaseMillis = c.retryBaseMillis;
            retryMaxMillis = c.retryMaxMillis;
            metadataWriteThrough = c.metadataWriteThrough;
            parallelism = c.parallelism;
            stateDir = c.stateDir;
        }

        public Builder intervals(List<String> v) { this.intervals = v; return this; }
        public Builder batchSize(int v) { this.batchSize = v; return this; }
        public Builder batchSizes(Map<String, Integer> v) { this.batchSizes = v; return this; }
        public Builder maxBatchesPerRun(int v) { this.maxBatchesPerRun = v; return this; }
        public Builder maxConsecutiveErrors(int v) { this.maxConsecutiveErrors = v; return this; }
        public Builder errorCooldown(Duration v) { this.errorCooldown = v; return this; }
        public Builder entityCounts(Map<String, Integer> v) { this.entityCounts = v; return this; }
        public Builder minDelay(Duration v) { this.minDelay = v; return this; }
        public Builder maxDelay(Duration v) { this.maxDelay = v; return this; }
        public Builder delayIncreaseFactor(double v) { this.delayIncreaseFactor = v; return this; }
        public Builder delayIncreaseStep(Duration v) { this.delayIncreaseStep = v; return this; }
        public Builder delayDecayFactor(double v) { this.delayDecayFactor = v; return this; }
        public Builder fetchTimeout(Duration v) { this.fetchTimeout = v; return this; }
        public Builder maxAttemptsPerItem(int v) { this.maxAttemptsPerItem = v; return this; }
        public Builder retryBaseMillis(long v) { this.retryBaseMillis = v; return this; }
        public Builder retryMaxMillis(long v) { this.retryMaxMillis = v; return this; }
        public Builder metadataWriteThrough(boolean v) { this.metadataWriteThrough = v; return this; }
        public Builder parallelism(int v) { this.parallelism = v; return this; }
        public Builder stateDir(Path v) { this.stateDir = v; return this; }

        public SchedulerConfig build() {
            return new SchedulerConfig(intervals, batchSize, batchSizes, maxBatchesPerRun, maxConsecutiveErrors,
                    errorCooldown, entityCounts, minDelay, maxDelay, delayIncreaseFactor, delayIncreaseStep,
                    delayDecayFactor, fetchTimeout, maxAttemptsPerItem, retryBaseMillis, retryMaxMillis,
                    metadataWriteThrough, parallelism, stateDir);
        }
    }
}
