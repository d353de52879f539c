package io.tickersched.marketdata;

import io.tickersched.metadata.JsonFileEntityMetadataStore;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerMainTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new SchedulerMain());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void statusOnEmptyStateDir() throws Exception {
        Path dir = Files.createTempDirectory("cli-status");
        assertEquals(0, execute("status", "--state-dir", dir.toString()));
        assertTrue(out.toString().contains("No entity metadata"));
        assertTrue(out.toString().contains("Active passes: none"));
        try (Stream<Path> created = Files.list(dir)) {
            assertEquals(0, created.count());
        }
    }

    @Test
    void runFetchesThenStatusReportsHealth() throws Exception {
        Path dir = Files.createTempDirectory("cli-run");
        try (FakeChartServer server = new FakeChartServer()) {
            server.respond("GONE", 404, "{}");
            int code = execute("run", "--strategy", "RESUME", "--ticker", "SPY,GONE", "--interval", "1d",
                    "--state-dir", dir.toString(), "--base-url", server.baseUrl());
            assertEquals(0, code, err.toString());
            assertEquals(2, server.queries.size());
        }
        assertTrue(Files.exists(dir.resolve("entity-metadata.json")));
        assertTrue(Files.exists(dir.resolve("rate-limits.json")));
        assertEquals(1, Files.readAllLines(dir.resolve("diagnostics.jsonl")).size());

        assertEquals(0, execute("status", "--state-dir", dir.toString()));
        assertTrue(out.toString().contains("healthy=1 degraded=1 cooldown=0"), out.toString());
    }

    @Test
    void tickersFileSkipsCommentsAndBlanks() throws Exception {
        Path file = Files.createTempFile("tickers", ".txt");
        Files.write(file, List.of("# watchlist", "AAPL", "", "  MSFT  "));
        assertEquals(List.of("X", "AAPL", "MSFT"), SchedulerMain.readTickers(List.of("X", " "), file));
    }

    @Test
    void badInputExitsWithTwo() throws Exception {
        Path dir = Files.createTempDirectory("cli-bad");
        assertEquals(2, execute("run", "--state-dir", dir.toString()));
        assertEquals(2, execute("run", "--ticker", "SPY", "--strategy", "fastest", "--state-dir", dir.toString()));
        assertEquals(2, execute("run", "--ticker", "SPY", "--batch-size", "0", "--state-dir", dir.toString()));
        assertEquals(2, execute("clear-cooldown", "--ticker", "SPY"));
    }

    @Test
    void clearCooldownMakesTickerEligible() throws Exception {
        Path dir = Files.createTempDirectory("cli-clear");
        Path file = dir.resolve("entity-metadata.json");
        var store = new JsonFileEntityMetadataStore(file, 5, Duration.ofHours(1), true);
        Instant now = Instant.now();
        for (int i = 0; i < 5; i++) store.recordFailure("BAD", "1d", now);

        assertEquals(0, execute("clear-cooldown", "--ticker", "BAD", "--interval", "1d", "--state-dir", dir.toString()));
        assertTrue(out.toString().contains("Cleared cooldown for BAD 1d"));

        var reloaded = new JsonFileEntityMetadataStore(file, 5, Duration.ofHours(1), true);
        assertFalse(reloaded.get("BAD", "1d").orElseThrow().inCooldown(Instant.now()));
    }
}
