package io.tickersched.priority;

import io.tickersched.core.WorkItem;
import io.tickersched.metadata.JsonFileEntityMetadataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PriorityScorerTest {
    private static final Instant NOW = Instant.parse("2024-01-02T00:00:00Z");

    private JsonFileEntityMetadataStore store;
    private PriorityScorer scorer;

    @BeforeEach
    void setUp() throws Exception {
        store = new JsonFileEntityMetadataStore(Files.createTempDirectory("scorer").resolve("meta.json"), 5, Duration.ofHours(1), false);
        scorer = new PriorityScorer(store);
    }

    @Test
    void neverFetchedFirstThenStalestAndCooldownExcluded() throws Exception {
        store.recordSuccess("A", "1d", NOW.minus(Duration.ofHours(1)));
        for (int i = 0; i < 5; i++) store.recordFailure("C", "1d", NOW.minusSeconds(10));

        List<WorkItem> order = scorer.score(List.of("A", "B", "C"), "1d", NOW);

        assertEquals(List.of(new WorkItem("B", "1d"), new WorkItem("A", "1d")), order);
    }

    @Test
    void cooldownEndingNowIsEligible() throws Exception {
        Instant failedAt = NOW.minus(Duration.ofHours(1));
        for (int i = 0; i < 5; i++) store.recordFailure("C", "1d", failedAt);
        assertEquals(1, scorer.score(List.of("C"), "1d", NOW).size());
        assertTrue(scorer.score(List.of("C"), "1d", NOW.minusNanos(1)).isEmpty());
    }

    @Test
    void tiesKeepUniverseOrder() throws Exception {
        Instant t = NOW.minusSeconds(100);
        store.recordSuccess("X", "1d", t);
        store.recordSuccess("Y", "1d", t);
        store.recordSuccess("Z", "1d", NOW.minusSeconds(500));

        List<String> order = scorer.score(List.of("Y", "X", "Z", "N1", "N2"), "1d", NOW).stream().map(WorkItem::entity).toList();

        assertEquals(List.of("N1", "N2", "Z", "Y", "X"), order);
    }

    @Test
    void duplicatesAndBlanksCollapsed() {
        List<String> order = scorer.score(Arrays.asList("A", " ", null, "B", "A"), "1h", NOW).stream().map(WorkItem::entity).toList();
        assertEquals(List.of("A", "B"), order);
    }

    @Test
    void intervalsScoredIndependently() throws Exception {
        for (int i = 0; i < 5; i++) store.recordFailure("C", "1d", NOW);
        assertEquals(1, scorer.score(List.of("C"), "1h", NOW).size());
    }

    @Test
    void emptyUniverseGivesEmptyOrder() {
        assertTrue(scorer.score(List.of(), "1d", NOW).isEmpty());
    }
}
