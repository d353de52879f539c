package io.tickersched.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tickersched.core.WorkItem;
import io.tickersched.support.TestClock;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileFetchDiagnosticsTest {
    @Test
    void appendsOneJsonLinePerReport() throws Exception {
        Path file = Files.createTempDirectory("diag").resolve("nested").resolve("diagnostics.jsonl");
        var clock = new TestClock(Instant.parse("2024-06-01T10:00:00Z"));
        try (var diagnostics = new FileFetchDiagnostics(file, clock)) {
            diagnostics.report(new WorkItem("ZZZZ", "1d"), FetchFailure.of(FetchError.NOT_FOUND, "no such ticker"));
            diagnostics.report(new WorkItem("JUNK", "1h"), FetchFailure.of(FetchError.MALFORMED, "bad payload"));
        }

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        JsonNode first = new ObjectMapper().readTree(lines.get(0));
        assertEquals("ZZZZ", first.get("entity").asText());
        assertEquals("1d", first.get("interval").asText());
        assertEquals("NOT_FOUND", first.get("error").asText());
        assertEquals("2024-06-01T10:00:00Z", first.get("ts").asText());
        assertEquals("MALFORMED", new ObjectMapper().readTree(lines.get(1)).get("error").asText());
    }
}
