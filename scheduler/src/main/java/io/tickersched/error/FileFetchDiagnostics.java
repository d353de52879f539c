package io.tickersched.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tickersched.core.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/**
 * Appends one JSON line per permanent failure, e.g.
 * {@code {"ts":"...","entity":"XYZ","interval":"1d","error":"NOT_FOUND","message":"..."}}.
 */
public class FileFetchDiagnostics implements FetchDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(FileFetchDiagnostics.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;
    private final Clock clock;

    public FileFetchDiagnostics(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    @Override
    public synchronized void report(WorkItem item, FetchFailure failure) {
        ObjectNode line = MAPPER.createObjectNode()
                .put("ts", clock.instant().toString())
                .put("entity", item.entity())
                .put("interval", item.interval())
                .put("error", failure.error().name())
                .put("message", String.valueOf(failure.getMessage()));
        try {
            Files.writeString(file, MAPPER.writeValueAsString(line) + System.lineSeparator(),
                    StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            // diagnostics are advisory; the failure itself is already recorded in the metadata store
            log.warn("Could not append diagnostic for {} to {}", item, file, e);
        }
    }
}
