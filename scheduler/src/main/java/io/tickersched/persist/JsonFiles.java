package io.tickersched.persist;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tickersched.error.PersistenceFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON state files replaced by write-temp-then-rename, so a crash leaves either the old or the new document.
 * Journals are JSON-lines files appended and synced one record at a time; a torn last line is ignored on read.
 */
public final class JsonFiles {
    private static final Logger log = LoggerFactory.getLogger(JsonFiles.class);
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonFiles() {}

    public static void writeAtomically(Path target, Object value) throws PersistenceFailure {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            byte[] bytes = MAPPER.writeValueAsBytes(value);
            // FileOutputStream rather than a FileChannel: a pending interrupt must not abort the write
            try (FileOutputStream out = new FileOutputStream(tmp.toFile())) {
                out.write(bytes);
                out.getFD().sync();
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (tmp != null) {
                try { Files.deleteIfExists(tmp); } catch (IOException suppressed) { e.addSuppressed(suppressed); }
            }
            throw new PersistenceFailure("Failed to write " + target, e);
        }
    }

    public static <T> Optional<T> read(Path source, Class<T> type) throws PersistenceFailure {
        if (!Files.exists(source)) return Optional.empty();
        try {
            return Optional.ofNullable(MAPPER.readValue(source.toFile(), type));
        } catch (IOException e) {
            throw new PersistenceFailure("Failed to read " + source, e);
        }
    }

    public static <T> Optional<T> read(Path source, TypeReference<T> type) throws PersistenceFailure {
        if (!Files.exists(source)) return Optional.empty();
        try {
            return Optional.ofNullable(MAPPER.readValue(source.toFile(), type));
        } catch (IOException e) {
            throw new PersistenceFailure("Failed to read " + source, e);
        }
    }

    /** Appends {@code value} as one JSON line and syncs it to disk before returning. */
    public static void appendLine(Path journal, Object value) throws PersistenceFailure {
        try {
            Path dir = journal.toAbsolutePath().getParent();
            if (dir != null) Files.createDirectories(dir);
            byte[] json = MAPPER.writeValueAsBytes(value);
            byte[] line = new byte[json.length + 1];
            System.arraycopy(json, 0, line, 0, json.length);
            line[json.length] = '\n';
            try (FileOutputStream out = new FileOutputStream(journal.toFile(), true)) {
                out.write(line);
                out.getFD().sync();
            }
        } catch (IOException e) {
            throw new PersistenceFailure("Failed to append to " + journal, e);
        }
    }

    /**
     * Reads every record of a journal. Only the final line may be unparsable (a write cut short by a crash);
     * a bad line anywhere else is corruption.
     */
    public static <T> List<T> readLines(Path journal, Class<T> type) throws PersistenceFailure {
        List<T> records = new ArrayList<>();
        if (!Files.exists(journal)) return records;
        List<String> lines;
        try {
            lines = Files.readAllLines(journal, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceFailure("Failed to read " + journal, e);
        }
        String torn = null;
        for (String line : lines) {
            if (line.isBlank()) continue;
            if (torn != null) throw new PersistenceFailure("Corrupt record in " + journal + ": " + torn);
            try {
                records.add(MAPPER.readValue(line, type));
            } catch (IOException e) {
                torn = line;
            }
        }
        if (torn != null) log.warn("Ignoring incomplete last record in {}", journal);
        return records;
    }

    public static void delete(Path file) throws PersistenceFailure {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new PersistenceFailure("Failed to delete " + file, e);
        }
    }
}
