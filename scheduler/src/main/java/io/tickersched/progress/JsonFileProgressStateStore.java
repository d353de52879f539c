package io.tickersched.progress;

import io.tickersched.core.WorkItem;
import io.tickersched.error.ActivePassException;
import io.tickersched.error.PersistenceFailure;
import io.tickersched.persist.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores each active cursor as {@code <dir>/<passId>.json} plus {@code <dir>/<passId>.attempted}, a journal with
 * one line per item attempted since the cursor file was last written. Marking an item appends a single line; the
 * journal is folded into the cursor file once it outgrows it. Completed cursors move to {@code <dir>/archive/}.
 * Nothing is created on disk until a pass starts.
 */
public class JsonFileProgressStateStore implements ProgressStateStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileProgressStateStore.class);
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String SUFFIX = ".json";
    private static final String JOURNAL_SUFFIX = ".attempted";
    static final int MIN_COMPACTION_RECORDS = 256;

    private final Path dir;
    private final Path archiveDir;
    private final Clock clock;
    // passId -> records appended to its journal since the cursor file was written
    private final Map<String, Integer> journalRecords = new HashMap<>();

    public JsonFileProgressStateStore(Path dir, Clock clock) {
        this.dir = dir;
        this.archiveDir = dir.resolve("archive");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public synchronized ProgressCursor startPass(String passId, String interval, List<WorkItem> items) throws PersistenceFailure {
        Path file = fileFor(passId);
        if (Files.exists(file)) throw new ActivePassException(passId);
        ProgressCursor cursor = ProgressCursor.start(passId, interval, clock.instant(), items);
        // a journal left behind by an archived pass must not leak into this one
        JsonFiles.delete(journalFor(passId));
        JsonFiles.writeAtomically(file, cursor);
        journalRecords.put(passId, 0);
        log.info("Started pass {} with {} items", passId, items.size());
        return cursor;
    }

    @Override
    public synchronized Optional<ProgressCursor> resumePass(String passId) throws PersistenceFailure {
        Optional<ProgressCursor> stored = JsonFiles.read(fileFor(passId), ProgressCursor.class);
        if (stored.isEmpty()) return stored;
        List<WorkItem> replay = JsonFiles.readLines(journalFor(passId), WorkItem.class);
        ProgressCursor cursor = stored.get().withAllAttempted(replay);
        if (Files.exists(journalFor(passId))) {
            // fold now: the journal may end in a torn line that later appends would run into
            JsonFiles.writeAtomically(fileFor(passId), cursor);
            JsonFiles.delete(journalFor(passId));
        }
        journalRecords.put(passId, 0);
        log.info("Resuming pass {}: {} attempted, {} pending", passId, cursor.attempted().size(), cursor.pending().size());
        return Optional.of(cursor);
    }

    @Override
    public synchronized ProgressCursor markAttempted(ProgressCursor cursor, WorkItem item) throws PersistenceFailure {
        String passId = cursor.passId();
        ProgressCursor next = cursor.withAttempted(item);
        JsonFiles.appendLine(journalFor(passId), item);
        int records = journalRecords.merge(passId, 1, Integer::sum);
        if (records >= Math.max(MIN_COMPACTION_RECORDS, next.attempted().size())) {
            JsonFiles.writeAtomically(fileFor(passId), next);
            JsonFiles.delete(journalFor(passId));
            journalRecords.put(passId, 0);
        }
        return next;
    }

    @Override
    public synchronized void completePass(ProgressCursor cursor) throws PersistenceFailure {
        if (!cursor.isDrained()) {
            throw new IllegalStateException("Pass " + cursor.passId() + " still has " + cursor.pending().size() + " pending items");
        }
        String passId = cursor.passId();
        Path archived = archiveDir.resolve(passId + "-" + clock.millis() + SUFFIX);
        // archive first: a crash before the active files are gone leaves a drained pass that completes again
        JsonFiles.writeAtomically(archived, cursor);
        JsonFiles.delete(fileFor(passId));
        JsonFiles.delete(journalFor(passId));
        journalRecords.remove(passId);
        log.info("Completed pass {} ({} items)", cursor.passId(), cursor.attempted().size());
    }

    @Override
    public synchronized Set<String> activePassIds() throws PersistenceFailure {
        Set<String> ids = new TreeSet<>();
        if (!Files.isDirectory(dir)) return ids;
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(SUFFIX))
                    .forEach(n -> ids.add(n.substring(0, n.length() - SUFFIX.length())));
        } catch (IOException e) {
            throw new PersistenceFailure("Cannot list " + dir, e);
        }
        return ids;
    }

    private Path fileFor(String passId) {
        if (!SAFE_ID.matcher(passId).matches()) throw new IllegalArgumentException("Unsafe pass id: " + passId);
        return dir.resolve(passId + SUFFIX);
    }

    private Path journalFor(String passId) {
        return dir.resolve(passId + JOURNAL_SUFFIX);
    }
}
