package io.tickersched.metadata;

import io.tickersched.core.EntityState;
import io.tickersched.error.PersistenceFailure;
import io.tickersched.persist.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entity metadata kept in memory and persisted as a JSON snapshot plus an append-only journal next to it
 * ({@code <file>.journal}). With write-through on, each mutation appends one journal record, so the cost of a
 * write does not depend on how many entities are tracked; the journal is folded into the snapshot on
 * {@link #flush()} or once it outgrows the snapshot. All mutations are serialized on this instance, which makes
 * it safe to share between parallel interval workers.
 */
public class JsonFileEntityMetadataStore implements EntityMetadataStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileEntityMetadataStore.class);
    static final int MIN_COMPACTION_RECORDS = 1024;

    private final Path file;
    private final Path journal;
    private final int maxConsecutiveErrors;
    private final Duration errorCooldown;
    private final boolean writeThrough;
    // interval -> entity -> state
    private final Map<String, Map<String, EntityState>> states = new HashMap<>();
    private int entryCount;
    private int journalRecords;
    // a journal found at load may end in a torn record, so it is folded before anything is appended to it
    private boolean foldBeforeAppend;
    private boolean dirty;

    public JsonFileEntityMetadataStore(Path file, int maxConsecutiveErrors, Duration errorCooldown, boolean writeThrough)
            throws PersistenceFailure {
        if (maxConsecutiveErrors < 1) throw new IllegalArgumentException("maxConsecutiveErrors must be >= 1");
        this.file = file;
        this.journal = file.resolveSibling(file.getFileName() + ".journal");
        this.maxConsecutiveErrors = maxConsecutiveErrors;
        this.errorCooldown = errorCooldown;
        this.writeThrough = writeThrough;
        load();
    }

    private void load() throws PersistenceFailure {
        Optional<Document> doc = JsonFiles.read(file, Document.class);
        if (doc.isPresent() && doc.get().entries() != null) {
            doc.get().entries().forEach(this::apply);
        }
        List<Entry> replay = JsonFiles.readLines(journal, Entry.class);
        replay.forEach(this::apply);
        journalRecords = replay.size();
        dirty = !replay.isEmpty();
        foldBeforeAppend = Files.exists(journal);
        if (entryCount > 0) {
            log.info("Loaded {} entity records from {} ({} journal records replayed)", entryCount, file, replay.size());
        }
    }

    private void apply(Entry e) {
        EntityState previous = states.computeIfAbsent(e.interval(), k -> new LinkedHashMap<>()).put(e.entity(),
                new EntityState(e.lastSuccessAt(), e.consecutiveErrors(), e.lastErrorAt(), e.inCooldownUntil()));
        if (previous == null) entryCount++;
    }

    @Override
    public synchronized EntityState recordSuccess(String entity, String interval, Instant at) throws PersistenceFailure {
        EntityState next = current(entity, interval).afterSuccess(at);
        put(entity, interval, next);
        return next;
    }

    @Override
    public synchronized EntityState recordFailure(String entity, String interval, Instant at) throws PersistenceFailure {
        EntityState next = current(entity, interval).afterFailure(at, maxConsecutiveErrors, errorCooldown);
        put(entity, interval, next);
        return next;
    }

    @Override
    public synchronized boolean clearCooldown(String entity, String interval) throws PersistenceFailure {
        EntityState existing = states.getOrDefault(interval, Map.of()).get(entity);
        if (existing == null || existing.inCooldownUntil() == null) return false;
        put(entity, interval, existing.withoutCooldown());
        log.info("Cooldown cleared for {}|{}", entity, interval);
        return true;
    }

    @Override
    public synchronized Optional<EntityState> get(String entity, String interval) {
        return Optional.ofNullable(states.getOrDefault(interval, Map.of()).get(entity));
    }

    @Override
    public synchronized Map<String, EntityState> snapshot(String interval) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(states.getOrDefault(interval, Map.of())));
    }

    @Override
    public synchronized Set<String> intervals() {
        return Collections.unmodifiableSet(new TreeSet<>(states.keySet()));
    }

    @Override
    public synchronized void flush() throws PersistenceFailure {
        if (!dirty) return;
        List<Entry> entries = new ArrayList<>();
        for (var byInterval : states.entrySet()) {
            for (var byEntity : byInterval.getValue().entrySet()) {
                EntityState s = byEntity.getValue();
                entries.add(new Entry(byEntity.getKey(), byInterval.getKey(), s.lastSuccessAt(),
                        s.consecutiveErrors(), s.lastErrorAt(), s.inCooldownUntil()));
            }
        }
        JsonFiles.writeAtomically(file, new Document(entries));
        // the snapshot now holds every journal record
        JsonFiles.delete(journal);
        journalRecords = 0;
        foldBeforeAppend = false;
        dirty = false;
    }

    private EntityState current(String entity, String interval) {
        return states.getOrDefault(interval, Map.of()).getOrDefault(entity, EntityState.INITIAL);
    }

    private void put(String entity, String interval, EntityState state) throws PersistenceFailure {
        Entry entry = new Entry(entity, interval, state.lastSuccessAt(),
                state.consecutiveErrors(), state.lastErrorAt(), state.inCooldownUntil());
        apply(entry);
        dirty = true;
        if (!writeThrough) return;
        if (foldBeforeAppend) {
            flush();
            return;
        }
        JsonFiles.appendLine(journal, entry);
        journalRecords++;
        if (journalRecords >= Math.max(MIN_COMPACTION_RECORDS, entryCount)) flush();
    }

    record Document(List<Entry> entries) {}

    record Entry(String entity,
                 String interval,
                 Instant lastSuccessAt,
                 int consecutiveErrors,
                 Instant lastErrorAt,
                 Instant inCooldownUntil) {}
}
