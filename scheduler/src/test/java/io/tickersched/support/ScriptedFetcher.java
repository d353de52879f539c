package io.tickersched.support;

import io.tickersched.core.Bar;
import io.tickersched.core.TimeSeries;
import io.tickersched.core.TimeSeriesFetcher;
import io.tickersched.core.WorkItem;
import io.tickersched.error.FetchError;
import io.tickersched.error.FetchFailure;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetcher whose outcome per entity is scripted: queued {@link FetchError}s are thrown in order, after which
 * every call succeeds with a single bar. Entities marked with {@link #alwaysFail} fail on every call.
 */
public class ScriptedFetcher implements TimeSeriesFetcher {
    private final Map<String, Deque<FetchError>> scripts = new HashMap<>();
    private final Map<String, FetchError> permanent = new HashMap<>();
    private final Map<WorkItem, FetchError> permanentPerItem = new HashMap<>();
    private final List<WorkItem> calls = new ArrayList<>();
    private final List<Instant> sinces = new ArrayList<>();

    public synchronized ScriptedFetcher failNext(String entity, FetchError... errors) {
        Deque<FetchError> q = scripts.computeIfAbsent(entity, k -> new ArrayDeque<>());
        for (FetchError e : errors) q.add(e);
        return this;
    }

    public synchronized ScriptedFetcher alwaysFail(String entity, FetchError error) {
        permanent.put(entity, error);
        return this;
    }

    /** Like {@link #alwaysFail} but only for one interval of the entity. */
    public synchronized ScriptedFetcher alwaysFailIn(String entity, String interval, FetchError error) {
        permanentPerItem.put(new WorkItem(entity, interval), error);
        return this;
    }

    @Override
    public synchronized TimeSeries fetch(String entity, String interval, Instant since) throws FetchFailure {
        calls.add(new WorkItem(entity, interval));
        sinces.add(since);
        FetchError always = permanent.getOrDefault(entity, permanentPerItem.get(new WorkItem(entity, interval)));
        if (always != null) throw FetchFailure.of(always, "scripted " + always + " for " + entity);
        Deque<FetchError> q = scripts.get(entity);
        if (q != null && !q.isEmpty()) {
            FetchError e = q.poll();
            throw FetchFailure.of(e, "scripted " + e + " for " + entity);
        }
        return new TimeSeries(entity, interval, List.of(new Bar(Instant.EPOCH, 1, 1, 1, 1, 10)));
    }

    public synchronized List<WorkItem> calls() { return new ArrayList<>(calls); }

    public synchronized List<Instant> sinces() { return new ArrayList<>(sinces); }

    public synchronized List<String> entitiesCalled(String interval) {
        List<String> out = new ArrayList<>();
        for (WorkItem w : calls) if (w.interval().equals(interval)) out.add(w.entity());
        return out;
    }
}
