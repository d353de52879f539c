package io.tickersched.priority;

import io.tickersched.core.EntityState;
import io.tickersched.core.WorkItem;
import io.tickersched.metadata.EntityMetadataStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders the entities of one interval stalest first. Entities that never succeeded come before all others,
 * entities in cooldown are left out, ties keep universe order.
 */
public class PriorityScorer {
    private static final Comparator<Instant> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    private final EntityMetadataStore metadata;

    public PriorityScorer(EntityMetadataStore metadata) {
        this.metadata = metadata;
    }

    public List<WorkItem> score(List<String> entities, String interval, Instant now) {
        Map<String, EntityState> states = metadata.snapshot(interval);
        Set<String> unique = new LinkedHashSet<>();
        for (String e : entities) {
            if (e == null || e.isBlank()) continue;
            unique.add(e.trim());
        }
        List<Scored> eligible = new ArrayList<>(unique.size());
        for (String e : unique) {
            EntityState st = states.getOrDefault(e, EntityState.INITIAL);
            if (st.inCooldown(now)) continue;
            eligible.add(new Scored(e, st.lastSuccessAt()));
        }
        // List.sort is stable
        eligible.sort(Comparator.comparing(Scored::lastSuccessAt, NULLS_FIRST));
        List<WorkItem> out = new ArrayList<>(eligible.size());
        for (Scored s : eligible) out.add(new WorkItem(s.entity(), interval));
        return out;
    }

    private record Scored(String entity, Instant lastSuccessAt) {}
}
