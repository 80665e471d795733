package com.cgrera.extractor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run-level QA result.
 *
 * @param summary       count of diffs per status wire name, every status present in declaration order
 * @param totalEntities number of entities compared
 * @param totalFields   number of field comparisons across all entities
 * @param entities      per-entity diffs sorted by entity key
 */
public record QaReport(Map<String, Integer> summary, int totalEntities, int totalFields, List<EntityDiff> entities) {
    public QaReport {
        summary = summary == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(summary));
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public int count(DiffStatus status) {
        return summary.getOrDefault(status.wireName(), 0);
    }
}
