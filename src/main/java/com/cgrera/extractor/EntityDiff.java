package com.cgrera.extractor;

import java.util.List;

/**
 * Field diffs of one entity, in mapping order.
 */
public record EntityDiff(String entityKey, List<FieldDiff> diffs) {
    public EntityDiff {
        diffs = diffs == null ? List.of() : List.copyOf(diffs);
    }

    public long count(DiffStatus status) {
        return diffs.stream().filter(d -> d.status() == status).count();
    }
}
