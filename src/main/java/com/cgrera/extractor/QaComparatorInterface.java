package com.cgrera.extractor;

import java.util.List;
import java.util.Map;

/**
 * Interface for field-by-field verification of canonical records against their source pages.
 */
public interface QaComparatorInterface {
    /**
     * Compares every configured path of one record with the page value under the configured label.
     * @param rawByLabel raw fields by normalized label, first occurrence per label
     * @param record     final canonical record
     * @return one diff per configured mapping, in mapping order
     */
    List<FieldDiff> compare(Map<String, RawField> rawByLabel, CanonicalRecord record);

    /**
     * Compares the selected entities and aggregates the run.
     * @param inputs  entities to consider, any order
     * @param options entity filter and cap
     * @return report with entities sorted by key
     */
    QaReport compareAll(List<QaEntityInput> inputs, QaRunOptions options);
}
