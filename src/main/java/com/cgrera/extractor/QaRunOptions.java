package com.cgrera.extractor;

/**
 * Entity selection for a QA run.
 *
 * @param entityFilter only entities whose key contains this text are compared; null or blank selects all
 * @param limit        maximum number of entities, taken in key order; zero or negative means no cap
 */
public record QaRunOptions(String entityFilter, int limit) {
    public static QaRunOptions all() {
        return new QaRunOptions(null, 0);
    }

    public boolean selects(String entityKey) {
        return Utils.isBlank(entityFilter) || (entityKey != null && entityKey.contains(entityFilter));
    }
}
