package com.cgrera.extractor;

import java.util.Map;

/**
 * What QA compares for one entity: the page's raw fields by normalized label and the final record.
 */
public record QaEntityInput(String entityKey, Map<String, RawField> rawByLabel, CanonicalRecord record) {}
