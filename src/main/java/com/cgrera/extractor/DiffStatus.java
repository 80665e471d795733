package com.cgrera.extractor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classification of one compared field.
 */
public enum DiffStatus {
    MATCH,
    MISMATCH,
    MISSING_IN_RECORD,
    MISSING_IN_HTML,
    PLACEHOLDER_UNRESOLVED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DiffStatus fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
