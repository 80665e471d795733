package com.cgrera.extractor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Categories of recoverable failures. Configuration problems are not listed here because they abort the run
 * (see {@link ConfigurationException}).
 */
public enum WarningKind {
    EXTRACTION_FAILURE,
    SYNONYM_AMBIGUITY,
    NORMALIZATION_FAILURE,
    CAPTURE_TIMEOUT,
    CAPTURE_NAVIGATION_ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WarningKind fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
