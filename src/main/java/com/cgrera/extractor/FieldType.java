package com.cgrera.extractor;

/**
 * Value type of a canonical field, declared per key in the synonym table.
 */
public enum FieldType {
    TEXT,
    DATE,
    INTEGER,
    DECIMAL;

    static FieldType parse(String value) {
        if (value == null || value.isBlank()) return TEXT;
        return valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
