package com.cgrera.extractor;

import java.util.List;

/**
 * Header-led data table (quarterly updates, unit types, bank accounts) found inside a section.
 */
public record RawTable(List<String> headers, List<List<String>> rows) {
    public RawTable {
        headers = headers == null ? List.of() : List.copyOf(headers);
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }
}
