package com.cgrera.extractor;

import java.util.List;

/**
 * A titled section of a detail page with its fields and data tables in page order.
 * Produced once per page by {@link FieldExtractor} and never modified afterwards.
 */
public record RawSection(
    String titleText,
    List<RawField> fields,
    List<RawTable> tables,
    List<ProcessingWarning> warnings
) {
    public RawSection {
        titleText = titleText == null ? "" : titleText;
        fields = fields == null ? List.of() : List.copyOf(fields);
        tables = tables == null ? List.of() : List.copyOf(tables);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public RawSection(String titleText, List<RawField> fields) {
        this(titleText, fields, List.of(), List.of());
    }
}
