package com.cgrera.extractor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interface for turning one persisted detail page into raw sections of labeled fields.
 */
public interface FieldExtractorInterface {
    /**
     * Parses a persisted page into ordered sections. Section-level parse failures are recorded as warnings on
     * the affected section and never abort the page.
     * @param page persisted page (may be null)
     * @return sections in page order, empty when the page has no usable content
     */
    List<RawSection> extract(PersistedPage page);

    /**
     * Indexes raw fields by normalized label. When a label occurs more than once the first occurrence wins,
     * matching page reading order.
     * @param sections extracted sections
     * @return normalized label → field
     */
    default Map<String, RawField> indexByLabel(List<RawSection> sections) {
        Map<String, RawField> index = new LinkedHashMap<>();
        if (sections == null) return index;
        for (RawSection section : sections) {
            for (RawField field : section.fields()) {
                if (!field.normalizedLabel().isEmpty()) index.putIfAbsent(field.normalizedLabel(), field);
            }
        }
        return index;
    }
}
