package com.cgrera.extractor;

import java.util.Locale;

/**
 * One configured QA comparison: a logical path in the canonical record and the label it is shown under on
 * the page.
 *
 * @param logicalPath {@code section.key}, {@code metadata.key} or {@code documents[i].attr}
 * @param label       original page label
 * @param compareAs   {@code text} or {@code date}; date comparisons normalize the page value first
 */
public record QaFieldMapping(String logicalPath, String label, String compareAs) {
    public static final String COMPARE_AS_TEXT = "text";
    public static final String COMPARE_AS_DATE = "date";

    public QaFieldMapping {
        compareAs = Utils.isBlank(compareAs) ? COMPARE_AS_TEXT : compareAs.trim().toLowerCase(Locale.ROOT);
    }

    public boolean comparesDates() {
        return COMPARE_AS_DATE.equals(compareAs);
    }
}
