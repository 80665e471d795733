package com.cgrera.extractor;

import java.util.List;

/**
 * One label/value pair read from a persisted detail page.
 * <p>
 * A field whose {@code triggerHint} is set is artifact-bearing: its full value is only reachable by
 * activating a UI element (a "Preview" button wired to a script postback, for example), whether or not the
 * field is later mapped to a canonical key.
 *
 * @param label           label text as shown on the page, trailing colon removed
 * @param normalizedLabel lowercase label with punctuation stripped, used for synonym and QA lookups
 * @param valueText       collapsed visible value text, may be empty
 * @param explicitLinks   direct hyperlink destinations found in the value cell, in document order
 * @param triggerHint     locator description of the preview/view/download element, or null
 * @param triggerText     visible text of that element, or null
 * @param triggerIndex    position among the page's elements matching {@code triggerHint}, or null when unknown
 */
public record RawField(
    String label,
    String normalizedLabel,
    String valueText,
    List<String> explicitLinks,
    String triggerHint,
    String triggerText,
    Integer triggerIndex
) {
    public RawField {
        label = label == null ? "" : label;
        normalizedLabel = normalizedLabel == null ? Utils.normalizeLabel(label) : normalizedLabel;
        valueText = valueText == null ? "" : valueText;
        explicitLinks = explicitLinks == null ? List.of() : List.copyOf(explicitLinks);
    }

    public RawField(String label, String normalizedLabel, String valueText, List<String> explicitLinks,
                    String triggerHint, String triggerText) {
        this(label, normalizedLabel, valueText, explicitLinks, triggerHint, triggerText, null);
    }

    public boolean artifactBearing() {
        return triggerHint != null;
    }

    public String firstLink() {
        return explicitLinks.isEmpty() ? null : explicitLinks.get(0);
    }
}
