package com.cgrera.extractor;

/**
 * An artifact-bearing field waiting to be captured.
 *
 * @param fieldKey     canonical key when the field resolved, otherwise {@code slug(section).slug(label)}
 * @param sectionTitle title of the raw section the field came from
 * @param label        raw label
 * @param triggerHint  locator of the preview element ({@code #id}, {@code tag.class} or visible text)
 * @param triggerText  visible text of the preview element, used to recognise sentinel values
 * @param explicitLink first direct link of the field, null when the destination needs script execution
 * @param triggerIndex which of the elements matching {@code triggerHint} to activate, null when unknown
 */
public record ArtifactPlaceholder(
    String fieldKey,
    String sectionTitle,
    String label,
    String triggerHint,
    String triggerText,
    String explicitLink,
    Integer triggerIndex
) {
    public ArtifactPlaceholder(String fieldKey, String sectionTitle, String label, String triggerHint,
                               String triggerText, String explicitLink) {
        this(fieldKey, sectionTitle, label, triggerHint, triggerText, explicitLink, null);
    }
}
