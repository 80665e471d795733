package com.cgrera.extractor;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Outcome of capturing one artifact-bearing field.
 * <p>
 * Starts as a placeholder (no files, no source URL) when the mapper creates it and is replaced once per run by
 * either a resolved record, carrying the persisted files and the final URL the content was served from, or an
 * unresolved record whose notes explain the failure.
 *
 * @param fieldKey       key shared with the placeholder and the canonical document entry
 * @param status         lifecycle state
 * @param artifactType   content kind
 * @param persistedFiles storage paths relative to the output directory
 * @param sourceUrl      final URL after redirects or pop-up navigation, null unless resolved
 * @param notes          trigger hint and failure explanations, "; " separated
 */
public record ArtifactRecord(
    String fieldKey,
    ArtifactStatus status,
    ArtifactType artifactType,
    List<String> persistedFiles,
    String sourceUrl,
    String notes
) {
    public ArtifactRecord {
        status = status == null ? ArtifactStatus.PLACEHOLDER : status;
        artifactType = artifactType == null ? ArtifactType.UNKNOWN : artifactType;
        persistedFiles = persistedFiles == null ? List.of() : List.copyOf(persistedFiles);
    }

    public static ArtifactRecord placeholder(ArtifactPlaceholder placeholder) {
        return new ArtifactRecord(placeholder.fieldKey(), ArtifactStatus.PLACEHOLDER, ArtifactType.UNKNOWN,
            List.of(), null, placeholder.triggerHint());
    }

    public static ArtifactRecord resolved(String fieldKey, ArtifactType type, List<String> files, String sourceUrl, String notes) {
        return new ArtifactRecord(fieldKey, ArtifactStatus.RESOLVED, type, files, sourceUrl, notes);
    }

    public static ArtifactRecord unresolved(String fieldKey, String notes) {
        return new ArtifactRecord(fieldKey, ArtifactStatus.UNRESOLVED, ArtifactType.UNKNOWN, List.of(), null, notes);
    }

    @JsonIgnore
    public boolean isResolved() {
        return status == ArtifactStatus.RESOLVED && sourceUrl != null;
    }

    static String mergeNotes(String existing, String addition) {
        if (Utils.isBlank(existing)) return addition;
        if (Utils.isBlank(addition)) return existing;
        return existing + "; " + addition;
    }
}
