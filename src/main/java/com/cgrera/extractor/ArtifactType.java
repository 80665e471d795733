package com.cgrera.extractor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of content captured for an artifact, derived from the response content type.
 */
public enum ArtifactType {
    PDF(".pdf"),
    IMAGE(".img"),
    HTML(".html"),
    UNKNOWN(".bin");

    private final String defaultExtension;

    ArtifactType(String defaultExtension) {
        this.defaultExtension = defaultExtension;
    }

    /**
     * Classifies a content type header. Missing or unrecognised types are {@link #UNKNOWN}.
     */
    public static ArtifactType fromContentType(String contentType) {
        String lowered = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (lowered.contains("pdf")) return PDF;
        if (lowered.contains("png") || lowered.contains("jpg") || lowered.contains("jpeg") || lowered.contains("gif")) return IMAGE;
        if (lowered.contains("html") || lowered.contains("text")) return HTML;
        return UNKNOWN;
    }

    /**
     * File extension for a content type, more precise than the type default for images.
     */
    public static String extensionFor(String contentType) {
        String lowered = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (lowered.contains("png")) return ".png";
        if (lowered.contains("jpg") || lowered.contains("jpeg")) return ".jpg";
        if (lowered.contains("gif")) return ".gif";
        if (lowered.contains("text/plain")) return ".txt";
        return fromContentType(contentType).defaultExtension;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ArtifactType fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
