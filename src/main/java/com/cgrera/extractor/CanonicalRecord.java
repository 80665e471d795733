package com.cgrera.extractor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema-versioned structured record of one registered project.
 * <p>
 * Layout:
 * <ul>
 *   <li>{@code sections}: logical section → canonical key → normalized value, in discovery order.</li>
 *   <li>{@code tableRows}: logical section → rows mapped from header-led tables (quarterly updates, unit types).</li>
 *   <li>{@code documents}: one entry per document field, URL back-propagated after capture.</li>
 *   <li>{@code unmapped}: raw section title → raw label → value for everything the synonym table does not
 *   recognise yet, plus values whose normalization failed.</li>
 *   <li>{@code placeholders} and {@code artifacts}: every artifact-bearing field, keyed by field key.</li>
 *   <li>{@code warnings}: manifest of recoverable problems met while building and enriching the record.</li>
 * </ul>
 * The record is mutated twice: by {@link CanonicalMapper} when it is built and by {@link ArtifactCapturer}
 * when captured URLs are written back. Collections are insertion ordered so serialization is reproducible.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class CanonicalRecord {
    public static final String SCHEMA_VERSION = "1.0";

    private String schemaVersion = SCHEMA_VERSION;
    private String entityKey;
    private String stateCode;
    private String sourceUrl;
    private String sourceFile;
    private Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    private Map<String, List<Map<String, String>>> tableRows = new LinkedHashMap<>();
    private List<CanonicalDocument> documents = new ArrayList<>();
    private Map<String, Map<String, String>> unmapped = new LinkedHashMap<>();
    private List<ArtifactPlaceholder> placeholders = new ArrayList<>();
    private Map<String, ArtifactRecord> artifacts = new LinkedHashMap<>();
    private List<ProcessingWarning> warnings = new ArrayList<>();

    public CanonicalRecord() {}

    public CanonicalRecord(String entityKey, String stateCode, String sourceUrl, String sourceFile) {
        this.entityKey = entityKey;
        this.stateCode = stateCode;
        this.sourceUrl = sourceUrl;
        this.sourceFile = sourceFile;
    }

    /** Returns the value map of a logical section, creating it on first use. */
    public Map<String, String> sectionValues(String logicalSection) {
        return sections.computeIfAbsent(logicalSection, k -> new LinkedHashMap<>());
    }

    /** Returns the unmapped slot of a raw section title, creating it on first use. */
    public Map<String, String> unmappedSlot(String sectionTitle) {
        return unmapped.computeIfAbsent(sectionTitle, k -> new LinkedHashMap<>());
    }

    public CanonicalDocument documentFor(String fieldKey) {
        for (CanonicalDocument document : documents) {
            if (fieldKey.equals(document.getFieldKey())) return document;
        }
        return null;
    }

    public void addWarning(ProcessingWarning warning) {
        warnings.add(warning);
    }

    public String getSchemaVersion() { return schemaVersion; }
    public void setSchemaVersion(String schemaVersion) { this.schemaVersion = schemaVersion; }
    public String getEntityKey() { return entityKey; }
    public void setEntityKey(String entityKey) { this.entityKey = entityKey; }
    public String getStateCode() { return stateCode; }
    public void setStateCode(String stateCode) { this.stateCode = stateCode; }
    public String getSourceUrl() { return sourceUrl; }
    public void setSourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; }
    public String getSourceFile() { return sourceFile; }
    public void setSourceFile(String sourceFile) { this.sourceFile = sourceFile; }
    public Map<String, Map<String, String>> getSections() { return sections; }
    public void setSections(Map<String, Map<String, String>> sections) { this.sections = sections; }
    public Map<String, List<Map<String, String>>> getTableRows() { return tableRows; }
    public void setTableRows(Map<String, List<Map<String, String>>> tableRows) { this.tableRows = tableRows; }
    public List<CanonicalDocument> getDocuments() { return documents; }
    public void setDocuments(List<CanonicalDocument> documents) { this.documents = documents; }
    public Map<String, Map<String, String>> getUnmapped() { return unmapped; }
    public void setUnmapped(Map<String, Map<String, String>> unmapped) { this.unmapped = unmapped; }
    public List<ArtifactPlaceholder> getPlaceholders() { return placeholders; }
    public void setPlaceholders(List<ArtifactPlaceholder> placeholders) { this.placeholders = placeholders; }
    public Map<String, ArtifactRecord> getArtifacts() { return artifacts; }
    public void setArtifacts(Map<String, ArtifactRecord> artifacts) { this.artifacts = artifacts; }
    public List<ProcessingWarning> getWarnings() { return warnings; }
    public void setWarnings(List<ProcessingWarning> warnings) { this.warnings = warnings; }
}
