package com.cgrera.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link CanonicalRecord} from raw sections using a {@link SynonymResolver}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Each raw section title is resolved to a logical section; fields of unresolved sections and unknown
 *   labels are kept verbatim in the unmapped bag under the raw section title.</li>
 *   <li>Resolved fields are normalized by their declared type. A value that cannot be normalized is left unset
 *   in the section, kept in the unmapped bag and reported as {@link WarningKind#NORMALIZATION_FAILURE}.</li>
 *   <li>When two fields resolve to the same key the first value stays and the later one goes to the unmapped
 *   bag.</li>
 *   <li>Every artifact-bearing field becomes exactly one placeholder, mapped or not, together with a document
 *   entry whose URL is the direct link or, failing that, the visible value (often a "Preview" sentinel that
 *   capture later replaces).</li>
 *   <li>Header-led tables of mapped sections are mapped row by row; the postal code is derived from the
 *   address when the page does not list it.</li>
 * </ul>
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class CanonicalMapper implements CanonicalMapperInterface {
    private static final Logger logger = LoggerFactory.getLogger(CanonicalMapper.class);

    public static final String DEFAULT_STATE_CODE = "CG";
    static final String MISSING_URL = "NA";

    // Ordered: the first keyword found in the key or label decides the type.
    private static final Map<String, String> DOCUMENT_TYPES = new LinkedHashMap<>();
    static {
        DOCUMENT_TYPES.put("registration", "registration_certificate");
        DOCUMENT_TYPES.put("building", "building_permission");
        DOCUMENT_TYPES.put("layout", "layout_plan");
        DOCUMENT_TYPES.put("fire", "noc_fire");
        DOCUMENT_TYPES.put("environment", "noc_environment");
        DOCUMENT_TYPES.put("pollution", "noc_pollution");
        DOCUMENT_TYPES.put("water", "noc_water");
        DOCUMENT_TYPES.put("airport", "noc_other");
        DOCUMENT_TYPES.put("encumbrance", "encumbrance_certificate");
        DOCUMENT_TYPES.put("commencement", "commencement_certificate");
        DOCUMENT_TYPES.put("occupancy", "occupancy_certificate");
        DOCUMENT_TYPES.put("completion", "completion_certificate");
        DOCUMENT_TYPES.put("revenue", "revenue_record");
        DOCUMENT_TYPES.put("title", "title_document");
        DOCUMENT_TYPES.put("quarterly", "quarterly_report");
        DOCUMENT_TYPES.put("affidavit", "affidavit");
        DOCUMENT_TYPES.put("agreement", "agreement");
        DOCUMENT_TYPES.put("brochure", "brochure");
        DOCUMENT_TYPES.put("photo", "site_photograph");
    }

    private final SynonymResolver resolver;
    private final FieldNormalizer normalizer;
    private final String stateCode;

    public CanonicalMapper(SynonymResolver resolver) {
        this(resolver, new FieldNormalizer(), DEFAULT_STATE_CODE);
    }

    public CanonicalMapper(SynonymResolver resolver, FieldNormalizer normalizer, String stateCode) {
        if (resolver == null) throw new IllegalArgumentException("resolver cannot be null");
        this.resolver = resolver;
        this.normalizer = normalizer == null ? new FieldNormalizer() : normalizer;
        this.stateCode = Utils.isBlank(stateCode) ? DEFAULT_STATE_CODE : stateCode;
    }

    @Override
    public CanonicalRecord map(PersistedPage page, List<RawSection> sections) {
        if (page == null) throw new IllegalArgumentException("page cannot be null");
        CanonicalRecord record = new CanonicalRecord(page.entityKey(), stateCode, page.sourceUrl(), page.sourceFile());
        record.setSchemaVersion(resolver.table().schemaVersion());
        if (sections == null || sections.isEmpty()) {
            logger.warn("No sections to map for {}", page.entityKey());
            return record;
        }
        Set<String> fieldKeys = new HashSet<>();
        int mapped = 0;
        int unmapped = 0;
        for (RawSection section : sections) {
            section.warnings().forEach(record::addWarning);
            SynonymTable.LogicalSection logical = resolver.resolveSection(section.titleText());
            if (logical == null) {
                logger.debug("Section '{}' of {} is not in the synonym table", section.titleText(), page.entityKey());
            }
            for (RawField field : section.fields()) {
                String canonicalKey = null;
                if (logical != null) {
                    canonicalKey = resolveKey(record, logical, field);
                }
                if (canonicalKey != null && assignValue(record, logical, canonicalKey, section.titleText(), field)) {
                    mapped++;
                } else {
                    putUnmapped(record, section.titleText(), field.label(), field.valueText());
                    unmapped++;
                }
                boolean documentField = logical != null && logical.name().equals(resolver.table().documentsSection());
                if (field.artifactBearing() || documentField) {
                    String base = canonicalKey != null ? canonicalKey
                        : Utils.slugify(section.titleText()) + "." + Utils.slugify(field.label());
                    String fieldKey = uniqueKey(fieldKeys, base);
                    if (field.artifactBearing()) {
                        addPlaceholder(record, fieldKey, section.titleText(), field);
                    }
                    record.getDocuments().add(toDocument(fieldKey, field));
                }
            }
            if (!section.tables().isEmpty()) {
                mapTables(record, logical, section);
            }
        }
        derivePostalCode(record);
        logger.info("Mapped {}: {} fields mapped, {} unmapped, {} placeholders, {} documents, {} warnings",
            page.entityKey(), mapped, unmapped, record.getPlaceholders().size(), record.getDocuments().size(),
            record.getWarnings().size());
        return record;
    }

    private String resolveKey(CanonicalRecord record, SynonymTable.LogicalSection logical, RawField field) {
        SynonymResolver.KeyResolution resolution = resolver.resolveKey(logical.name(), field.normalizedLabel());
        if (resolution.ambiguous()) {
            String message = String.format("Label '%s' matches keys %s; using '%s'", field.label(),
                resolution.candidates(), resolution.canonicalKey());
            logger.warn("{} in section {}", message, logical.name());
            record.addWarning(new ProcessingWarning(WarningKind.SYNONYM_AMBIGUITY,
                logical.name() + "." + resolution.canonicalKey(), message));
        }
        return resolution.canonicalKey();
    }

    /**
     * Stores a resolved value, normalized by type.
     * @return false when the value belongs in the unmapped bag instead
     */
    private boolean assignValue(CanonicalRecord record, SynonymTable.LogicalSection logical, String key,
                                String sectionTitle, RawField field) {
        Map<String, String> values = record.sectionValues(logical.name());
        if (values.containsKey(key)) {
            logger.debug("Duplicate value for {}.{} from label '{}'; keeping the first", logical.name(), key, field.label());
            return false;
        }
        String value = field.valueText();
        FieldType type = logical.typeOf(key);
        if (type == FieldType.TEXT || value.isEmpty()) {
            values.put(key, value);
            return true;
        }
        Optional<String> normalized = normalizer.normalize(type, value);
        if (normalized.isPresent()) {
            values.put(key, normalized.get());
            return true;
        }
        String location = logical.name() + "." + key;
        logger.warn("Could not normalize {} value '{}' for {} (section '{}')", type, value, location, sectionTitle);
        record.addWarning(new ProcessingWarning(WarningKind.NORMALIZATION_FAILURE, location,
            "Unparseable " + type.name().toLowerCase(Locale.ROOT) + " value '" + value + "'"));
        return false;
    }

    private void addPlaceholder(CanonicalRecord record, String fieldKey, String sectionTitle, RawField field) {
        ArtifactPlaceholder placeholder = new ArtifactPlaceholder(fieldKey, sectionTitle, field.label(),
            field.triggerHint(), field.triggerText(), field.firstLink(), field.triggerIndex());
        record.getPlaceholders().add(placeholder);
        record.getArtifacts().put(fieldKey, ArtifactRecord.placeholder(placeholder));
    }

    private CanonicalDocument toDocument(String fieldKey, RawField field) {
        String url = field.firstLink();
        if (Utils.isBlank(url)) url = field.valueText();
        if (Utils.isBlank(url)) url = MISSING_URL;
        String uploadedOn = null;
        if (field.firstLink() != null && !field.valueText().isEmpty()) {
            uploadedOn = normalizer.normalizeDate(field.valueText()).orElse(null);
        }
        return new CanonicalDocument(fieldKey, field.label(), documentType(fieldKey, field.normalizedLabel()), url, uploadedOn);
    }

    static String documentType(String fieldKey, String normalizedLabel) {
        String haystack = (fieldKey + " " + normalizedLabel).toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : DOCUMENT_TYPES.entrySet()) {
            if (haystack.contains(entry.getKey())) return entry.getValue();
        }
        return "other";
    }

    private void mapTables(CanonicalRecord record, SynonymTable.LogicalSection logical, RawSection section) {
        int tableIndex = 0;
        for (RawTable table : section.tables()) {
            tableIndex++;
            int rowIndex = 0;
            for (List<String> row : table.rows()) {
                rowIndex++;
                if (logical == null) {
                    for (int i = 0; i < row.size(); i++) {
                        String header = i < table.headers().size() ? table.headers().get(i) : "Column " + (i + 1);
                        putUnmapped(record, section.titleText(),
                            String.format("%s [table %d, row %d]", header, tableIndex, rowIndex), row.get(i));
                    }
                    continue;
                }
                Map<String, String> mappedRow = new LinkedHashMap<>();
                for (int i = 0; i < row.size(); i++) {
                    String header = i < table.headers().size() ? table.headers().get(i) : "";
                    String key = resolver.resolveHeader(logical.name(), header);
                    if (key == null) key = Utils.slugify(header.isEmpty() ? "column " + (i + 1) : header);
                    mappedRow.putIfAbsent(key, row.get(i));
                }
                record.getTableRows().computeIfAbsent(logical.name(), k -> new ArrayList<>()).add(mappedRow);
            }
        }
    }

    private void derivePostalCode(CanonicalRecord record) {
        SynonymTable.PostalCodeRule rule = resolver.table().postalCodeRule();
        if (rule == null) return;
        Map<String, String> values = record.getSections().get(rule.section());
        if (values == null || !Utils.isBlank(values.get(rule.targetKey()))) return;
        for (String addressKey : rule.addressKeys()) {
            Optional<String> postalCode = normalizer.extractPostalCode(values.get(addressKey));
            if (postalCode.isPresent()) {
                values.put(rule.targetKey(), postalCode.get());
                logger.debug("Derived {}.{} = {} from {}", rule.section(), rule.targetKey(), postalCode.get(), addressKey);
                return;
            }
        }
    }

    private static void putUnmapped(CanonicalRecord record, String sectionTitle, String label, String value) {
        Map<String, String> slot = record.unmappedSlot(sectionTitle);
        String key = Utils.isBlank(label) ? "(unlabeled)" : label;
        String candidate = key;
        int n = 2;
        while (slot.containsKey(candidate)) {
            candidate = key + " (" + n++ + ")";
        }
        slot.put(candidate, value);
    }

    static String uniqueKey(Set<String> used, String base) {
        String candidate = base;
        int n = 2;
        while (!used.add(candidate)) {
            candidate = base + "_" + n++;
        }
        return candidate;
    }
}
