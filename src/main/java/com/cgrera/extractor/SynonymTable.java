package com.cgrera.extractor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly typed synonym configuration, validated by {@link SynonymTableLoader}.
 * <p>
 * For every logical section it holds the section-title variants and, per canonical key, the ordered list of
 * label variants that map onto it. Sections and keys keep their declaration order, which is the tie-break
 * order when a label matches more than one key.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public final class SynonymTable {
    public static final String DEFAULT_DOCUMENTS_SECTION = "documents";

    /**
     * @param name          logical section name, e.g. {@code project_details}
     * @param titleVariants section titles that identify this logical section on the page
     * @param keys          canonical key → ordered label variants
     * @param fieldTypes    canonical key → value type; keys not listed are text
     */
    public record LogicalSection(String name, List<String> titleVariants, Map<String, List<String>> keys, Map<String, FieldType> fieldTypes) {
        public LogicalSection {
            titleVariants = List.copyOf(titleVariants);
            Map<String, List<String>> orderedKeys = new LinkedHashMap<>();
            keys.forEach((key, variants) -> orderedKeys.put(key, List.copyOf(variants)));
            keys = Collections.unmodifiableMap(orderedKeys);
            fieldTypes = fieldTypes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fieldTypes));
        }

        public FieldType typeOf(String canonicalKey) {
            return fieldTypes.getOrDefault(canonicalKey, FieldType.TEXT);
        }
    }

    /**
     * Derivation of the postal code from an address-like field when the page does not list it separately.
     *
     * @param section     logical section holding both the target and the address keys
     * @param targetKey   canonical key that receives the postal code
     * @param addressKeys canonical keys searched in order
     */
    public record PostalCodeRule(String section, String targetKey, List<String> addressKeys) {
        public PostalCodeRule {
            addressKeys = List.copyOf(addressKeys);
        }
    }

    private final String schemaVersion;
    private final List<LogicalSection> sections;
    private final String documentsSection;
    private final PostalCodeRule postalCodeRule;

    public SynonymTable(String schemaVersion, List<LogicalSection> sections, String documentsSection, PostalCodeRule postalCodeRule) {
        this.schemaVersion = schemaVersion;
        this.sections = List.copyOf(sections);
        this.documentsSection = documentsSection == null ? DEFAULT_DOCUMENTS_SECTION : documentsSection;
        this.postalCodeRule = postalCodeRule;
    }

    public String schemaVersion() {
        return schemaVersion;
    }

    public List<LogicalSection> sections() {
        return sections;
    }

    public String documentsSection() {
        return documentsSection;
    }

    /** @return the postal code rule, or null when the table does not configure one */
    public PostalCodeRule postalCodeRule() {
        return postalCodeRule;
    }

    public LogicalSection section(String name) {
        for (LogicalSection section : sections) {
            if (section.name().equals(name)) return section;
        }
        return null;
    }
}
