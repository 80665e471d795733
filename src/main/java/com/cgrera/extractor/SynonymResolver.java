package com.cgrera.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves raw section titles and labels against a {@link SynonymTable}.
 * <p>
 * Variants are normalized once at construction with the same rules applied to raw labels, so matching is a
 * map lookup. When one normalized variant belongs to several canonical keys of a section the table is
 * ambiguous: lookups return every candidate in declaration order and the first one wins.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class SynonymResolver {
    private static final Logger logger = LoggerFactory.getLogger(SynonymResolver.class);

    /**
     * Result of a label lookup.
     * @param canonicalKey winning key, null when the label is unknown to the section
     * @param candidates   every key whose variants contain the label, in declaration order
     */
    public record KeyResolution(String canonicalKey, List<String> candidates) {
        public boolean resolved() {
            return canonicalKey != null;
        }

        public boolean ambiguous() {
            return candidates.size() > 1;
        }
    }

    private final SynonymTable table;
    private final Map<String, Map<String, List<String>>> labelIndex = new LinkedHashMap<>();

    public SynonymResolver(SynonymTable table) {
        this.table = table;
        for (SynonymTable.LogicalSection section : table.sections()) {
            Map<String, List<String>> index = new LinkedHashMap<>();
            section.keys().forEach((key, variants) -> {
                for (String variant : variants) {
                    List<String> owners = index.computeIfAbsent(Utils.normalizeLabel(variant), v -> new ArrayList<>());
                    if (!owners.contains(key)) owners.add(key);
                }
            });
            index.forEach((variant, owners) -> {
                if (owners.size() > 1) {
                    logger.warn("Synonym table is ambiguous in section '{}': label '{}' maps to {}; '{}' wins",
                        section.name(), variant, owners, owners.get(0));
                }
            });
            labelIndex.put(section.name(), index);
        }
    }

    public SynonymTable table() {
        return table;
    }

    /**
     * Finds the logical section for a raw section title. The first logical section whose title variants
     * contain the title wins.
     * @param rawTitle title as found on the page
     * @return logical section, or null when the section is unmapped
     */
    public SynonymTable.LogicalSection resolveSection(String rawTitle) {
        String normalized = Utils.normalizeTitle(rawTitle);
        if (normalized.isEmpty()) return null;
        for (SynonymTable.LogicalSection section : table.sections()) {
            for (String variant : section.titleVariants()) {
                if (normalized.equals(Utils.normalizeTitle(variant))) {
                    return section;
                }
            }
        }
        return null;
    }

    /**
     * Looks up a normalized label inside one logical section.
     */
    public KeyResolution resolveKey(String logicalSection, String normalizedLabel) {
        Map<String, List<String>> index = labelIndex.get(logicalSection);
        if (index == null || normalizedLabel == null) return new KeyResolution(null, List.of());
        List<String> owners = index.get(normalizedLabel);
        if (owners == null || owners.isEmpty()) return new KeyResolution(null, List.of());
        return new KeyResolution(owners.get(0), List.copyOf(owners));
    }

    /**
     * Maps a data-table header to a canonical key: the first key, in declaration order, having a variant
     * contained in the normalized header. Headers carry units and qualifiers ("Carpet Area (sq m)"), hence the
     * containment test instead of equality.
     * @return canonical key or null
     */
    public String resolveHeader(String logicalSection, String header) {
        SynonymTable.LogicalSection section = table.section(logicalSection);
        String normalized = Utils.normalizeLabel(header);
        if (section == null || normalized.isEmpty()) return null;
        for (Map.Entry<String, List<String>> entry : section.keys().entrySet()) {
            for (String variant : entry.getValue()) {
                String normalizedVariant = Utils.normalizeLabel(variant);
                if (!normalizedVariant.isEmpty() && normalized.contains(normalizedVariant)) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }
}
