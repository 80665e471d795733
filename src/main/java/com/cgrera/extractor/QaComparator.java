package com.cgrera.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Field-level QA: checks that what a page shows under a label survived into the canonical record.
 * <p>
 * Both sides are trimmed, whitespace-collapsed and case-folded before comparison. Classification, first rule
 * that applies:
 * <ol>
 *   <li>page value is a trigger label ("Preview", "View", "Download" or the trigger's own text):
 *   {@code placeholder_unresolved}</li>
 *   <li>values equal, including both empty: {@code match}</li>
 *   <li>record value empty: {@code missing_in_record}</li>
 *   <li>page value empty: {@code missing_in_html}</li>
 *   <li>otherwise {@code mismatch}</li>
 * </ol>
 * Date mappings run the page value through {@link FieldNormalizer#normalizeDate(String)} first, so
 * "15/03/2024" on the page matches "2024-03-15" in the record.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class QaComparator implements QaComparatorInterface {
    private static final Logger logger = LoggerFactory.getLogger(QaComparator.class);

    private static final Pattern DOCUMENT_PATH = Pattern.compile("^documents\\[(\\d+)]\\.([a-z_]+)$");
    private static final Set<String> TRIGGER_LABELS = Set.of("preview", "view", "download");

    private final List<QaFieldMapping> mappings;
    private final FieldNormalizer normalizer;

    public QaComparator(List<QaFieldMapping> mappings) {
        this(mappings, new FieldNormalizer());
    }

    public QaComparator(List<QaFieldMapping> mappings, FieldNormalizer normalizer) {
        if (mappings == null || mappings.isEmpty()) {
            throw new ConfigurationException("QA comparator needs at least one field mapping");
        }
        this.mappings = List.copyOf(mappings);
        this.normalizer = normalizer == null ? new FieldNormalizer() : normalizer;
    }

    @Override
    public List<FieldDiff> compare(Map<String, RawField> rawByLabel, CanonicalRecord record) {
        List<FieldDiff> diffs = new ArrayList<>();
        for (QaFieldMapping mapping : mappings) {
            String canonical = Utils.collapseWhitespace(canonicalValue(record, mapping.logicalPath()));
            RawField field = rawByLabel == null ? null : rawByLabel.get(Utils.normalizeLabel(mapping.label()));
            String raw = Utils.collapseWhitespace(rawValue(field, mapping.logicalPath()));
            diffs.add(new FieldDiff(mapping.logicalPath(), canonical, raw,
                classify(canonical, raw, field == null ? null : field.triggerText(), mapping)));
        }
        return diffs;
    }

    /**
     * A raw value that is only the label of a preview control. Placeholder words such as "NA" are real values
     * here and compare like any other text.
     */
    static boolean isTriggerLabel(String raw, String triggerText) {
        if (raw == null || raw.isBlank()) return false;
        String folded = raw.trim().toLowerCase(Locale.ROOT);
        if (TRIGGER_LABELS.contains(folded)) return true;
        return triggerText != null && folded.equals(triggerText.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Classifies one pair of collapsed values.
     */
    DiffStatus classify(String canonical, String raw, String triggerText, QaFieldMapping mapping) {
        if (isTriggerLabel(raw, triggerText)) {
            return DiffStatus.PLACEHOLDER_UNRESOLVED;
        }
        String comparableRaw = raw;
        if (mapping.comparesDates() && !raw.isEmpty()) {
            comparableRaw = normalizer.normalizeDate(raw).orElse(raw);
        }
        if (Utils.foldForComparison(canonical).equals(Utils.foldForComparison(comparableRaw))) {
            return DiffStatus.MATCH;
        }
        if (canonical.isEmpty()) return DiffStatus.MISSING_IN_RECORD;
        if (raw.isEmpty()) return DiffStatus.MISSING_IN_HTML;
        return DiffStatus.MISMATCH;
    }

    @Override
    public QaReport compareAll(List<QaEntityInput> inputs, QaRunOptions options) {
        QaRunOptions effective = options == null ? QaRunOptions.all() : options;
        List<QaEntityInput> selected = new ArrayList<>();
        if (inputs != null) {
            for (QaEntityInput input : inputs) {
                if (effective.selects(input.entityKey())) selected.add(input);
            }
        }
        selected.sort(Comparator.comparing(QaEntityInput::entityKey));
        if (effective.limit() > 0 && selected.size() > effective.limit()) {
            selected = new ArrayList<>(selected.subList(0, effective.limit()));
        }
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (DiffStatus status : DiffStatus.values()) summary.put(status.wireName(), 0);
        List<EntityDiff> entities = new ArrayList<>();
        int totalFields = 0;
        for (QaEntityInput input : selected) {
            List<FieldDiff> diffs = compare(input.rawByLabel(), input.record());
            for (FieldDiff diff : diffs) summary.merge(diff.status().wireName(), 1, Integer::sum);
            totalFields += diffs.size();
            entities.add(new EntityDiff(input.entityKey(), diffs));
            logger.debug("QA {}: {} fields compared", input.entityKey(), diffs.size());
        }
        logger.info("QA compared {} entities, {} fields: {}", entities.size(), totalFields, summary);
        return new QaReport(summary, entities.size(), totalFields, entities);
    }

    /**
     * Reads a logical path from the record. Unknown sections, keys or indexes read as empty.
     */
    static String canonicalValue(CanonicalRecord record, String logicalPath) {
        if (record == null || logicalPath == null) return "";
        Matcher doc = DOCUMENT_PATH.matcher(logicalPath);
        if (doc.matches()) {
            int index = Integer.parseInt(doc.group(1));
            if (index >= record.getDocuments().size()) return "";
            CanonicalDocument document = record.getDocuments().get(index);
            return nullToEmpty(switch (doc.group(2)) {
                case "field_key" -> document.getFieldKey();
                case "name" -> document.getName();
                case "document_type" -> document.getDocumentType();
                case "url" -> document.getUrl();
                case "uploaded_on" -> document.getUploadedOn();
                default -> null;
            });
        }
        int dot = logicalPath.indexOf('.');
        if (dot <= 0) return "";
        String section = logicalPath.substring(0, dot);
        String key = logicalPath.substring(dot + 1);
        if ("metadata".equals(section)) {
            return nullToEmpty(switch (key) {
                case "entity_key" -> record.getEntityKey();
                case "state_code" -> record.getStateCode();
                case "source_url" -> record.getSourceUrl();
                case "source_file" -> record.getSourceFile();
                case "schema_version" -> record.getSchemaVersion();
                default -> null;
            });
        }
        Map<String, String> values = record.getSections().get(section);
        return values == null ? "" : nullToEmpty(values.get(key));
    }

    private static String rawValue(RawField field, String logicalPath) {
        if (field == null) return "";
        if (logicalPath.endsWith(".url") && field.firstLink() != null) return field.firstLink();
        return field.valueText();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
