package com.cgrera.extractor;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class QaComparatorTest {
    private static final QaFieldMapping DISTRICT = new QaFieldMapping("project_details.district", "District", null);
    private static final QaFieldMapping LAUNCH = new QaFieldMapping("project_details.launch_date", "Launch Date", "date");

    private final QaComparator comparator = new QaComparator(List.of(DISTRICT, LAUNCH));

    private static CanonicalRecord recordWith(String entityKey, String district, String launchDate) {
        CanonicalRecord record = new CanonicalRecord(entityKey, "CG", null, entityKey + ".html");
        Map<String, String> values = record.sectionValues("project_details");
        if (district != null) values.put("district", district);
        if (launchDate != null) values.put("launch_date", launchDate);
        return record;
    }

    private static Map<String, RawField> raw(String district, String launchDate) {
        return Map.of(
            "district", new RawField("District", null, district, List.of(), null, null),
            "launch date", new RawField("Launch Date", null, launchDate, List.of(), null, null));
    }

    @Test
    void testClassificationOrder() {
        assertEquals(DiffStatus.MATCH, comparator.classify("Raipur", " raipur ", null, DISTRICT));
        assertEquals(DiffStatus.MATCH, comparator.classify("", "", null, DISTRICT));
        assertEquals(DiffStatus.MISSING_IN_RECORD, comparator.classify("", "Raipur", null, DISTRICT));
        assertEquals(DiffStatus.MISSING_IN_HTML, comparator.classify("Raipur", "", null, DISTRICT));
        assertEquals(DiffStatus.MISMATCH, comparator.classify("Raipur", "Durg", null, DISTRICT));
        assertEquals(DiffStatus.PLACEHOLDER_UNRESOLVED, comparator.classify("https://example.org/a.pdf", "Preview", null, DISTRICT));
        assertEquals(DiffStatus.PLACEHOLDER_UNRESOLVED, comparator.classify("", "Show", "Show", DISTRICT));
    }

    @Test
    void testPlaceholderWordsCompareAsValues() {
        assertEquals(DiffStatus.MATCH, comparator.classify("NA", "NA", null, DISTRICT));
        assertEquals(DiffStatus.MATCH, comparator.classify("n/a", "N/A", null, DISTRICT));
        assertEquals(DiffStatus.MISSING_IN_RECORD, comparator.classify("", "NA", null, DISTRICT));
        assertEquals(DiffStatus.MISMATCH, comparator.classify("Raipur", "Not Available", null, DISTRICT));
        assertEquals(DiffStatus.PLACEHOLDER_UNRESOLVED, comparator.classify("", "Download", null, DISTRICT));
        assertEquals(DiffStatus.PLACEHOLDER_UNRESOLVED, comparator.classify("NA", "View", null, DISTRICT));
    }

    @Test
    void testDateMappingsCompareNormalizedDates() {
        assertEquals(DiffStatus.MATCH, comparator.classify("2024-03-15", "15/03/2024", null, LAUNCH));
        assertEquals(DiffStatus.MISMATCH, comparator.classify("2024-03-15", "16/03/2024", null, LAUNCH));
        assertEquals(DiffStatus.MISMATCH, comparator.classify("2024-03-15", "15/03/2024", null, DISTRICT));
    }

    @Test
    void testCompareUsesLabelsAndPaths() {
        List<FieldDiff> diffs = comparator.compare(raw("Raipur", "15/03/2024"), recordWith("E1", "raipur", "2024-03-15"));
        assertEquals(2, diffs.size());
        assertEquals("project_details.district", diffs.get(0).logicalPath());
        assertEquals("raipur", diffs.get(0).canonicalValue());
        assertEquals("Raipur", diffs.get(0).rawHtmlValue());
        assertTrue(diffs.stream().allMatch(d -> d.status() == DiffStatus.MATCH));

        List<FieldDiff> missing = comparator.compare(Map.of(), recordWith("E1", "Raipur", null));
        assertEquals(DiffStatus.MISSING_IN_HTML, missing.get(0).status());
        assertEquals(DiffStatus.MATCH, missing.get(1).status());
    }

    @Test
    void testSamplePageAgainstBundledMapping() {
        PersistedPage page = TestResources.samplePage();
        FieldExtractor extractor = new FieldExtractor();
        List<RawSection> sections = extractor.extract(page);
        CanonicalRecord record = new CanonicalMapper(TestResources.bundledResolver()).map(page, sections);
        QaComparator bundled = new QaComparator(new QaFieldMappingLoader().loadConfigured(null));

        Map<String, DiffStatus> statuses = bundled.compare(extractor.indexByLabel(sections), record).stream()
            .collect(Collectors.toMap(FieldDiff::logicalPath, FieldDiff::status));
        assertEquals(DiffStatus.MATCH, statuses.get("project_details.project_name"));
        assertEquals(DiffStatus.MATCH, statuses.get("project_details.launch_date"));
        assertEquals(DiffStatus.MISSING_IN_RECORD, statuses.get("project_details.expected_completion_date"));
        assertEquals(DiffStatus.PLACEHOLDER_UNRESOLVED, statuses.get("documents[0].url"));
        assertEquals(10, statuses.values().stream().filter(s -> s == DiffStatus.MATCH).count());
    }

    @Test
    void testCompareAllFiltersSortsAndLimits() {
        List<QaEntityInput> inputs = List.of(
            new QaEntityInput("PCGRERA300", raw("Durg", ""), recordWith("PCGRERA300", "Raipur", null)),
            new QaEntityInput("PCGRERA100", raw("Raipur", "15/03/2024"), recordWith("PCGRERA100", "Raipur", "2024-03-15")),
            new QaEntityInput("XYZ200", raw("Korba", ""), recordWith("XYZ200", "", null)));

        QaReport all = comparator.compareAll(inputs, QaRunOptions.all());
        assertEquals(List.of("PCGRERA100", "PCGRERA300", "XYZ200"),
            all.entities().stream().map(EntityDiff::entityKey).collect(Collectors.toList()));
        assertEquals(3, all.totalEntities());
        assertEquals(6, all.totalFields());
        assertEquals(4, all.count(DiffStatus.MATCH));
        assertEquals(1, all.count(DiffStatus.MISMATCH));
        assertEquals(1, all.count(DiffStatus.MISSING_IN_RECORD));
        assertEquals(0, all.count(DiffStatus.PLACEHOLDER_UNRESOLVED));
        assertEquals(DiffStatus.values().length, all.summary().size());

        QaReport filtered = comparator.compareAll(inputs, new QaRunOptions("PCGRERA", 1));
        assertEquals(1, filtered.totalEntities());
        assertEquals("PCGRERA100", filtered.entities().get(0).entityKey());
    }

    @Test
    void testCanonicalValuePaths() {
        CanonicalRecord record = recordWith("E9", "Raipur", null);
        record.getDocuments().add(new CanonicalDocument("brochure", "Brochure", "brochure", "https://example.org/b.pdf", null));
        assertEquals("https://example.org/b.pdf", QaComparator.canonicalValue(record, "documents[0].url"));
        assertEquals("", QaComparator.canonicalValue(record, "documents[3].url"));
        assertEquals("E9", QaComparator.canonicalValue(record, "metadata.entity_key"));
        assertEquals("Raipur", QaComparator.canonicalValue(record, "project_details.district"));
        assertEquals("", QaComparator.canonicalValue(record, "bank_details.ifsc"));
    }

    @Test
    void testEmptyMappingIsRejected() {
        assertThrows(ConfigurationException.class, () -> new QaComparator(List.of()));
    }
}
