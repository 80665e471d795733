package com.cgrera.extractor;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SynonymResolverTest {
    private final SynonymResolver resolver = TestResources.bundledResolver();

    @Test
    void testResolveSectionIgnoresCaseAndBrackets() {
        assertEquals("project_details", resolver.resolveSection("PROJECT DETAILS [ Registration No : X ]").name());
        assertEquals("promoter_details", resolver.resolveSection("Promoter Information").name());
        assertNull(resolver.resolveSection("Other Approvals"));
        assertNull(resolver.resolveSection(""));
    }

    @Test
    void testResolveKeyByVariant() {
        SynonymResolver.KeyResolution resolution = resolver.resolveKey("project_details", Utils.normalizeLabel("RERA Registration No."));
        assertTrue(resolution.resolved());
        assertFalse(resolution.ambiguous());
        assertEquals("registration_number", resolution.canonicalKey());
        assertFalse(resolver.resolveKey("project_details", "water connection").resolved());
        assertFalse(resolver.resolveKey("no_such_section", "district").resolved());
    }

    @Test
    void testAmbiguousLabelResolvesToFirstDeclaredKey() {
        Map<String, List<String>> keys = new LinkedHashMap<>();
        keys.put("launch_date", List.of("Launch Date", "Date"));
        keys.put("approval_date", List.of("Approval Date", "Date"));
        SynonymTable table = new SynonymTable("1.0",
            List.of(new SynonymTable.LogicalSection("dates", List.of("Dates"), keys, null)), null, null);

        SynonymResolver.KeyResolution resolution = new SynonymResolver(table).resolveKey("dates", "date");
        assertTrue(resolution.ambiguous());
        assertEquals("launch_date", resolution.canonicalKey());
        assertEquals(List.of("launch_date", "approval_date"), resolution.candidates());
    }

    @Test
    void testResolveHeaderByContainment() {
        assertEquals("carpet_area_sq_m", resolver.resolveHeader("unit_types", "Carpet Area (sq m)"));
        assertEquals("unit_count", resolver.resolveHeader("unit_types", "Number of Units"));
        assertEquals("quarter", resolver.resolveHeader("quarterly_updates", "Quarter"));
        assertNull(resolver.resolveHeader("quarterly_updates", "Sr."));
    }
}
