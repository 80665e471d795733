package com.cgrera.extractor;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

public class ArtifactBackPropagatorTest {
    private final ArtifactBackPropagator propagator = new ArtifactBackPropagator();

    private static CanonicalRecord record(String fieldKey, String documentUrl, String triggerText, ArtifactRecord artifact) {
        CanonicalRecord record = new CanonicalRecord("E1", "CG", null, "e1.html");
        record.getPlaceholders().add(new ArtifactPlaceholder(fieldKey, "Documents", "Doc", "#lnk", triggerText, null));
        record.getDocuments().add(new CanonicalDocument(fieldKey, "Doc", "other", documentUrl, null));
        record.getArtifacts().put(fieldKey, artifact);
        return record;
    }

    private static ArtifactRecord resolved(String fieldKey, String url) {
        return ArtifactRecord.resolved(fieldKey, ArtifactType.PDF, List.of("previews/E1/" + fieldKey + "/preview.pdf"), url, null);
    }

    @Test
    void testIsSentinel() {
        assertTrue(ArtifactBackPropagator.isSentinel("Preview", null));
        assertTrue(ArtifactBackPropagator.isSentinel("  VIEW ", null));
        assertTrue(ArtifactBackPropagator.isSentinel("N/A", null));
        assertTrue(ArtifactBackPropagator.isSentinel("", null));
        assertTrue(ArtifactBackPropagator.isSentinel(null, null));
        assertTrue(ArtifactBackPropagator.isSentinel("Click Here", "click here"));
        assertFalse(ArtifactBackPropagator.isSentinel("https://example.org/a.pdf", "Preview"));
        assertFalse(ArtifactBackPropagator.isSentinel("Applied", null));
    }

    @Test
    void testSentinelReplacedByResolvedUrl() {
        CanonicalRecord record = record("fire_noc", "Preview", "Preview", resolved("fire_noc", "https://example.org/fire.pdf"));
        assertEquals(1, propagator.propagate(record));
        assertEquals("https://example.org/fire.pdf", record.documentFor("fire_noc").getUrl());
    }

    @Test
    void testTriggerTextCountsAsSentinel() {
        CanonicalRecord record = record("brochure", "Open File", "Open File", resolved("brochure", "https://example.org/b.pdf"));
        assertEquals(1, propagator.propagate(record));
        assertEquals("https://example.org/b.pdf", record.documentFor("brochure").getUrl());
    }

    @Test
    void testRealUrlIsKept() {
        CanonicalRecord record = record("layout", "https://example.org/layout.pdf", "View",
            resolved("layout", "https://example.org/redirected/layout.pdf"));
        assertEquals(0, propagator.propagate(record));
        assertEquals("https://example.org/layout.pdf", record.documentFor("layout").getUrl());
    }

    @Test
    void testUnresolvedArtifactLeavesSentinel() {
        CanonicalRecord record = record("fire_noc", "Preview", "Preview", ArtifactRecord.unresolved("fire_noc", "timeout"));
        assertEquals(0, propagator.propagate(record));
        assertEquals("Preview", record.documentFor("fire_noc").getUrl());
    }
}
