package com.cgrera.extractor;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.regex.Pattern;

public class PlaywrightBrowsingSessionTest {
    @Test
    void testRecordedIndexSelectsAmongDuplicates() throws Exception {
        assertEquals(1, PlaywrightBrowsingSession.chooseTarget(2, 1, "button.btn.btn-info"));
        assertEquals(0, PlaywrightBrowsingSession.chooseTarget(3, 0, "button.btn.btn-info"));
    }

    @Test
    void testDuplicatesWithoutIndexAreAmbiguous() {
        CaptureNavigationException e = assertThrows(CaptureNavigationException.class,
            () -> PlaywrightBrowsingSession.chooseTarget(2, null, "button.btn.btn-info"));
        assertTrue(e.getMessage().startsWith("Ambiguous trigger locator"));
    }

    @Test
    void testSingleMatchWithoutIndex() throws Exception {
        assertEquals(0, PlaywrightBrowsingSession.chooseTarget(1, null, "#lnkCert"));
    }

    @Test
    void testMissingOrOutOfRangeTarget() {
        assertThrows(CaptureNavigationException.class, () -> PlaywrightBrowsingSession.chooseTarget(0, null, "#gone"));
        assertThrows(CaptureNavigationException.class, () -> PlaywrightBrowsingSession.chooseTarget(0, 0, "#gone"));
        CaptureNavigationException e = assertThrows(CaptureNavigationException.class,
            () -> PlaywrightBrowsingSession.chooseTarget(2, 2, "a.doc"));
        assertTrue(e.getMessage().contains("out of range"));
    }

    @Test
    void testExactTextPatternMatchesWholeLabelOnly() {
        Pattern preview = PlaywrightBrowsingSession.exactTextPattern("Preview");
        assertTrue(preview.matcher("  preview ").find());
        assertFalse(preview.matcher("Preview Document").find());

        Pattern twoWords = PlaywrightBrowsingSession.exactTextPattern(" View   Letter ");
        assertTrue(twoWords.matcher("view letter").find());
        assertFalse(twoWords.matcher("viewletter").find());
    }

    @Test
    void testExactTextPatternEscapesMetacharacters() {
        Pattern pattern = PlaywrightBrowsingSession.exactTextPattern("View (PDF)");
        assertEquals("^\\s*View\\s+\\(PDF\\)\\s*$", pattern.pattern());
        assertTrue(pattern.matcher("View (pdf)").find());
        assertFalse(pattern.matcher("View PDF").find());
    }
}
