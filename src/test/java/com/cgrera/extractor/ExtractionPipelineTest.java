package com.cgrera.extractor;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class ExtractionPipelineTest {
    private final CanonicalMapper mapper = new CanonicalMapper(TestResources.bundledResolver());

    private static PersistedPage page(String key, String html) {
        return new PersistedPage(key, "project_" + key + ".html", "https://example.org/" + key, html);
    }

    private static String projectPage(String name) {
        return "<h3>Project Details</h3><table><tr><td>Project Name</td><td>" + name + "</td></tr></table>";
    }

    @Test
    void testResultsSortedByEntityKey() {
        List<PersistedPage> pages = new ArrayList<>();
        for (int i = 9; i >= 1; i--) pages.add(page("E" + i, projectPage("Project " + i)));
        List<ExtractionPipeline.EntityResult> results = new ExtractionPipeline(new FieldExtractor(), mapper, 4).run(pages);

        assertEquals(9, results.size());
        assertEquals(List.of("E1", "E2", "E3", "E4", "E5", "E6", "E7", "E8", "E9"),
            results.stream().map(ExtractionPipeline.EntityResult::entityKey).collect(Collectors.toList()));
        assertEquals("Project 3", results.get(2).record().getSections().get("project_details").get("project_name"));
        assertEquals(1, results.get(0).sections().size());
    }

    @Test
    void testFailingPageDoesNotStopTheRun() {
        FieldExtractorInterface flaky = page -> {
            if (page.entityKey().equals("BAD")) throw new IllegalStateException("parser blew up");
            return new FieldExtractor().extract(page);
        };
        List<ExtractionPipeline.EntityResult> results = new ExtractionPipeline(flaky, mapper, 2)
            .run(List.of(page("GOOD", projectPage("Fine")), page("BAD", "<html></html>")));

        assertEquals(2, results.size());
        CanonicalRecord bad = results.get(0).record();
        assertEquals("BAD", bad.getEntityKey());
        assertEquals(1, bad.getWarnings().size());
        assertEquals(WarningKind.EXTRACTION_FAILURE, bad.getWarnings().get(0).kind());
        assertTrue(bad.getWarnings().get(0).message().contains("parser blew up"));
        assertEquals("Fine", results.get(1).record().getSections().get("project_details").get("project_name"));
    }

    @Test
    void testConfigurationErrorsPropagate() {
        FieldExtractorInterface broken = page -> {
            throw new ConfigurationException("bad table");
        };
        ExtractionPipeline pipeline = new ExtractionPipeline(broken, mapper, 1);
        assertThrows(ConfigurationException.class, () -> pipeline.run(List.of(page("X", ""))));
    }

    @Test
    void testEmptyInput() {
        assertTrue(new ExtractionPipeline(new FieldExtractor(), mapper, 2).run(List.of()).isEmpty());
    }
}
