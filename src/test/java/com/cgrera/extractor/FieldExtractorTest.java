package com.cgrera.extractor;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

public class FieldExtractorTest {
    private final FieldExtractor extractor = new FieldExtractor();

    private static RawSection section(List<RawSection> sections, String title) {
        return sections.stream().filter(s -> s.titleText().equals(title)).findFirst()
            .orElseThrow(() -> new AssertionError("No section " + title));
    }

    private static RawField field(RawSection section, String label) {
        return section.fields().stream().filter(f -> f.label().equals(label)).findFirst()
            .orElseThrow(() -> new AssertionError("No field " + label + " in " + section.titleText()));
    }

    private static List<RawSection> extract(String body) {
        return new FieldExtractor().extract(new PersistedPage("T1", "project_T1.html", "https://rera.example/view?id=1",
            "<html><body>" + body + "</body></html>"));
    }

    @Test
    void testSectionsInPageOrder() {
        List<RawSection> sections = extractor.extract(TestResources.samplePage());
        assertEquals(List.of("Project Details [ Registration No : PCGRERA250518000123 ]", "Promoter Details", "Documents",
            "Quarterly Updates", "Other Approvals"), sections.stream().map(RawSection::titleText).toList());
    }

    @Test
    void testLabelValueRows() {
        RawSection project = extractor.extract(TestResources.samplePage()).get(0);
        assertEquals(11, project.fields().size());
        RawField name = field(project, "Project Name");
        assertEquals("project name", name.normalizedLabel());
        assertEquals("Green Valley Residency", name.valueText());
        assertFalse(name.artifactBearing());
        assertEquals("Plot 12, Ring Road 1, Raipur, CG 492001", field(project, "Project Address").valueText());
    }

    @Test
    void testScriptTriggerHasHintButNoLink() {
        RawSection project = extractor.extract(TestResources.samplePage()).get(0);
        RawField cert = field(project, "Registration Certificate");
        assertTrue(cert.artifactBearing());
        assertEquals("#ContentPlaceHolder1_lnkCert", cert.triggerHint());
        assertEquals("Preview", cert.triggerText());
        assertEquals("Preview", cert.valueText());
        assertTrue(cert.explicitLinks().isEmpty());
    }

    @Test
    void testAlternatingPairsAndRowspan() {
        RawSection promoter = section(extractor.extract(TestResources.samplePage()), "Promoter Details");
        assertEquals(3, promoter.fields().size());
        assertEquals("Shree Builders", field(promoter, "Promoter Name").valueText());
        assertEquals("info@shree.example", field(promoter, "Email").valueText());
        assertEquals("Shop 4, Pandri Raipur 492004", field(promoter, "Address").valueText());
    }

    @Test
    void testLinksResolvedAgainstPageUrl() {
        RawSection documents = section(extractor.extract(TestResources.samplePage()), "Documents");
        RawField permission = field(documents, "Building Permission");
        assertEquals(List.of("https://rera.cgstate.gov.in/docs/bp.pdf"), permission.explicitLinks());
        assertEquals("View", permission.triggerHint());

        RawField fire = field(documents, "Fire NOC");
        assertEquals("#btnFire", fire.triggerHint());
        assertEquals("Preview", fire.triggerText());
        assertEquals("", fire.valueText());

        RawField layout = field(documents, "Layout Plan");
        assertEquals("NA", layout.valueText());
        assertFalse(layout.artifactBearing());
    }

    @Test
    void testDataTableAndTriggerRow() {
        RawSection updates = section(extractor.extract(TestResources.samplePage()), "Quarterly Updates");
        assertEquals(1, updates.tables().size());
        RawTable table = updates.tables().get(0);
        assertEquals(List.of("Quarter", "Year", "Status", "Report"), table.headers());
        assertEquals(List.of(List.of("Q1", "2024", "Submitted", "View"), List.of("Q2", "2024", "Pending", "")), table.rows());

        assertEquals(1, updates.fields().size());
        RawField q1 = updates.fields().get(0);
        assertEquals("Q1", q1.label());
        assertEquals("View", q1.valueText());
        assertEquals("button.btn.btn-link.qpr", q1.triggerHint());
    }

    @Test
    void testFormLabelsAndControls() {
        PersistedPage page = new PersistedPage("PCGRERA200", "project_PCGRERA200.html", null,
            TestResources.read("pages/project_PCGRERA200.html"));
        List<RawSection> sections = extractor.extract(page);
        assertEquals(1, sections.size());
        RawSection info = sections.get(0);
        assertEquals("Project Information", info.titleText());
        assertEquals("Shanti Enclave", field(info, "Project Name").valueText());
        assertEquals("", field(info, "District").valueText());
        assertEquals("Bilaspur", field(info, "Tehsil").valueText());
        assertEquals("01-02-2023", field(info, "Launch Date").valueText());
    }

    @Test
    void testContentBeforeHeadingGoesToGeneralAndEmptyHeadingKeepsSection() {
        List<RawSection> sections = extract(
            "<table><tr><td>Registration No</td><td>X1</td></tr></table>"
                + "<h4>Bank Details</h4><p>No bank account reported.</p>"
                + "<h4>Land Details</h4><table><tr><td>Land Area</td><td>4,046.86 sq m</td></tr></table>");
        assertEquals(List.of("General", "Bank Details", "Land Details"), sections.stream().map(RawSection::titleText).toList());
        assertEquals(1, sections.get(0).fields().size());
        assertTrue(sections.get(1).fields().isEmpty());
    }

    @Test
    void testRepeatedTitlesMerge() {
        List<RawSection> sections = extract(
            "<h3>Project Details</h3><table><tr><td>District</td><td>Durg</td></tr></table>"
                + "<h3>Promoter Details</h3><table><tr><td>Name</td><td>A</td></tr></table>"
                + "<h3>Project Details</h3><table><tr><td>Tehsil</td><td>Bhilai</td></tr></table>");
        assertEquals(2, sections.size());
        assertEquals(List.of("District", "Tehsil"), sections.get(0).fields().stream().map(RawField::label).toList());
    }

    @Test
    void testNestedLayoutTablesAndTitleRows() {
        List<RawSection> sections = extract(
            "<table><tr><td><table>"
                + "<tr><th colspan='2'>Land Details</th></tr>"
                + "<tr><td>Khasra No</td><td>112/3</td></tr>"
                + "</table></td></tr></table>");
        RawSection land = section(sections, "Land Details");
        assertEquals("112/3", field(land, "Khasra No").valueText());
    }

    @Test
    void testBoldInsideCellIsNotAHeading() {
        List<RawSection> sections = extract(
            "<strong>Project Details</strong><table><tr><td><b>District</b></td><td>Korba</td></tr></table>");
        assertEquals(1, sections.size());
        assertEquals("Project Details", sections.get(0).titleText());
        assertEquals("Korba", field(sections.get(0), "District").valueText());
    }

    @Test
    void testSkippedLinkSchemes() {
        List<RawSection> sections = extract("<table><tr><td>Contact</td><td>"
            + "<a href='mailto:a@b.example'>mail</a> <a href='tel:123'>call</a> <a href='#top'>top</a>"
            + " <a href='https://other.example/x.pdf'>file</a></td></tr></table>");
        assertEquals(List.of("https://other.example/x.pdf"), sections.get(0).fields().get(0).explicitLinks());
    }

    @Test
    void testEmptyPageYieldsNoSections() {
        assertTrue(extractor.extract(new PersistedPage("E", "project_E.html", null, "  ")).isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }

    @Test
    void testIndexByLabelFirstOccurrenceWins() {
        List<RawSection> sections = extract(
            "<h3>A</h3><table><tr><td>District</td><td>Durg</td></tr></table>"
                + "<h3>B</h3><table><tr><td>District:</td><td>Raipur</td></tr></table>");
        Map<String, RawField> index = extractor.indexByLabel(sections);
        assertEquals("Durg", index.get("district").valueText());
    }

    @Test
    void testDuplicateClassTriggersGetDistinctIndexes() {
        RawSection docs = extract("<h3>Documents</h3><table>"
            + "<tr><td>Fire NOC</td><td><button class=\"btn btn-info\">Preview</button></td></tr>"
            + "<tr><td>Brochure</td><td><button class=\"btn btn-info\">Download</button></td></tr>"
            + "<tr><td>Layout Plan</td><td><button class=\"btn btn-info\"> Preview </button></td></tr>"
            + "</table>").get(0);
        RawField fire = field(docs, "Fire NOC");
        RawField layout = field(docs, "Layout Plan");
        assertEquals("button.btn.btn-info", fire.triggerHint());
        assertEquals(fire.triggerHint(), layout.triggerHint());
        assertEquals(0, fire.triggerIndex());
        assertEquals(1, layout.triggerIndex());
        assertEquals(0, field(docs, "Brochure").triggerIndex());
    }

    @Test
    void testIdTriggerIndexIsZero() {
        RawField cert = field(extractor.extract(TestResources.samplePage()).get(0), "Registration Certificate");
        assertEquals(0, cert.triggerIndex());
    }

    @Test
    void testTriggerWordInsideLongerLabel() {
        RawSection docs = extract("<h3>Documents</h3><table>"
            + "<tr><td>Sanction Letter</td><td><a href=\"javascript:void(0)\">Downloads</a></td></tr>"
            + "<tr><td>Site Plan</td><td><input type=\"button\" id=\"btnSite\" value=\"ViewDocument\"></td></tr>"
            + "<tr><td>Water Connection</td><td>Applied</td></tr>"
            + "</table>").get(0);
        assertTrue(field(docs, "Sanction Letter").artifactBearing());
        assertEquals("Downloads", field(docs, "Sanction Letter").triggerText());
        assertEquals("#btnSite", field(docs, "Site Plan").triggerHint());
        assertFalse(field(docs, "Water Connection").artifactBearing());
    }
}
