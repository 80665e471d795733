package com.cgrera.extractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link QaReport} as JSON (Jackson), a per-entity CSV summary (OpenCSV) and a plain-text table.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@code qa_fields_report.json}: the full report including every field diff.</li>
 *   <li>{@code qa_fields_report.csv}: one row per entity with its count per status.</li>
 *   <li>{@code qa_fields_report.txt}: run summary followed by the non-matching diffs of each entity.</li>
 * </ul>
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class QaReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(QaReportWriter.class);

    public static final String REPORT_BASENAME = "qa_fields_report";

    private final ObjectMapper mapper = Utils.jsonMapper();

    /**
     * Writes all three renderings into a directory.
     * @return written files, JSON first
     * @throws IOException if any file cannot be written
     */
    public List<Path> writeAll(QaReport report, Path qaDir) throws IOException {
        if (report == null) throw new IllegalArgumentException("report cannot be null");
        Files.createDirectories(qaDir);
        List<Path> written = new ArrayList<>();
        written.add(writeJson(report, qaDir.resolve(REPORT_BASENAME + ".json")));
        written.add(writeCsv(report, qaDir.resolve(REPORT_BASENAME + ".csv")));
        Path text = qaDir.resolve(REPORT_BASENAME + ".txt");
        Files.writeString(text, renderText(report), StandardCharsets.UTF_8);
        written.add(text);
        logger.info("Wrote QA report for {} entities to {}", report.totalEntities(), qaDir);
        return written;
    }

    public Path writeJson(QaReport report, Path file) throws IOException {
        mapper.writeValue(file.toFile(), report);
        return file;
    }

    public Path writeCsv(QaReport report, Path file) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            List<String> header = new ArrayList<>(List.of("entity_key", "total_fields"));
            for (DiffStatus status : DiffStatus.values()) header.add(status.wireName());
            writer.writeNext(header.toArray(String[]::new));
            for (EntityDiff entity : report.entities()) {
                List<String> row = new ArrayList<>();
                row.add(entity.entityKey());
                row.add(Integer.toString(entity.diffs().size()));
                for (DiffStatus status : DiffStatus.values()) row.add(Long.toString(entity.count(status)));
                writer.writeNext(row.toArray(String[]::new));
            }
        }
        logger.debug("Wrote QA CSV summary with {} rows to {}", report.entities().size(), file);
        return file;
    }

    /**
     * Plain-text table for terminals and logs.
     */
    public String renderText(QaReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Field-by-field QA report\n");
        sb.append(String.format("Entities: %d  Fields: %d%n", report.totalEntities(), report.totalFields()));
        for (DiffStatus status : DiffStatus.values()) {
            sb.append(String.format("  %-24s %6d%n", status.wireName(), report.count(status)));
        }
        for (EntityDiff entity : report.entities()) {
            sb.append('\n').append(entity.entityKey()).append('\n');
            sb.append(String.format("  %-40s %-24s %-30s %s%n", "PATH", "STATUS", "RECORD", "HTML"));
            for (FieldDiff diff : entity.diffs()) {
                if (diff.status() == DiffStatus.MATCH) continue;
                sb.append(String.format("  %-40s %-24s %-30s %s%n", diff.logicalPath(), diff.status().wireName(),
                    abbreviate(diff.canonicalValue()), abbreviate(diff.rawHtmlValue())));
            }
        }
        return sb.toString();
    }

    private static String abbreviate(String value) {
        String text = value == null || value.isEmpty() ? "-" : value.replaceAll("[\\r\\n]+", " ");
        return text.length() > 30 ? text.substring(0, 27) + "..." : text;
    }
}
