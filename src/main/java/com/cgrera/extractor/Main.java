package com.cgrera.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Batch driver for the CG RERA detail extractor.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code extract <pagesDir>}: extract and map every persisted page, write {@code records/*.json}.</li>
 *   <li>{@code capture}: resolve the artifact placeholders of stored records through a browser session
 *   opened on each record's source URL, then rewrite the records.</li>
 *   <li>{@code qa <pagesDir> [entityFilter] [limit]}: compare stored records with their pages field by
 *   field and write {@code qa/qa_fields_report.*}.</li>
 * </ul>
 * Configuration comes from {@link ExtractorConfig}. Invalid configuration stops the run before any entity
 * is processed.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String USAGE = "Usage: extract <pagesDir> | capture | qa <pagesDir> [entityFilter] [limit]";

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        System.exit(run(args, ExtractorConfig.fromEnvironment()));
    }

    /**
     * Runs one mode and returns the process exit code.
     */
    static int run(String[] args, ExtractorConfig config) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase(Locale.ROOT) : "";
        try {
            switch (mode) {
                case "extract" -> {
                    if (args.length < 2) return usage();
                    extract(config, Path.of(args[1]));
                }
                case "capture" -> capture(config);
                case "qa" -> {
                    if (args.length < 2) return usage();
                    String filter = args.length > 2 ? args[2] : null;
                    int limit = args.length > 3 ? Integer.parseInt(args[3]) : 0;
                    QaReport report = qa(config, Path.of(args[1]), new QaRunOptions(filter, limit));
                    System.out.println(new QaReportWriter().renderText(report));
                }
                default -> {
                    return usage();
                }
            }
            return 0;
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage());
            return 2;
        } catch (NumberFormatException e) {
            logger.error("Invalid limit: {}", e.getMessage());
            return usage();
        } catch (IOException e) {
            logger.error("I/O failure: {}", e.getMessage());
            return 1;
        }
    }

    private static int usage() {
        System.err.println(USAGE);
        return 64;
    }

    private static ExtractionPipeline pipeline(ExtractorConfig config) {
        SynonymTable table = new SynonymTableLoader().loadConfigured(config.synonymTablePath());
        CanonicalMapper mapper = new CanonicalMapper(new SynonymResolver(table), new FieldNormalizer(), config.stateCode());
        return new ExtractionPipeline(new FieldExtractor(), mapper, config.workers());
    }

    /**
     * Extracts and maps every page and writes the records.
     * @return written record files
     */
    static List<Path> extract(ExtractorConfig config, Path pagesDir) throws IOException {
        ExtractionPipeline pipeline = pipeline(config);
        List<PersistedPage> pages = new PersistedPageReader().readAll(pagesDir);
        RecordStore store = new RecordStore(config.outputDir());
        List<Path> written = new ArrayList<>();
        int warnings = 0;
        for (ExtractionPipeline.EntityResult result : pipeline.run(pages)) {
            written.add(store.write(result.record()));
            warnings += result.record().getWarnings().size();
        }
        logger.info("Extraction complete: {} records written to {} ({} warnings)", written.size(), store.recordsDir(), warnings);
        return written;
    }

    /**
     * Captures the artifacts of every stored record with placeholders not yet resolved.
     */
    static void capture(ExtractorConfig config) throws IOException {
        RecordStore store = new RecordStore(config.outputDir());
        List<CanonicalRecord> records = store.readAll();
        ArtifactCapturer capturer = new ArtifactCapturer(new ArtifactStore(config.outputDir()),
            config.captureTimeoutMs(), config.navigationRetries(), 1_000);
        Path storageState = config.outputDir().resolve("storage-state.json");
        try (PlaywrightSessionFactory sessions = new PlaywrightSessionFactory(config.headless(), storageState)) {
            for (CanonicalRecord record : records) {
                if (record.getPlaceholders().isEmpty() || allResolved(record)) continue;
                if (Utils.isBlank(record.getSourceUrl())) {
                    logger.warn("Record {} has no source URL; its artifacts cannot be captured", record.getEntityKey());
                    capturer.capture(record, null);
                } else {
                    try (BrowsingSession session = sessions.open(record.getSourceUrl(), config.captureTimeoutMs())) {
                        capturer.capture(record, session);
                    } catch (CaptureException e) {
                        logger.error("Could not open {} for {}: {}", record.getSourceUrl(), record.getEntityKey(), e.getMessage());
                        capturer.capture(record, null);
                    }
                }
                store.write(record);
            }
            sessions.saveStorageState();
        }
    }

    private static boolean allResolved(CanonicalRecord record) {
        return record.getPlaceholders().stream().allMatch(p -> {
            ArtifactRecord artifact = record.getArtifacts().get(p.fieldKey());
            return artifact != null && artifact.status() == ArtifactStatus.RESOLVED;
        });
    }

    /**
     * Compares stored records with their pages and writes the report files.
     */
    static QaReport qa(ExtractorConfig config, Path pagesDir, QaRunOptions options) throws IOException {
        QaComparator comparator = new QaComparator(new QaFieldMappingLoader().loadConfigured(config.qaMappingPath()));
        FieldExtractor extractor = new FieldExtractor();
        Map<String, PersistedPage> pages = new LinkedHashMap<>();
        for (PersistedPage page : new PersistedPageReader().readAll(pagesDir)) {
            pages.put(page.entityKey(), page);
        }
        List<QaEntityInput> inputs = new ArrayList<>();
        for (CanonicalRecord record : new RecordStore(config.outputDir()).readAll()) {
            PersistedPage page = pages.get(record.getEntityKey());
            if (page == null) {
                logger.warn("No persisted page for record {}; skipping QA", record.getEntityKey());
                continue;
            }
            if (!options.selects(record.getEntityKey())) continue;
            inputs.add(new QaEntityInput(record.getEntityKey(), extractor.indexByLabel(extractor.extract(page)), record));
        }
        QaReport report = comparator.compareAll(inputs, options);
        new QaReportWriter().writeAll(report, config.outputDir().resolve("qa"));
        return report;
    }
}
