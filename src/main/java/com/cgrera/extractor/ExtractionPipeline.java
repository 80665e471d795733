package com.cgrera.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Extracts and maps many persisted pages in parallel.
 * <p>
 * Extraction and mapping touch no shared state, so each page is one task on a fixed thread pool. A page that
 * fails as a whole yields an empty record carrying an {@link WarningKind#EXTRACTION_FAILURE} warning; results
 * are returned sorted by entity key whatever the completion order.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class ExtractionPipeline {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionPipeline.class);

    /**
     * Output for one page. The raw sections are kept for QA.
     */
    public record EntityResult(PersistedPage page, List<RawSection> sections, CanonicalRecord record) {
        public String entityKey() {
            return page.entityKey();
        }
    }

    private final FieldExtractorInterface extractor;
    private final CanonicalMapperInterface mapper;
    private final int workers;

    public ExtractionPipeline(FieldExtractorInterface extractor, CanonicalMapperInterface mapper, int workers) {
        if (extractor == null || mapper == null) throw new IllegalArgumentException("extractor and mapper are required");
        this.extractor = extractor;
        this.mapper = mapper;
        this.workers = Math.max(1, workers);
    }

    /**
     * Runs one page synchronously.
     */
    public EntityResult process(PersistedPage page) {
        try {
            List<RawSection> sections = extractor.extract(page);
            return new EntityResult(page, sections, mapper.map(page, sections));
        } catch (RuntimeException e) {
            if (e instanceof ConfigurationException) throw e;
            logger.error("Failed to process {}: {}", page.entityKey(), e.getMessage());
            CanonicalRecord record = new CanonicalRecord(page.entityKey(), null, page.sourceUrl(), page.sourceFile());
            record.addWarning(new ProcessingWarning(WarningKind.EXTRACTION_FAILURE, page.sourceFile(),
                "Page could not be processed: " + e.getMessage()));
            return new EntityResult(page, List.of(), record);
        }
    }

    /**
     * Processes all pages on the worker pool.
     * @return one result per page, sorted by entity key
     */
    public List<EntityResult> run(List<PersistedPage> pages) {
        if (pages == null || pages.isEmpty()) return List.of();
        int threads = Math.min(workers, pages.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        logger.info("Processing {} pages with {} workers", pages.size(), threads);
        List<EntityResult> results = new ArrayList<>();
        try {
            List<Callable<EntityResult>> tasks = new ArrayList<>();
            for (PersistedPage page : pages) {
                tasks.add(() -> process(page));
            }
            for (Future<EntityResult> future : pool.invokeAll(tasks)) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Extraction interrupted after {} of {} pages", results.size(), pages.size());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("Extraction task failed: " + cause, cause);
        } finally {
            shutdown(pool);
        }
        results.sort(Comparator.comparing(EntityResult::entityKey));
        return results;
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
