package com.cgrera.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Two-phase artifact capture: resolves the placeholders created at mapping time against a live session.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Placeholders are processed sequentially in discovery order; each one is attempted once per run.
 *   Artifacts resolved by an earlier run are kept, unresolved ones are attempted again.</li>
 *   <li>Direct strategy: a field with an explicit link is loaded in a separate tab, retried with backoff on
 *   navigation errors.</li>
 *   <li>Triggered strategy: the trigger element is activated and the pop-up, or failing that an inline modal,
 *   captured within the per-field timeout. If the origin tab moved, history back-navigation returns to it.</li>
 *   <li>Captured content is persisted by the {@link ArtifactStore}; the artifact becomes resolved with the
 *   final URL as provenance. A timeout or navigation failure marks that field unresolved and records a
 *   warning, then the next placeholder is processed. So does any unexpected runtime failure.</li>
 *   <li>Afterwards {@link ArtifactBackPropagator} rewrites sentinel document URLs and the entity's
 *   metadata.json is written.</li>
 * </ul>
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class ArtifactCapturer implements ArtifactCapturerInterface {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactCapturer.class);

    public static final long DEFAULT_TIMEOUT_MS = 20_000;
    public static final int DEFAULT_NAVIGATION_RETRIES = 3;
    private static final long DEFAULT_RETRY_DELAY_MS = 1_000;

    private final ArtifactStore store;
    private final ArtifactBackPropagator propagator;
    private final long timeoutMs;
    private final int navigationRetries;
    private final long retryDelayMs;

    public ArtifactCapturer(ArtifactStore store) {
        this(store, DEFAULT_TIMEOUT_MS, DEFAULT_NAVIGATION_RETRIES, DEFAULT_RETRY_DELAY_MS);
    }

    public ArtifactCapturer(ArtifactStore store, long timeoutMs, int navigationRetries, long retryDelayMs) {
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        this.store = store;
        this.propagator = new ArtifactBackPropagator();
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS;
        this.navigationRetries = Math.max(1, navigationRetries);
        this.retryDelayMs = Math.max(0, retryDelayMs);
    }

    @Override
    public Map<String, ArtifactRecord> capture(CanonicalRecord record, BrowsingSession session) {
        if (record == null) throw new IllegalArgumentException("record cannot be null");
        String entity = record.getEntityKey();
        List<ArtifactPlaceholder> placeholders = record.getPlaceholders();
        if (session == null) {
            logger.warn("No browsing session for {}; {} placeholders stay unresolved", entity, placeholders.size());
            for (ArtifactPlaceholder placeholder : placeholders) {
                if (alreadyResolved(record, placeholder)) continue;
                clearCaptureWarnings(record, placeholder);
                fail(record, placeholder, WarningKind.CAPTURE_NAVIGATION_ERROR, "No browsing session available");
            }
            finish(record);
            return record.getArtifacts();
        }
        String origin = session.currentUrl();
        logger.info("Capturing {} artifacts for {} from {}", placeholders.size(), entity, origin);
        int resolved = 0;
        for (ArtifactPlaceholder placeholder : placeholders) {
            if (alreadyResolved(record, placeholder)) {
                logger.debug("Artifact {} already resolved; skipping", placeholder.fieldKey());
                continue;
            }
            clearCaptureWarnings(record, placeholder);
            boolean direct = !Utils.isBlank(placeholder.explicitLink());
            try {
                CapturedPage page = direct ? captureDirect(session, placeholder) : captureTriggered(session, placeholder);
                List<String> files = store.persist(entity, placeholder.fieldKey(), page);
                ArtifactType type = ArtifactType.fromContentType(page.contentType());
                String strategy = direct ? "direct link" : page.inlineModal() ? "inline modal" : "triggered";
                String notes = ArtifactRecord.mergeNotes(placeholder.triggerHint(), strategy);
                record.getArtifacts().put(placeholder.fieldKey(),
                    ArtifactRecord.resolved(placeholder.fieldKey(), type, files, page.finalUrl(), notes));
                resolved++;
                logger.info("Captured {} for {} from {}", placeholder.fieldKey(), entity, page.finalUrl());
            } catch (CaptureTimeoutException e) {
                fail(record, placeholder, WarningKind.CAPTURE_TIMEOUT, e.getMessage());
            } catch (CaptureException e) {
                fail(record, placeholder, WarningKind.CAPTURE_NAVIGATION_ERROR, e.getMessage());
            } catch (IOException e) {
                fail(record, placeholder, WarningKind.CAPTURE_NAVIGATION_ERROR, "Failed to store artifact: " + e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Unexpected failure capturing {} for {}", placeholder.fieldKey(), entity, e);
                fail(record, placeholder, WarningKind.CAPTURE_NAVIGATION_ERROR, "Unexpected capture failure: " + e);
            } finally {
                if (!direct) returnToOrigin(record, session, origin, placeholder.fieldKey());
            }
        }
        logger.info("Capture finished for {}: {} of {} resolved", entity, resolved, placeholders.size());
        finish(record);
        return record.getArtifacts();
    }

    private CapturedPage captureDirect(BrowsingSession session, ArtifactPlaceholder placeholder) throws CaptureException {
        try {
            return Utils.retryPlaywrightAction(() -> session.openInNewTab(placeholder.explicitLink(), timeoutMs),
                navigationRetries, "open " + placeholder.explicitLink(), retryDelayMs);
        } catch (CaptureException e) {
            throw e;
        } catch (Exception e) {
            throw new CaptureNavigationException("Failed to open " + placeholder.explicitLink() + ": " + e.getMessage(), e);
        }
    }

    private CapturedPage captureTriggered(BrowsingSession session, ArtifactPlaceholder placeholder) throws CaptureException {
        if (Utils.isBlank(placeholder.triggerHint()) && Utils.isBlank(placeholder.triggerText())) {
            throw new CaptureNavigationException("Field has neither a link nor a trigger locator");
        }
        return session.activateTrigger(placeholder.triggerHint(), placeholder.triggerText(), placeholder.triggerIndex(),
            timeoutMs);
    }

    private static boolean alreadyResolved(CanonicalRecord record, ArtifactPlaceholder placeholder) {
        ArtifactRecord current = record.getArtifacts().get(placeholder.fieldKey());
        return current != null && current.status() == ArtifactStatus.RESOLVED;
    }

    /**
     * Drops capture warnings a previous run left for this field, so a retry reports only its own outcome.
     */
    private static void clearCaptureWarnings(CanonicalRecord record, ArtifactPlaceholder placeholder) {
        record.getWarnings().removeIf(w -> placeholder.fieldKey().equals(w.location())
            && (w.kind() == WarningKind.CAPTURE_TIMEOUT || w.kind() == WarningKind.CAPTURE_NAVIGATION_ERROR));
    }

    private void returnToOrigin(CanonicalRecord record, BrowsingSession session, String origin, String fieldKey) {
        if (origin == null || origin.equals(session.currentUrl())) return;
        try {
            session.navigateBack(timeoutMs);
            if (!origin.equals(session.currentUrl())) {
                logger.warn("History back after {} landed on {} instead of {}", fieldKey, session.currentUrl(), origin);
            }
        } catch (CaptureException e) {
            logger.warn("Could not return to the detail page after {}: {}", fieldKey, e.getMessage());
            record.addWarning(new ProcessingWarning(WarningKind.CAPTURE_NAVIGATION_ERROR, fieldKey,
                "History back navigation failed: " + e.getMessage()));
        }
    }

    private void fail(CanonicalRecord record, ArtifactPlaceholder placeholder, WarningKind kind, String message) {
        logger.warn("Artifact {} of {} unresolved: {}", placeholder.fieldKey(), record.getEntityKey(), message);
        String notes = ArtifactRecord.mergeNotes(placeholder.triggerHint(), message);
        record.getArtifacts().put(placeholder.fieldKey(), ArtifactRecord.unresolved(placeholder.fieldKey(), notes));
        record.addWarning(new ProcessingWarning(kind, placeholder.fieldKey(), message));
    }

    private void finish(CanonicalRecord record) {
        propagator.propagate(record);
        try {
            store.writeMetadata(record.getEntityKey(), record.getArtifacts());
        } catch (IOException e) {
            logger.error("Failed to write artifact metadata for {}: {}", record.getEntityKey(), e.getMessage());
        }
    }
}
