package com.cgrera.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Writes resolved artifact URLs back into the canonical record.
 * <p>
 * Document URLs taken from the page are often not URLs at all but the visible label of the button that opens
 * the document ("Preview", "View", "NA"). After capture, every document whose URL is such a sentinel and
 * whose artifact resolved gets the artifact's source URL. Real URLs are never overwritten.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class ArtifactBackPropagator {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactBackPropagator.class);

    static final Set<String> SENTINELS = Set.of(
        "preview", "view", "download", "na", "n/a", "unavailable", "not available");

    /**
     * Tells whether a value is a placeholder sentinel rather than real content.
     * @param value       value or URL to test, blank counts as a sentinel
     * @param triggerText visible text of the field's trigger, also treated as a sentinel; may be null
     */
    public static boolean isSentinel(String value, String triggerText) {
        String folded = Utils.foldForComparison(value);
        if (folded.isEmpty()) return true;
        if (SENTINELS.contains(folded)) return true;
        return !Utils.isBlank(triggerText) && folded.equals(Utils.foldForComparison(triggerText));
    }

    /**
     * Replaces sentinel document URLs with resolved source URLs.
     * @param record record to enrich in place
     * @return number of document URLs overwritten
     */
    public int propagate(CanonicalRecord record) {
        Map<String, String> triggerTexts = new HashMap<>();
        for (ArtifactPlaceholder placeholder : record.getPlaceholders()) {
            triggerTexts.put(placeholder.fieldKey(), placeholder.triggerText());
        }
        int updated = 0;
        int skipped = 0;
        for (CanonicalDocument document : record.getDocuments()) {
            ArtifactRecord artifact = record.getArtifacts().get(document.getFieldKey());
            if (artifact == null || !artifact.isResolved()) continue;
            if (isSentinel(document.getUrl(), triggerTexts.get(document.getFieldKey()))) {
                logger.debug("Back-propagating {} -> {} for {}", document.getUrl(), artifact.sourceUrl(), document.getFieldKey());
                document.setUrl(artifact.sourceUrl());
                updated++;
            } else {
                skipped++;
            }
        }
        logger.info("Back-propagated {} document URLs for {} ({} already held a real URL)", updated, record.getEntityKey(), skipped);
        return updated;
    }
}
