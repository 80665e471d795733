package com.cgrera.extractor;

import java.util.Map;

/**
 * Interface for resolving artifact placeholders through a live browsing session.
 */
public interface ArtifactCapturerInterface {
    /**
     * Captures every pending placeholder of a record in discovery order, then back-propagates resolved URLs
     * into the record's documents. Failures are field-scoped and never stop the remaining placeholders.
     * @param record  canonical record whose artifacts are updated in place
     * @param session session positioned on the record's detail page
     * @return the record's artifact map after capture
     */
    Map<String, ArtifactRecord> capture(CanonicalRecord record, BrowsingSession session);
}
