package com.cgrera.extractor;

import java.util.List;

/**
 * Interface for building the canonical record of one entity from its raw sections.
 */
public interface CanonicalMapperInterface {
    /**
     * Maps raw sections onto canonical keys. Unknown sections and labels land in the unmapped bag, every
     * artifact-bearing field gets a placeholder, and the result is deterministic for a given input.
     * @param page     persisted page the sections were extracted from, supplies the record metadata
     * @param sections raw sections in page order
     * @return a new canonical record
     */
    CanonicalRecord map(PersistedPage page, List<RawSection> sections);
}
