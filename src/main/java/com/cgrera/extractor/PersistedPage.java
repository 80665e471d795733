package com.cgrera.extractor;

/**
 * A detail page saved to disk by the crawl collaborator.
 *
 * @param entityKey  deterministic key of the project, usually the sanitized registration number
 * @param sourceFile path the HTML was read from
 * @param sourceUrl  URL the page was fetched from, null when unknown
 * @param html       full page HTML
 */
public record PersistedPage(String entityKey, String sourceFile, String sourceUrl, String html) {}
