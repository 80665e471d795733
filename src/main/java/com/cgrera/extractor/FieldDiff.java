package com.cgrera.extractor;

/**
 * @param logicalPath    compared path, e.g. {@code project_details.district} or {@code documents[0].url}
 * @param canonicalValue value found in the canonical record, empty when absent
 * @param rawHtmlValue   value read from the page under the configured label, empty when absent
 * @param status         classification
 */
public record FieldDiff(String logicalPath, String canonicalValue, String rawHtmlValue, DiffStatus status) {}
