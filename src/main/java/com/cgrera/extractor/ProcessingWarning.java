package com.cgrera.extractor;

/**
 * Non-fatal problem attached to a section, record or artifact. A run collects these into its manifest
 * instead of aborting.
 *
 * @param kind     failure category
 * @param location section title, canonical path or artifact field key the warning refers to
 * @param message  human readable explanation
 */
public record ProcessingWarning(WarningKind kind, String location, String message) {}
