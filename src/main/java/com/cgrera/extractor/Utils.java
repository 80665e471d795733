package com.cgrera.extractor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

/**
 * Utility class for common text helpers used in extraction, mapping and file operations.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern SLUG_SEPARATORS = Pattern.compile("[^a-z0-9]+");
    private static final Pattern BRACKETED = Pattern.compile("[\\[(].*?[\\])]");

    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\\\\\s]", "_");
    }

    /**
     * Collapses runs of whitespace (including non-breaking spaces) into a single space and trims.
     * @param text Input text (may be null)
     * @return Collapsed text, never null
     */
    public static String collapseWhitespace(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text.replace('\u00A0', ' ')).replaceAll(" ").trim();
    }

    /**
     * Normalizes a label for matching: lowercase, punctuation stripped, whitespace collapsed.
     * "Registration No.:" and "registration  no" both become "registration no".
     * @param label Raw label text
     * @return Normalized label, never null
     */
    public static String normalizeLabel(String label) {
        if (label == null) return "";
        String lowered = collapseWhitespace(label).toLowerCase(Locale.ROOT);
        return collapseWhitespace(NON_ALNUM.matcher(lowered).replaceAll(" "));
    }

    /**
     * Normalizes a section title for matching. Bracketed or parenthetical suffixes such as
     * "Project Details [ Registration No : PCGRERA123 ]" are dropped before label normalization.
     */
    public static String normalizeTitle(String title) {
        if (title == null) return "";
        return normalizeLabel(BRACKETED.matcher(title).replaceAll(" "));
    }

    /**
     * Builds a filesystem and JSON friendly slug: lowercase, runs of non-alphanumerics become one underscore.
     * @param text Input text
     * @return Slug, or "field" when nothing alphanumeric remains
     */
    public static String slugify(String text) {
        String lowered = collapseWhitespace(text).toLowerCase(Locale.ROOT);
        String slug = SLUG_SEPARATORS.matcher(lowered).replaceAll("_");
        slug = slug.replaceAll("^_+|_+$", "");
        return slug.isEmpty() ? "field" : slug;
    }

    /**
     * Case-folds and collapses a value for comparison.
     */
    public static String foldForComparison(String value) {
        return collapseWhitespace(value).toLowerCase(Locale.ROOT);
    }

    /**
     * Returns true when the string is null or contains only whitespace.
     */
    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Shared Jackson mapper: snake_case property names, pretty printed, tolerant of unknown properties.
     * @return a newly configured ObjectMapper
     */
    public static ObjectMapper jsonMapper() {
        return new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Retries a Playwright action up to maxRetries times with exponential backoff.
     * @param action Callable action to execute
     * @param maxRetries Maximum number of attempts
     * @param actionDesc Description for logging
     * @param baseDelayMs Delay before the second attempt; doubled after each further failure
     * @param <T> Return type
     * @return Result of action
     * @throws Exception the last failure once all attempts are exhausted
     */
    public static <T> T retryPlaywrightAction(Callable<T> action, int maxRetries, String actionDesc, long baseDelayMs) throws Exception {
        int attempts = 0;
        Exception last = null;
        int allowed = Math.max(1, maxRetries);
        while (attempts < allowed) {
            try {
                return action.call();
            } catch (Exception e) {
                last = e;
                attempts++;
                logger.warn("Failed {} (attempt {}): {}", actionDesc, attempts, e.getMessage());
                if (attempts < allowed && baseDelayMs > 0) {
                    try {
                        Thread.sleep(baseDelayMs * (1L << (attempts - 1)));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw e;
                    }
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, allowed);
        throw last;
    }
}
