package com.cgrera.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Run configuration read from environment variables, falling back to system properties of the same name and
 * then to defaults.
 * <ul>
 *   <li>{@code EXTRACTOR_OUTPUT_DIR}: output root (default {@code outputs})</li>
 *   <li>{@code EXTRACTOR_SYNONYM_TABLE}: synonym table path, bundled table when unset</li>
 *   <li>{@code EXTRACTOR_QA_MAPPING}: QA field mapping path, bundled mapping when unset</li>
 *   <li>{@code EXTRACTOR_CAPTURE_TIMEOUT_MS}: per-field capture timeout (default 20000)</li>
 *   <li>{@code EXTRACTOR_NAVIGATION_RETRIES}: attempts for direct-link navigation (default 3)</li>
 *   <li>{@code EXTRACTOR_WORKERS}: extraction threads (default: available processors)</li>
 *   <li>{@code EXTRACTOR_STATE_CODE}: state code written to records (default CG)</li>
 *   <li>{@code EXTRACTOR_HEADLESS}: run the capture browser headless (default true)</li>
 * </ul>
 */
public record ExtractorConfig(
    Path outputDir,
    String synonymTablePath,
    String qaMappingPath,
    long captureTimeoutMs,
    int navigationRetries,
    int workers,
    String stateCode,
    boolean headless
) {
    private static final Logger logger = LoggerFactory.getLogger(ExtractorConfig.class);

    public static ExtractorConfig fromEnvironment() {
        ExtractorConfig config = new ExtractorConfig(
            Path.of(envOrProp("EXTRACTOR_OUTPUT_DIR", "outputs")),
            blankToNull(envOrProp("EXTRACTOR_SYNONYM_TABLE", "")),
            blankToNull(envOrProp("EXTRACTOR_QA_MAPPING", "")),
            parseLong("EXTRACTOR_CAPTURE_TIMEOUT_MS", ArtifactCapturer.DEFAULT_TIMEOUT_MS),
            (int) parseLong("EXTRACTOR_NAVIGATION_RETRIES", ArtifactCapturer.DEFAULT_NAVIGATION_RETRIES),
            (int) parseLong("EXTRACTOR_WORKERS", Runtime.getRuntime().availableProcessors()),
            envOrProp("EXTRACTOR_STATE_CODE", CanonicalMapper.DEFAULT_STATE_CODE),
            Boolean.parseBoolean(envOrProp("EXTRACTOR_HEADLESS", "true"))
        );
        logger.info("Configuration: output={}, synonyms={}, qaMapping={}, timeoutMs={}, retries={}, workers={}, state={}, headless={}",
            config.outputDir(), config.synonymTablePath() == null ? "bundled" : config.synonymTablePath(),
            config.qaMappingPath() == null ? "bundled" : config.qaMappingPath(), config.captureTimeoutMs(),
            config.navigationRetries(), config.workers(), config.stateCode(), config.headless());
        return config;
    }

    static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String pv = System.getProperty(key);
        if (pv != null && !pv.isBlank()) return pv;
        return defaultVal;
    }

    private static long parseLong(String key, long defaultVal) {
        String raw = envOrProp(key, Long.toString(defaultVal));
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be a number, got '" + raw + "'", e);
        }
    }

    private static String blankToNull(String value) {
        return Utils.isBlank(value) ? null : value;
    }
}
