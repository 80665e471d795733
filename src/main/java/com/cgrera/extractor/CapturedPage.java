package com.cgrera.extractor;

/**
 * Content reached through a preview link or trigger.
 *
 * @param finalUrl    URL after redirects or pop-up navigation, the provenance of the artifact; null for an
 *                    inline modal that embeds no document
 * @param contentType response content type, may be null
 * @param body        raw bytes to persist
 * @param screenshot  PNG of the rendered content, null when not taken
 * @param inlineModal whether the content is the markup of a dialog shown on the origin tab
 */
public record CapturedPage(String finalUrl, String contentType, byte[] body, byte[] screenshot, boolean inlineModal) {
    public CapturedPage {
        body = body == null ? new byte[0] : body;
    }

    public CapturedPage(String finalUrl, String contentType, byte[] body) {
        this(finalUrl, contentType, body, null, false);
    }

    public static CapturedPage modal(String embeddedUrl, byte[] html, byte[] screenshot) {
        return new CapturedPage(embeddedUrl, "text/html", html, screenshot, true);
    }
}
