package com.cgrera.extractor;

/**
 * Failure to capture one artifact. Always field-scoped: the capturer records it against the field and moves
 * on to the next placeholder.
 */
public class CaptureException extends Exception {
    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
