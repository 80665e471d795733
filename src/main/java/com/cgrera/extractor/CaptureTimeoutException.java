package com.cgrera.extractor;

/**
 * The trigger was activated but no pop-up or navigation completed within the per-field timeout.
 */
public class CaptureTimeoutException extends CaptureException {
    public CaptureTimeoutException(String message) {
        super(message);
    }

    public CaptureTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
