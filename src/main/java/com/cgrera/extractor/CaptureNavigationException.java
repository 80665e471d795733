package com.cgrera.extractor;

/**
 * Navigation failed: the trigger element was missing, the link could not be loaded, or history navigation
 * back to the origin page did not succeed.
 */
public class CaptureNavigationException extends CaptureException {
    public CaptureNavigationException(String message) {
        super(message);
    }

    public CaptureNavigationException(String message, Throwable cause) {
        super(message, cause);
    }
}
