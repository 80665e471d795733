package com.cgrera.extractor;

/**
 * A live, interactive browsing context positioned on an entity's detail page.
 * <p>
 * The origin page carries server-side state (view state, session tokens) that a fresh navigation to its URL
 * would lose, so implementations never expose a "go to URL" on the origin tab: links open in a separate tab
 * and returning after a same-tab navigation goes through history.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public interface BrowsingSession extends AutoCloseable {
    /**
     * @return URL currently shown in the origin tab
     */
    String currentUrl();

    /**
     * Loads a direct link in a separate tab, reads its content and closes the tab.
     * @param url       link destination
     * @param timeoutMs navigation timeout
     * @return captured content with the final URL after redirects
     * @throws CaptureException on timeout or navigation failure
     */
    CapturedPage openInNewTab(String url, long timeoutMs) throws CaptureException;

    /**
     * Activates a trigger element on the origin tab and captures what it opens. A pop-up is read and closed;
     * when the trigger navigates the origin tab itself, that page is captured and the caller is expected to
     * return with {@link #navigateBack(long)}. When no pop-up appears but an inline modal dialog does, the
     * dialog markup and a screenshot are captured and the dialog is closed.
     * @param triggerHint locator hint: {@code #id}, {@code tag.class} or visible text
     * @param triggerText  visible text of the trigger, used to narrow class based hints; may be null
     * @param triggerIndex which matching element to activate; when null the hint must match exactly one
     * @param timeoutMs    bound on waiting for the pop-up
     * @return captured content
     * @throws CaptureTimeoutException when nothing opened in time
     * @throws CaptureException        when the element is missing or ambiguous, or the navigation fails
     */
    CapturedPage activateTrigger(String triggerHint, String triggerText, Integer triggerIndex, long timeoutMs) throws CaptureException;

    /**
     * Goes one step back in the origin tab's history.
     * @throws CaptureException when there is no history entry or the navigation fails
     */
    void navigateBack(long timeoutMs) throws CaptureException;

    @Override
    void close();
}
