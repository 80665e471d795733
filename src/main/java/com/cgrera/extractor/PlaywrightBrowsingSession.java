package com.cgrera.extractor;

import com.microsoft.playwright.APIResponse;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.RequestOptions;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link BrowsingSession} backed by a Playwright page that is already on the entity's detail page.
 * <p>
 * Workflow for a triggered capture:
 * <ul>
 *   <li>Resolve the hint: {@code #id} becomes an attribute selector (portal ids contain {@code $} and
 *   {@code :}), {@code tag.class} is used as CSS narrowed by the exact trigger text, anything else is matched
 *   as exact visible text of a trigger element.</li>
 *   <li>Pick the match at the trigger index recorded at extraction. Without an index the hint must match a
 *   single element.</li>
 *   <li>Click inside {@code waitForPopup}, let the pop-up finish loading and read its URL.</li>
 *   <li>Fetch the pop-up URL through the context's request API to obtain the original bytes and content type;
 *   fall back to the rendered HTML when the fetch fails.</li>
 *   <li>Close the pop-up. If no pop-up appeared but the origin tab navigated, capture that page instead.</li>
 *   <li>If neither happened, look for an inline modal dialog: keep its markup and a screenshot, take the
 *   embedded document URL as provenance when there is one, then close it.</li>
 * </ul>
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public class PlaywrightBrowsingSession implements BrowsingSession {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightBrowsingSession.class);

    private static final double LOAD_SETTLE_TIMEOUT_MS = 5_000;
    private static final double MODAL_WAIT_MS = 3_000;
    private static final List<String> MODAL_SELECTORS = List.of(".modal-dialog", ".modal.show", "#modal", "[role='dialog']");
    private static final String EMBEDDED_SOURCE = "iframe[src], embed[src], object[data], img[src]";

    private final Page page;
    private final boolean ownsPage;

    public PlaywrightBrowsingSession(Page page) {
        this(page, false);
    }

    public PlaywrightBrowsingSession(Page page, boolean ownsPage) {
        if (page == null) throw new IllegalArgumentException("page cannot be null");
        this.page = page;
        this.ownsPage = ownsPage;
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public CapturedPage openInNewTab(String url, long timeoutMs) throws CaptureException {
        Page tab = page.context().newPage();
        try {
            Response response = tab.navigate(url, new Page.NavigateOptions().setTimeout(timeoutMs).setWaitUntil(WaitUntilState.LOAD));
            if (response != null && response.status() >= 400) {
                throw new CaptureNavigationException("HTTP " + response.status() + " for " + url);
            }
            return read(tab);
        } catch (TimeoutError e) {
            throw new CaptureTimeoutException("Timed out after " + timeoutMs + " ms loading " + url, e);
        } catch (PlaywrightException e) {
            // Chromium reports a download instead of a page for attachment responses.
            if (e.getMessage() != null && e.getMessage().contains("Download is starting")) {
                return fetch(url, timeoutMs);
            }
            throw new CaptureNavigationException("Failed to load " + url + ": " + e.getMessage(), e);
        } finally {
            closeQuietly(tab);
        }
    }

    @Override
    public CapturedPage activateTrigger(String triggerHint, String triggerText, Integer triggerIndex, long timeoutMs)
            throws CaptureException {
        Locator target;
        try {
            Locator matches = resolveLocator(triggerHint, triggerText);
            target = matches.nth(chooseTarget(matches.count(), triggerIndex, triggerHint));
        } catch (PlaywrightException e) {
            throw new CaptureNavigationException("Invalid trigger hint '" + triggerHint + "': " + e.getMessage(), e);
        }
        String before = page.url();
        Page popup;
        try {
            popup = page.waitForPopup(new Page.WaitForPopupOptions().setTimeout(timeoutMs), target::click);
        } catch (TimeoutError e) {
            if (!before.equals(page.url())) {
                logger.info("Trigger '{}' navigated the origin tab instead of opening a pop-up", triggerHint);
                settle(page);
                return read(page);
            }
            logger.info("No pop-up for '{}'; falling back to inline modal capture", triggerHint);
            CapturedPage modal = captureInlineModal();
            if (modal != null) return modal;
            throw new CaptureTimeoutException("No pop-up within " + timeoutMs + " ms after activating '" + triggerHint
                + "' and no preview modal detected", e);
        } catch (PlaywrightException e) {
            throw new CaptureNavigationException("Activating '" + triggerHint + "' failed: " + e.getMessage(), e);
        }
        try {
            settle(popup);
            return read(popup);
        } finally {
            closeQuietly(popup);
        }
    }

    /**
     * Picks which of {@code count} matching elements to activate.
     * @throws CaptureNavigationException when nothing matches, the index is out of range, or the hint is
     *                                    ambiguous and no index is known
     */
    static int chooseTarget(int count, Integer triggerIndex, String triggerHint) throws CaptureNavigationException {
        if (count == 0) {
            throw new CaptureNavigationException("Trigger element not found for hint '" + triggerHint + "'");
        }
        if (triggerIndex != null) {
            if (triggerIndex < 0 || triggerIndex >= count) {
                throw new CaptureNavigationException("Trigger index " + triggerIndex + " out of range for hint '"
                    + triggerHint + "' (" + count + " matches)");
            }
            return triggerIndex;
        }
        if (count > 1) {
            throw new CaptureNavigationException("Ambiguous trigger locator '" + triggerHint + "': " + count
                + " matching elements and no index");
        }
        return 0;
    }

    /**
     * Whole-text, case-insensitive matcher for a trigger label, tolerant of surrounding and inner whitespace.
     */
    static Pattern exactTextPattern(String text) {
        String[] words = text.trim().split("\\s+");
        StringBuilder regex = new StringBuilder("^\\s*");
        for (int i = 0; i < words.length; i++) {
            if (i > 0) regex.append("\\s+");
            for (char c : words[i].toCharArray()) {
                // Playwright evaluates the pattern as a JavaScript regex, which has no \Q...\E quoting.
                if ("\\^$.|?*+()[]{}/".indexOf(c) >= 0) regex.append('\\');
                regex.append(c);
            }
        }
        return Pattern.compile(regex.append("\\s*$").toString(), Pattern.CASE_INSENSITIVE);
    }

    private CapturedPage captureInlineModal() {
        Locator modal = waitForModal();
        if (modal == null) return null;
        String html;
        try {
            html = modal.innerHTML();
        } catch (PlaywrightException e) {
            logger.debug("Could not read modal markup: {}", e.getMessage());
            return null;
        }
        byte[] screenshot = null;
        try {
            screenshot = modal.screenshot();
        } catch (PlaywrightException e) {
            logger.debug("Modal screenshot skipped: {}", e.getMessage());
        }
        String embedded = embeddedSource(modal);
        closeModal(modal);
        return CapturedPage.modal(embedded, html.getBytes(StandardCharsets.UTF_8), screenshot);
    }

    private Locator waitForModal() {
        for (String selector : MODAL_SELECTORS) {
            Locator candidate = page.locator(selector).first();
            try {
                candidate.waitFor(new Locator.WaitForOptions().setState(WaitForSelectorState.VISIBLE).setTimeout(MODAL_WAIT_MS));
                return candidate;
            } catch (PlaywrightException e) {
                logger.debug("No modal matching {}", selector);
            }
        }
        return null;
    }

    private String embeddedSource(Locator modal) {
        try {
            Locator source = modal.locator(EMBEDDED_SOURCE);
            if (source.count() == 0) return null;
            Locator first = source.first();
            String value = first.getAttribute("src");
            if (Utils.isBlank(value)) value = first.getAttribute("data");
            if (Utils.isBlank(value)) return null;
            return URI.create(page.url()).resolve(value.trim()).toString();
        } catch (PlaywrightException | IllegalArgumentException e) {
            logger.debug("Could not resolve embedded modal source: {}", e.getMessage());
            return null;
        }
    }

    private void closeModal(Locator modal) {
        try {
            Locator close = modal.locator("button").filter(new Locator.FilterOptions().setHasText("Close"));
            if (close.count() > 0) {
                close.first().click(new Locator.ClickOptions().setTimeout(MODAL_WAIT_MS));
                return;
            }
        } catch (PlaywrightException e) {
            logger.debug("Modal close button failed: {}", e.getMessage());
        }
        try {
            page.keyboard().press("Escape");
        } catch (PlaywrightException e) {
            logger.debug("Escape did not close the modal: {}", e.getMessage());
        }
    }

    @Override
    public void navigateBack(long timeoutMs) throws CaptureException {
        try {
            Response response = page.goBack(new Page.GoBackOptions().setTimeout(timeoutMs));
            if (response == null) {
                logger.debug("goBack returned no response; history entry may have been same-document");
            }
            settle(page);
        } catch (TimeoutError e) {
            throw new CaptureTimeoutException("History back navigation timed out after " + timeoutMs + " ms", e);
        } catch (PlaywrightException e) {
            throw new CaptureNavigationException("History back navigation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (ownsPage) closeQuietly(page);
    }

    private Locator resolveLocator(String hint, String triggerText) {
        if (TriggerHints.isIdHint(hint)) {
            return page.locator("[id=\"" + hint.substring(1).replace("\"", "\\\"") + "\"]");
        }
        if (TriggerHints.isClassHint(hint)) {
            if (Utils.isBlank(triggerText)) return page.locator(hint);
            if (TriggerHints.tag(hint).equalsIgnoreCase("input")) {
                return page.locator(hint + valueAttribute(triggerText));
            }
            return page.locator(hint).filter(new Locator.FilterOptions().setHasText(exactTextPattern(triggerText)));
        }
        String text = Utils.isBlank(hint) ? triggerText : hint;
        if (Utils.isBlank(text)) text = "Preview";
        String value = valueAttribute(text);
        return page.locator("a, button").filter(new Locator.FilterOptions().setHasText(exactTextPattern(text)))
            .or(page.locator("input[type=button]" + value + ", input[type=submit]" + value));
    }

    private static String valueAttribute(String text) {
        return "[value=\"" + text.trim().replace("\\", "\\\\").replace("\"", "\\\"") + "\" i]";
    }

    private CapturedPage read(Page target) throws CaptureException {
        String url = target.url();
        if (url != null && url.startsWith("http")) {
            try {
                return fetch(url, (long) LOAD_SETTLE_TIMEOUT_MS * 2);
            } catch (CaptureException e) {
                logger.debug("Falling back to rendered content for {}: {}", url, e.getMessage());
            }
        }
        try {
            return new CapturedPage(url, "text/html", target.content().getBytes(StandardCharsets.UTF_8));
        } catch (PlaywrightException e) {
            throw new CaptureNavigationException("Failed to read content of " + url + ": " + e.getMessage(), e);
        }
    }

    private CapturedPage fetch(String url, long timeoutMs) throws CaptureException {
        APIResponse response = null;
        try {
            response = page.context().request().get(url, RequestOptions.create().setTimeout(timeoutMs));
            if (!response.ok()) {
                throw new CaptureNavigationException("HTTP " + response.status() + " fetching " + url);
            }
            return new CapturedPage(response.url(), response.headers().get("content-type"), response.body());
        } catch (TimeoutError e) {
            throw new CaptureTimeoutException("Timed out fetching " + url, e);
        } catch (PlaywrightException e) {
            throw new CaptureNavigationException("Failed to fetch " + url + ": " + e.getMessage(), e);
        } finally {
            if (response != null) {
                try {
                    response.dispose();
                } catch (PlaywrightException e) {
                    logger.debug("Failed to dispose response for {}: {}", url, e.getMessage());
                }
            }
        }
    }

    private static void settle(Page target) {
        try {
            target.waitForLoadState(LoadState.LOAD, new Page.WaitForLoadStateOptions().setTimeout(LOAD_SETTLE_TIMEOUT_MS));
        } catch (PlaywrightException e) {
            logger.debug("Page did not reach load state: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Page target) {
        try {
            if (!target.isClosed()) target.close();
        } catch (PlaywrightException e) {
            logger.debug("Failed to close tab: {}", e.getMessage());
        }
    }
}
