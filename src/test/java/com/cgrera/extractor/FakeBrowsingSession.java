package com.cgrera.extractor;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scriptable {@link BrowsingSession} for capture tests. Triggers open a pop-up at
 * {@code <origin host>/preview/<n>} unless scripted otherwise; the latest script for a hint wins over an
 * earlier failure. Every call is recorded.
 */
class FakeBrowsingSession implements BrowsingSession {
    private final String origin;
    private final Deque<String> history = new ArrayDeque<>();
    private final Map<String, CapturedPage> popups = new HashMap<>();
    private final Map<String, CapturedPage> sameTab = new HashMap<>();
    private final Map<String, CapturedPage> modals = new HashMap<>();
    private final Map<String, Exception> failures = new HashMap<>();
    private final Map<String, Integer> openFailures = new HashMap<>();
    final List<String> calls = new ArrayList<>();
    final List<String> openedUrls = new ArrayList<>();
    final List<Integer> triggerIndexes = new ArrayList<>();
    private String current;
    private int popupCounter;
    boolean closed;

    FakeBrowsingSession(String origin) {
        this.origin = origin;
        this.current = origin;
    }

    FakeBrowsingSession popup(String hint, String url, String contentType) {
        failures.remove(hint);
        popups.put(hint, new CapturedPage(url, contentType, ("content of " + url).getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    FakeBrowsingSession navigatesSameTab(String hint, String url) {
        sameTab.put(hint, new CapturedPage(url, "text/html", "<html>doc</html>".getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    FakeBrowsingSession inlineModal(String hint, String html, String embeddedUrl) {
        failures.remove(hint);
        modals.put(hint, CapturedPage.modal(embeddedUrl, html.getBytes(StandardCharsets.UTF_8),
            new byte[] {(byte) 0x89, 'P', 'N', 'G'}));
        return this;
    }

    /**
     * Makes the trigger throw; accepts a {@link CaptureException} or any runtime exception.
     */
    FakeBrowsingSession fails(String hint, Exception failure) {
        if (!(failure instanceof CaptureException) && !(failure instanceof RuntimeException)) {
            throw new IllegalArgumentException("unsupported failure type " + failure.getClass());
        }
        failures.put(hint, failure);
        return this;
    }

    FakeBrowsingSession failOpen(String url, int times) {
        openFailures.put(url, times);
        return this;
    }

    @Override
    public String currentUrl() {
        return current;
    }

    @Override
    public CapturedPage openInNewTab(String url, long timeoutMs) throws CaptureException {
        calls.add("open:" + url);
        openedUrls.add(url);
        int remaining = openFailures.getOrDefault(url, 0);
        if (remaining > 0) {
            openFailures.put(url, remaining - 1);
            throw new CaptureNavigationException("net::ERR_CONNECTION_RESET at " + url);
        }
        return new CapturedPage(url, "application/pdf", "%PDF-1.4".getBytes(StandardCharsets.US_ASCII));
    }

    @Override
    public CapturedPage activateTrigger(String triggerHint, String triggerText, Integer triggerIndex, long timeoutMs)
            throws CaptureException {
        calls.add("trigger:" + triggerHint);
        triggerIndexes.add(triggerIndex);
        Exception failure = failures.get(triggerHint);
        if (failure instanceof CaptureException) throw (CaptureException) failure;
        if (failure != null) throw (RuntimeException) failure;
        if (modals.containsKey(triggerHint)) return modals.get(triggerHint);
        if (sameTab.containsKey(triggerHint)) {
            CapturedPage page = sameTab.get(triggerHint);
            history.push(current);
            current = page.finalUrl();
            return page;
        }
        CapturedPage page = popups.get(triggerHint);
        if (page == null) {
            String url = "https://rera.cgstate.gov.in/preview/" + (++popupCounter);
            page = new CapturedPage(url, "application/pdf", "%PDF-1.4".getBytes(StandardCharsets.US_ASCII));
        }
        return page;
    }

    @Override
    public void navigateBack(long timeoutMs) throws CaptureException {
        calls.add("back");
        if (history.isEmpty()) throw new CaptureNavigationException("No history entry");
        current = history.pop();
    }

    @Override
    public void close() {
        closed = true;
    }

    String origin() {
        return origin;
    }
}
