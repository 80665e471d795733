package com.cgrera.extractor;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Launches Chromium through Playwright and opens {@link PlaywrightBrowsingSession}s on detail pages.
 * <p>
 * A storage state file left by an earlier session (cookies, local storage) is restored when it looks like
 * JSON; an invalid file is moved aside and a fresh context is used. Session bootstrap beyond that (CAPTCHA,
 * search form) is outside this class.
 *
 * @author CG RERA Extractor Team
 * @since 1.0
 */
public final class PlaywrightSessionFactory implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightSessionFactory.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Path storageState;

    public PlaywrightSessionFactory(boolean headless, Path storageState) {
        this.storageState = storageState;
        this.playwright = Playwright.create();
        try {
            this.browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
            this.context = createOrRestoreContext(browser);
        } catch (RuntimeException e) {
            logger.error("Failed to launch browser: {}", e.getMessage());
            playwright.close();
            throw e;
        }
    }

    private BrowserContext createOrRestoreContext(Browser browser) {
        Browser.NewContextOptions options = new Browser.NewContextOptions().setViewportSize(1920, 1080).setAcceptDownloads(true);
        if (storageState != null && Files.exists(storageState)) {
            if (looksLikeJson(storageState)) {
                options.setStorageStatePath(storageState);
                logger.info("Using existing storage state from {} to restore session.", storageState);
            } else {
                Path backup = storageState.resolveSibling(storageState.getFileName() + ".invalid-" + System.currentTimeMillis());
                try {
                    Files.move(storageState, backup);
                    logger.warn("Storage state appears invalid. Backed up to {} and starting a fresh context.", backup);
                } catch (IOException e) {
                    logger.warn("Storage state appears invalid and could not be backed up: {}. It will be ignored.", e.getMessage());
                }
            }
        } else {
            logger.info("No existing storage state found; starting a fresh context.");
        }
        try {
            return browser.newContext(options);
        } catch (PlaywrightException e) {
            logger.warn("Playwright failed to create context using storage state: {}. Retrying without it.", e.getMessage());
            return browser.newContext(new Browser.NewContextOptions().setViewportSize(1920, 1080).setAcceptDownloads(true));
        }
    }

    private static boolean looksLikeJson(Path file) {
        try {
            String content = Files.readString(file).stripLeading();
            return content.startsWith("{") || content.startsWith("[");
        } catch (IOException e) {
            logger.warn("Failed to read storage state '{}': {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Opens a new tab on a detail page. This is the only navigation to the origin URL; everything after it
     * stays on the page's history.
     * @param detailUrl detail page URL
     * @param timeoutMs navigation timeout
     * @return session owning the new tab
     * @throws CaptureException when the page cannot be loaded
     */
    public BrowsingSession open(String detailUrl, long timeoutMs) throws CaptureException {
        Page page = context.newPage();
        try {
            Utils.retryPlaywrightAction(() -> page.navigate(detailUrl,
                new Page.NavigateOptions().setTimeout(timeoutMs).setWaitUntil(WaitUntilState.LOAD)), 2, "open " + detailUrl, 1_000);
            return new PlaywrightBrowsingSession(page, true);
        } catch (Exception e) {
            page.close();
            throw new CaptureNavigationException("Failed to open detail page " + detailUrl + ": " + e.getMessage(), e);
        }
    }

    /**
     * Saves cookies and local storage so the next run can restore them.
     */
    public void saveStorageState() {
        if (storageState == null) return;
        try {
            Path parent = storageState.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            context.storageState(new BrowserContext.StorageStateOptions().setPath(storageState));
            logger.info("Saved storage state to {}", storageState);
        } catch (IOException | PlaywrightException e) {
            logger.warn("Failed to save storage state: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } catch (PlaywrightException e) {
            logger.warn("Error while closing browser: {}", e.getMessage());
        } finally {
            playwright.close();
        }
    }
}
