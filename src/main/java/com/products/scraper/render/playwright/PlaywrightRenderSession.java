package com.products.scraper.render.playwright;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.ServiceWorkerPolicy;
import com.products.scraper.exception.NavigationException;
import com.products.scraper.identity.IdentityProfile;
import com.products.scraper.render.RenderPage;
import com.products.scraper.render.RenderSession;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One Chromium process driven by Playwright.
 * <p>
 * Playwright objects are not thread safe: only one thread may be inside a
 * Playwright call at a time. Every call made through this session or any of
 * its pages therefore runs under {@link #apiLock}. Connection state is
 * tracked from the disconnect event, so checking it never waits for the lock.
 * </p>
 */
@Slf4j
class PlaywrightRenderSession implements RenderSession {

    /** Hides the most common automation tell before any page script runs. */
    private static final String STEALTH_SCRIPT =
            "Object.defineProperty(navigator, 'webdriver', { get: () => undefined });";

    /** Budget for creating the context and page of one request. */
    static final Duration OPEN_TIMEOUT = Duration.ofSeconds(10);

    /** Driver connection; closed together with the browser. */
    private final Playwright playwright;

    /** The Chromium process. */
    private final Browser browser;

    private final int viewportWidth;

    private final int viewportHeight;

    /** Lock shared by this session and all of its pages. */
    private final ApiLock apiLock = new ApiLock();

    /** Cleared when the browser process goes away. */
    private final AtomicBoolean connected = new AtomicBoolean(true);

    private final AtomicBoolean closed = new AtomicBoolean();

    PlaywrightRenderSession(final Playwright playwright,
                            final Browser browser,
                            final int viewportWidth,
                            final int viewportHeight) {
        this.playwright = playwright;
        this.browser = browser;
        this.viewportWidth = viewportWidth;
        this.viewportHeight = viewportHeight;
        browser.onDisconnected(b -> {
            connected.set(false);
            log.warn("Browser process disconnected");
        });
    }

    @Override
    public RenderPage openPage(final IdentityProfile identity) {
        try {
            return apiLock.call(ApiLock.deadline(OPEN_TIMEOUT), "Timed out opening a page", () -> {
                BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                        .setUserAgent(identity.userAgent())
                        .setViewportSize(viewportWidth, viewportHeight)
                        .setLocale("en-US")
                        .setExtraHTTPHeaders(identity.extraBrowserHeaders())
                        .setIgnoreHTTPSErrors(true)
                        .setServiceWorkers(ServiceWorkerPolicy.BLOCK));
                try {
                    context.addInitScript(STEALTH_SCRIPT);
                    Page page = context.newPage();
                    return new PlaywrightRenderPage(context, page, apiLock);
                } catch (PlaywrightException ex) {
                    context.close();
                    throw ex;
                }
            });
        } catch (PlaywrightException ex) {
            throw new NavigationException("Could not open page: " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean isConnected() {
        return !closed.get() && connected.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        apiLock.runExclusive(() -> {
            try {
                browser.close();
            } catch (PlaywrightException ex) {
                log.warn("Browser did not close cleanly: {}", ex.getMessage());
            } finally {
                playwright.close();
            }
        });
    }
}
