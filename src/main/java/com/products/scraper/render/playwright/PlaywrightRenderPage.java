package com.products.scraper.render.playwright;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import com.products.scraper.exception.NavigationException;
import com.products.scraper.exception.ScrapeTimeoutException;
import com.products.scraper.render.RenderPage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.Set;
import java.util.function.LongConsumer;
import java.util.function.Supplier;

/**
 * A Playwright page living in its own browser context.
 * <p>
 * Every call goes through the session's {@link ApiLock}. Long waits
 * (navigation, selector, submit) are split into short slices, each taking
 * the lock anew, so pages of concurrent requests interleave and every step
 * stays within its own timeout.
 * </p>
 */
@Slf4j
class PlaywrightRenderPage implements RenderPage {

    /** Longest single hold of the shared API lock while waiting on the page. */
    static final Duration WAIT_SLICE = Duration.ofMillis(250);

    /** Budget for calls that return at once (queries, reads, routing). */
    static final Duration QUICK_CALL_TIMEOUT = Duration.ofSeconds(10);

    private static final String BLANK_URL = "about:blank";

    private static final String ERROR_PAGE_PREFIX = "chrome-error://";

    /** Context owning the page; closing it closes the page too. */
    private final BrowserContext context;

    /** The Playwright page. */
    private final Page page;

    /** Lock shared with the owning session and its other pages. */
    private final ApiLock apiLock;

    PlaywrightRenderPage(final BrowserContext context, final Page page, final ApiLock apiLock) {
        this.context = context;
        this.page = page;
        this.apiLock = apiLock;
    }

    @Override
    public void blockResourceTypes(final Set<String> resourceTypes) {
        Set<String> blocked = Set.copyOf(resourceTypes);
        quickRun("Timed out installing the resource filter", () -> page.route("**/*", route -> {
            if (blocked.contains(route.request().resourceType())) {
                route.abort();
            } else {
                route.resume();
            }
        }));
    }

    /**
     * Starts the navigation with a commit wait of one slice, then waits for
     * {@code DOMContentLoaded} slice by slice. The page is fresh, so any URL
     * other than {@code about:blank} belongs to this navigation.
     */
    @Override
    public void navigate(final String url, final Duration timeout) {
        long deadline = ApiLock.deadline(timeout);
        String timeoutMessage = "Navigation timed out after " + timeout.toMillis() + "ms";
        try {
            try {
                apiLock.call(deadline, timeoutMessage, () -> page.navigate(url, new Page.NavigateOptions()
                        .setWaitUntil(WaitUntilState.COMMIT)
                        .setTimeout(slice(deadline, timeoutMessage))));
            } catch (TimeoutError notCommittedYet) {
                log.trace("Navigation to {} not committed within one slice", url);
            }
            awaitSliced(deadline, timeoutMessage, slice -> page.waitForURL(
                    current -> !BLANK_URL.equals(current),
                    new Page.WaitForURLOptions()
                            .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                            .setTimeout(slice)));
        } catch (PlaywrightException ex) {
            throw new NavigationException("Navigation failed: " + ex.getMessage(), ex);
        }

        if (StringUtils.startsWith(url(), ERROR_PAGE_PREFIX)) {
            throw new NavigationException("Navigation failed: browser error page for " + url);
        }
    }

    @Override
    public boolean exists(final String selector) {
        return quick("Timed out querying " + selector, () -> page.querySelector(selector) != null);
    }

    @Override
    public void waitForSelector(final String selector, final Duration timeout) {
        long deadline = ApiLock.deadline(timeout);
        String timeoutMessage = "Timed out after " + timeout.toMillis() + "ms waiting for " + selector;
        try {
            awaitSliced(deadline, timeoutMessage, slice -> page.waitForSelector(selector,
                    new Page.WaitForSelectorOptions()
                            .setState(WaitForSelectorState.ATTACHED)
                            .setTimeout(slice)));
        } catch (PlaywrightException ex) {
            throw new NavigationException("Waiting for " + selector + " failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public String attribute(final String selector, final String name) {
        return quick("Timed out reading " + selector, () -> {
            ElementHandle element = page.querySelector(selector);
            return element == null ? null : element.getAttribute(name);
        });
    }

    @Override
    public void fill(final String selector, final String value) {
        try {
            quickRun("Timed out filling " + selector, () -> page.fill(selector, value));
        } catch (PlaywrightException ex) {
            throw new NavigationException("Could not fill " + selector + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Clicks {@code selector} and waits for the resulting document. The click
     * itself returns once the navigation it triggers has started.
     */
    @Override
    public void submit(final String selector, final Duration timeout) {
        long deadline = ApiLock.deadline(timeout);
        String timeoutMessage = "Submit via " + selector + " timed out";
        try {
            apiLock.call(deadline, timeoutMessage, () -> {
                page.click(selector, new Page.ClickOptions().setTimeout(
                        ApiLock.remainingMillis(deadline, timeoutMessage)));
                return null;
            });
            awaitSliced(deadline, timeoutMessage, slice -> page.waitForLoadState(LoadState.DOMCONTENTLOADED,
                    new Page.WaitForLoadStateOptions().setTimeout(slice)));
        } catch (TimeoutError ex) {
            throw new ScrapeTimeoutException(timeoutMessage, ex);
        } catch (PlaywrightException ex) {
            throw new NavigationException("Submit via " + selector + " failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public String content() {
        try {
            return quick("Timed out reading page content", page::content);
        } catch (PlaywrightException ex) {
            throw new NavigationException("Could not read page content: " + ex.getMessage(), ex);
        }
    }

    @Override
    public String url() {
        return quick("Timed out reading page url", page::url);
    }

    @Override
    public void close() {
        apiLock.runExclusive(() -> {
            try {
                context.close();
            } catch (PlaywrightException ex) {
                log.warn("Page did not close cleanly: {}", ex.getMessage());
            }
        });
    }

    /**
     * Repeats {@code waitFor} with a timeout of at most one slice until it
     * returns, releasing the lock between slices.
     *
     * @throws ScrapeTimeoutException once the deadline has passed
     */
    private void awaitSliced(final long deadline, final String timeoutMessage, final LongConsumer waitFor) {
        while (true) {
            long slice = slice(deadline, timeoutMessage);
            try {
                apiLock.call(deadline, timeoutMessage, () -> {
                    waitFor.accept(slice);
                    return null;
                });
                return;
            } catch (TimeoutError sliceElapsed) {
                log.trace("Slice of {}ms elapsed: {}", slice, timeoutMessage);
            }
        }
    }

    private static long slice(final long deadline, final String timeoutMessage) {
        return Math.min(WAIT_SLICE.toMillis(), ApiLock.remainingMillis(deadline, timeoutMessage));
    }

    private <T> T quick(final String timeoutMessage, final Supplier<T> call) {
        return apiLock.call(ApiLock.deadline(QUICK_CALL_TIMEOUT), timeoutMessage, call);
    }

    private void quickRun(final String timeoutMessage, final Runnable call) {
        quick(timeoutMessage, () -> {
            call.run();
            return null;
        });
    }
}
