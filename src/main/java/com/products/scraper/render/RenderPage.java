package com.products.scraper.render;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Set;

/**
 * A single browser tab owned by one request for its whole lifetime.
 * Failures surface as {@link com.products.scraper.exception.ScrapeException}s.
 */
public interface RenderPage extends AutoCloseable {

    /**
     * Aborts every sub-request whose resource type is in {@code resourceTypes};
     * everything else continues untouched.
     *
     * @param resourceTypes engine resource type names, e.g. {@code image}
     */
    void blockResourceTypes(Set<String> resourceTypes);

    /**
     * Loads {@code url}, returning once the DOM has been parsed.
     *
     * @throws com.products.scraper.exception.ScrapeTimeoutException when {@code timeout} expires
     * @throws com.products.scraper.exception.NavigationException    on any other failure
     */
    void navigate(String url, Duration timeout);

    boolean exists(String selector);

    /**
     * Blocks until at least one element matches {@code selector}.
     *
     * @throws com.products.scraper.exception.ScrapeTimeoutException when {@code timeout} expires
     */
    void waitForSelector(String selector, Duration timeout);

    @Nullable
    String attribute(String selector, String name);

    void fill(String selector, String value);

    /**
     * Clicks {@code selector} and waits for the resulting navigation to parse its DOM.
     */
    void submit(String selector, Duration timeout);

    /**
     * @return serialized markup of the current DOM
     */
    String content();

    String url();

    /**
     * Discards the page and its context. Never throws.
     */
    @Override
    void close();
}
