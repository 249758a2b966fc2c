package com.products.scraper.exception;

/**
 * A navigation, selector wait or fetch exceeded its time limit.
 */
public class ScrapeTimeoutException extends ScrapeException {

    public ScrapeTimeoutException(final String message) {
        super(ErrorKind.TIMEOUT, message);
    }

    public ScrapeTimeoutException(final String message, final Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
