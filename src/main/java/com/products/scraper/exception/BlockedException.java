package com.products.scraper.exception;

/**
 * The raw response was a block page, or the site answered 503.
 */
public class BlockedException extends ScrapeException {

    public BlockedException(final String message) {
        super(ErrorKind.BLOCKED, message);
    }

    public BlockedException(final String message, final Throwable cause) {
        super(ErrorKind.BLOCKED, message, cause);
    }
}
