package com.products.scraper.exception;

import lombok.Getter;

/**
 * Base type of every failure raised by a scrape attempt.
 */
@Getter
public abstract class ScrapeException extends RuntimeException {

    private final ErrorKind kind;

    protected ScrapeException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    protected ScrapeException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
