package com.products.scraper.exception;

/**
 * Failure categories surfaced by the extraction core.
 */
public enum ErrorKind {
    TIMEOUT,
    CHALLENGE,
    BLOCKED,
    NAVIGATION,
    NO_RESULTS
}
