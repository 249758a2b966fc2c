package com.products.scraper.exception;

/**
 * Any other failure while loading or reading the results page.
 */
public class NavigationException extends ScrapeException {

    public NavigationException(final String message) {
        super(ErrorKind.NAVIGATION, message);
    }

    public NavigationException(final String message, final Throwable cause) {
        super(ErrorKind.NAVIGATION, message, cause);
    }
}
