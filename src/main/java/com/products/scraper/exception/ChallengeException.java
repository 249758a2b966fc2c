package com.products.scraper.exception;

/**
 * A bot-check page is still shown after the one remediation attempt.
 */
public class ChallengeException extends ScrapeException {

    public ChallengeException(final String message) {
        super(ErrorKind.CHALLENGE, message);
    }

    public ChallengeException(final String message, final Throwable cause) {
        super(ErrorKind.CHALLENGE, message, cause);
    }
}
