package com.products.scraper.exception;

import lombok.Getter;
import org.springframework.lang.Nullable;

/**
 * Terminal failure: every attempt on both backends produced zero valid records.
 * Carries the kind and message of the last underlying failure, if there was one.
 */
@Getter
public class NoResultsException extends ScrapeException {

    /** Kind of the last underlying failure, {@code null} when every attempt merely came back empty. */
    @Nullable
    private final ErrorKind causeKind;

    public NoResultsException(@Nullable final ErrorKind causeKind,
                              final String message,
                              @Nullable final Throwable cause) {
        super(ErrorKind.NO_RESULTS, message, cause);
        this.causeKind = causeKind;
    }
}
