package com.products.scraper.model;

import com.products.scraper.exception.ErrorKind;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Result of one orchestrated scrape. Never persisted.
 *
 * @param records      valid records, in page order
 * @param attemptsUsed number of backend invocations made, fallback included
 * @param backendUsed  backend that produced {@code records}
 * @param lastError    last failure observed before success, if any
 */
public record RequestOutcome(
        List<ProductRecord> records,
        int attemptsUsed,
        Backend backendUsed,
        @Nullable AttemptError lastError
) {

    public RequestOutcome {
        records = List.copyOf(records);
    }

    public Optional<AttemptError> error() {
        return Optional.ofNullable(lastError);
    }

    /**
     * Kind and message of a failed attempt.
     */
    public record AttemptError(ErrorKind kind, String message) {
    }
}
