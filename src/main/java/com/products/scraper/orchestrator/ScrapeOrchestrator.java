package com.products.scraper.orchestrator;

import com.products.scraper.backend.ProductSearchBackend;
import com.products.scraper.backend.RawFetchBackend;
import com.products.scraper.backend.RenderingBackend;
import com.products.scraper.config.ScraperProperties;
import com.products.scraper.exception.ErrorKind;
import com.products.scraper.exception.NoResultsException;
import com.products.scraper.exception.ScrapeException;
import com.products.scraper.model.Backend;
import com.products.scraper.model.ProductRecord;
import com.products.scraper.model.RequestOutcome;
import com.products.scraper.model.RequestOutcome.AttemptError;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.decorators.Decorators;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Sequences scrape attempts across the two backends.
 * <p>
 * The rendering backend runs under a per-run Resilience4j {@link Retry}:
 * up to {@code budget + 1} attempts, retried on any failure and on an empty
 * result, waiting {@code backoffStep * n} before retry {@code n}. When the
 * retry gives up, the fallback runs the raw fetch backend exactly once. If
 * that is empty too, a {@link NoResultsException} carrying the last failure
 * is thrown.
 * </p>
 * <p>
 * Every failure kind counts the same: a challenge page simply advances the
 * attempt counter like a timeout does.
 * </p>
 */
@Slf4j
@Service
public class ScrapeOrchestrator {

    /** Detail reported when nothing failed but nothing was found either. */
    static final String NOTHING_FOUND = "Try different keywords";

    /** Name of the per-run retry around the rendering backend. */
    private static final String RENDERING_RETRY = "scrapeRendering";

    /** Primary backend, retried. */
    private final ProductSearchBackend rendering;

    /** Fallback backend, tried once. */
    private final ProductSearchBackend rawFetch;

    /** Upper bound for the per-request retry budget. */
    private final int maxRetries;

    /** Wait before retry {@code n} is {@code n} times this step. */
    private final Duration backoffStep;

    @Autowired
    public ScrapeOrchestrator(final RenderingBackend rendering,
                              final RawFetchBackend rawFetch,
                              final ScraperProperties props) {
        this(rendering, rawFetch, props.getRetry().getMaxRetries(), props.getRetry().getBackoffStep());
    }

    ScrapeOrchestrator(final ProductSearchBackend rendering,
                       final ProductSearchBackend rawFetch,
                       final int maxRetries,
                       final Duration backoffStep) {
        this.rendering = rendering;
        this.rawFetch = rawFetch;
        this.maxRetries = maxRetries;
        this.backoffStep = backoffStep;
    }

    /**
     * @param keyword     non-blank keyword
     * @param retryBudget extra rendering attempts after the first; clamped to {@code 0..maxRetries}
     * @return the first non-empty result set
     * @throws NoResultsException       when both backends are exhausted without a valid record
     * @throws IllegalArgumentException when {@code keyword} is blank
     */
    public RequestOutcome run(final String keyword, final int retryBudget) {
        if (StringUtils.isBlank(keyword)) {
            throw new IllegalArgumentException("keyword must not be blank");
        }
        int budget = clampBudget(retryBudget);
        long t0 = System.nanoTime();
        Run run = new Run();

        Supplier<List<ProductRecord>> attempt = () -> {
            run.attempts++;
            return rendering.search(keyword);
        };
        List<ProductRecord> records = Decorators.ofSupplier(attempt)
                .withRetry(renderingRetry(keyword, budget, run))
                .withFallback((found, failure) -> found != null && !found.isEmpty()
                        ? found
                        : fallBack(keyword, run))
                .decorate()
                .get();

        if (!records.isEmpty()) {
            log.info("'{}' -> {} records via {} after {} attempts in {}ms", keyword, records.size(),
                    run.backend, run.attempts, (System.nanoTime() - t0) / 1_000_000);
            return new RequestOutcome(records, run.attempts, run.backend, run.lastError);
        }

        log.warn("No products for '{}' after {} attempts in {}ms", keyword, run.attempts,
                (System.nanoTime() - t0) / 1_000_000);
        ErrorKind causeKind = run.lastError == null ? null : run.lastError.kind();
        String detail = run.lastError == null ? NOTHING_FOUND : run.lastError.message();
        throw new NoResultsException(causeKind, detail, run.lastFailure);
    }

    private Retry renderingRetry(final String keyword, final int budget, final Run run) {
        Retry retry = Retry.of(RENDERING_RETRY, RetryConfig.<List<ProductRecord>>custom()
                .maxAttempts(budget + 1)
                .intervalFunction(linearBackoff(backoffStep))
                .retryOnResult(List::isEmpty)
                .retryExceptions(RuntimeException.class)
                .build());

        retry.getEventPublisher()
                .onRetry(e -> {
                    if (e.getLastThrowable() != null) {
                        run.record(e.getLastThrowable());
                    }
                    log.warn("Rendering attempt {}/{} for '{}' {}, retrying in {}ms",
                            e.getNumberOfRetryAttempts(), budget + 1, keyword,
                            e.getLastThrowable() == null ? "returned no records" : "failed: " + run.lastError,
                            e.getWaitInterval().toMillis());
                })
                .onError(e -> {
                    if (e.getLastThrowable() != null) {
                        run.record(e.getLastThrowable());
                    }
                    log.warn("Rendering gave up for '{}' after {} attempts, last error: {}",
                            keyword, e.getNumberOfRetryAttempts(), run.lastError);
                });
        return retry;
    }

    private List<ProductRecord> fallBack(final String keyword, final Run run) {
        log.info("Rendering exhausted for '{}', falling back to raw fetch", keyword);
        run.attempts++;
        run.backend = rawFetch.kind();
        try {
            List<ProductRecord> records = rawFetch.search(keyword);
            if (records.isEmpty()) {
                log.info("Raw fetch for '{}' returned no records", keyword);
            }
            return records;
        } catch (RuntimeException ex) {
            run.record(ex);
            log.warn("Raw fetch for '{}' failed: {}", keyword, run.lastError);
            return List.of();
        }
    }

    /**
     * @param step wait unit
     * @return interval function waiting {@code step * n} before retry {@code n}
     */
    static IntervalFunction linearBackoff(final Duration step) {
        long stepMillis = step.toMillis();
        return retryNumber -> stepMillis * retryNumber;
    }

    int clampBudget(final int retryBudget) {
        return Math.max(0, Math.min(retryBudget, maxRetries));
    }

    /**
     * Bookkeeping of one {@link #run(String, int)} call. Retry events fire on
     * the calling thread, so no synchronisation is needed.
     */
    private final class Run {

        private int attempts;

        private Backend backend = rendering.kind();

        private AttemptError lastError;

        private Throwable lastFailure;

        void record(final Throwable failure) {
            lastFailure = failure;
            if (failure instanceof ScrapeException se) {
                lastError = new AttemptError(se.getKind(), se.getMessage());
            } else {
                lastError = new AttemptError(ErrorKind.NAVIGATION, StringUtils.defaultIfBlank(
                        failure.getMessage(), failure.getClass().getSimpleName()));
            }
        }
    }
}
