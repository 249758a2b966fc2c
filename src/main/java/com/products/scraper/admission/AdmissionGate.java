package com.products.scraper.admission;

import com.products.scraper.config.ScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-client fixed window counter guarding entry into the scrape pipeline.
 * <p>
 * A client's window opens with its first request and lasts
 * {@code scraper.admission.window}; inside it at most
 * {@code scraper.admission.max-requests} requests are admitted. Expiry is
 * decided by comparing timestamps on every lookup, so the periodic
 * {@link #purgeExpired()} only reclaims memory.
 * </p>
 * <p>
 * Each key is updated through {@link ConcurrentHashMap#compute}, which makes
 * the check-and-increment for one client atomic while different clients
 * proceed in parallel.
 * </p>
 */
@Slf4j
@Component
public class AdmissionGate {

    /** Current window per client id. */
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    /** Requests admitted per window. */
    private final int maxRequests;

    /** Length of one window. */
    private final Duration windowLength;

    /** Time source for window starts and expiry. */
    private final Clock clock;

    @Autowired
    public AdmissionGate(final ScraperProperties props) {
        this(props.getAdmission().getMaxRequests(), props.getAdmission().getWindow(), Clock.systemUTC());
    }

    AdmissionGate(final int maxRequests, final Duration windowLength, final Clock clock) {
        this.maxRequests = maxRequests;
        this.windowLength = Objects.requireNonNull(windowLength, "windowLength");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Counts a request for {@code clientId} if it still fits in the client's window.
     * A denied request leaves the count untouched.
     *
     * @param clientId caller identity, usually the remote address
     * @return {@link Admission#ALLOW} or {@link Admission#DENY}
     */
    public Admission admit(final String clientId) {
        Instant now = clock.instant();
        AtomicReference<Admission> decision = new AtomicReference<>(Admission.DENY);

        windows.compute(clientId, (key, current) -> {
            if (current == null || current.isExpired(now, windowLength)) {
                decision.set(Admission.ALLOW);
                return new Window(now, 1);
            }
            if (current.count() >= maxRequests) {
                return current;
            }
            decision.set(Admission.ALLOW);
            return current.increment();
        });

        if (!decision.get().isAllowed()) {
            log.warn("Admission denied for {} ({} requests in {}s)",
                    clientId, maxRequests, windowLength.toSeconds());
        }
        return decision.get();
    }

    /**
     * Drops windows that have already elapsed.
     */
    @Scheduled(fixedDelayString = "${scraper.admission.window:PT60S}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = windows.size();
        windows.entrySet().removeIf(e -> e.getValue().isExpired(now, windowLength));
        int removed = before - windows.size();
        if (removed > 0) {
            log.debug("Purged {} expired admission windows", removed);
        }
    }

    int trackedClients() {
        return windows.size();
    }

    private record Window(Instant start, int count) {

        boolean isExpired(final Instant now, final Duration length) {
            return !now.isBefore(start.plus(length));
        }

        Window increment() {
            return new Window(start, count + 1);
        }
    }
}
