package com.products.scraper.backend;

import com.products.scraper.config.ScraperProperties;
import com.products.scraper.exception.BlockedException;
import com.products.scraper.exception.NavigationException;
import com.products.scraper.exception.ScrapeTimeoutException;
import com.products.scraper.identity.IdentityGenerator;
import com.products.scraper.identity.IdentityProfile;
import com.products.scraper.model.Backend;
import com.products.scraper.model.ProductRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Fetches the search results page with one plain HTTP GET and parses it with jsoup.
 * <p>
 * No JavaScript runs and no challenge is solved: a response containing the
 * block marker, or a 503, is reported as {@link BlockedException}.
 * </p>
 */
@Slf4j
@Service
public class RawFetchBackend implements ProductSearchBackend {

    /** WebClient bound to the target site. */
    private final WebClient webClient;

    /** Source of a fresh request identity per fetch. */
    private final IdentityGenerator identityGenerator;

    /** Search URL and block marker of the target site. */
    private final SearchTarget searchTarget;

    /** Shared result page parser. */
    private final SearchResultExtractor extractor;

    /** Upper bound for the whole GET, body included. */
    private final Duration timeout;

    public RawFetchBackend(@Qualifier("targetWebClient") final WebClient webClient,
                           final IdentityGenerator identityGenerator,
                           final SearchTarget searchTarget,
                           final SearchResultExtractor extractor,
                           final ScraperProperties props) {
        this.webClient = webClient;
        this.identityGenerator = identityGenerator;
        this.searchTarget = searchTarget;
        this.extractor = extractor;
        this.timeout = props.getTimeouts().getRawFetch();
    }

    @Override
    public Backend kind() {
        return Backend.RAW_FETCH;
    }

    @Override
    public List<ProductRecord> search(final String keyword) {
        URI uri = searchTarget.searchUri(keyword);

        long t0 = System.nanoTime();
        String body = fetch(uri, identityGenerator.generate());
        long t1 = System.nanoTime();

        if (body.contains(searchTarget.blockMarker())) {
            throw new BlockedException("CAPTCHA detected");
        }

        List<ProductRecord> records = extractor.extract(body, uri.toString());
        long t2 = System.nanoTime();

        log.info("RAW '{}' records={} NET={}ms PARSE={}ms TOTAL={}ms", keyword, records.size(),
                (t1 - t0) / 1_000_000, (t2 - t1) / 1_000_000, (t2 - t0) / 1_000_000);
        return records;
    }

    private String fetch(final URI uri, final IdentityProfile identity) {
        try {
            String body = webClient.get()
                    .uri(uri)
                    .headers(h -> identity.headers().forEach(h::set))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return body == null ? "" : body;
        } catch (WebClientResponseException ex) {
            if (ex.getStatusCode().value() == HttpStatus.SERVICE_UNAVAILABLE.value()) {
                throw new BlockedException("Target site is blocking requests", ex);
            }
            throw new NavigationException("HTTP " + ex.getStatusCode().value() + " from " + uri.getHost(), ex);
        } catch (RuntimeException ex) {
            if (isTimeout(ex)) {
                throw new ScrapeTimeoutException("Raw fetch timed out after " + timeout.toMillis() + "ms", ex);
            }
            throw new NavigationException("Raw fetch failed: " + ex.getMessage(), ex);
        }
    }

    private static boolean isTimeout(final Throwable ex) {
        return ExceptionUtils.getThrowableList(ex).stream()
                .anyMatch(t -> t instanceof TimeoutException
                        || t instanceof io.netty.handler.timeout.TimeoutException);
    }
}
