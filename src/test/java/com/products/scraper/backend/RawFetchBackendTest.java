package com.products.scraper.backend;

import com.products.scraper.config.ScraperProperties;
import com.products.scraper.exception.BlockedException;
import com.products.scraper.exception.ErrorKind;
import com.products.scraper.exception.NavigationException;
import com.products.scraper.exception.ScrapeTimeoutException;
import com.products.scraper.identity.IdentityGenerator;
import com.products.scraper.model.Backend;
import com.products.scraper.model.ProductRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RawFetchBackendTest {

    private ScraperProperties props;

    private SearchTarget target;

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        props = new ScraperProperties();
        target = new SearchTarget(props);
    }

    private RawFetchBackend backend(final ExchangeFunction exchange) {
        WebClient client = WebClient.builder()
                .exchangeFunction(req -> {
                    lastRequest.set(req);
                    return exchange.exchange(req);
                })
                .build();
        return new RawFetchBackend(client, new IdentityGenerator(), target,
                new SearchResultExtractor(target), props);
    }

    private static ExchangeFunction respond(final HttpStatus status, final String body) {
        return req -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE)
                .body(body)
                .build());
    }

    @Test
    @DisplayName("parses a normal results page into valid records")
    void search_resultsPage_returnsValidRecords() throws IOException {
        RawFetchBackend backend = backend(respond(HttpStatus.OK,
                SearchResultExtractorTest.fixture("search-results.html")));

        List<ProductRecord> records = backend.search("gaming laptop");

        assertThat(backend.kind()).isEqualTo(Backend.RAW_FETCH);
        assertThat(records).hasSize(3).allMatch(ProductRecord::isValid);
    }

    @Test
    @DisplayName("encodes the keyword and sends a consistent identity")
    void search_sendsEncodedKeywordAndIdentityHeaders() {
        backend(respond(HttpStatus.OK, "<html></html>")).search("usb c & hub");

        ClientRequest req = lastRequest.get();
        assertThat(req.url().toString()).isEqualTo("https://www.amazon.com/s?k=usb%20c%20%26%20hub");
        String ua = req.headers().getFirst("user-agent");
        String hints = req.headers().getFirst("sec-ch-ua");
        assertThat(ua).startsWith("Mozilla/5.0 (Windows NT 10.0; Win64; x64)");
        String version = ua.replaceAll(".*Chrome/(\\d+).*", "$1");
        assertThat(hints).contains("\"Chromium\";v=\"" + version + "\"");
    }

    @Test
    @DisplayName("a block marker in the body fails without parsing")
    void search_blockMarker_throwsBlocked() throws IOException {
        RawFetchBackend backend = backend(respond(HttpStatus.OK,
                SearchResultExtractorTest.fixture("robot-check.html")));

        assertThatThrownBy(() -> backend.search("laptop"))
                .isInstanceOf(BlockedException.class)
                .hasMessage("CAPTCHA detected")
                .extracting("kind").isEqualTo(ErrorKind.BLOCKED);
    }

    @Test
    void search_serviceUnavailable_throwsBlocked() {
        RawFetchBackend backend = backend(respond(HttpStatus.SERVICE_UNAVAILABLE, "busy"));

        assertThatThrownBy(() -> backend.search("laptop"))
                .isInstanceOf(BlockedException.class)
                .hasMessageContaining("blocking");
    }

    @Test
    void search_otherHttpError_throwsNavigation() {
        RawFetchBackend backend = backend(respond(HttpStatus.NOT_FOUND, "gone"));

        assertThatThrownBy(() -> backend.search("laptop"))
                .isInstanceOf(NavigationException.class)
                .hasMessageContaining("404");
    }

    @Test
    void search_slowResponse_throwsTimeout() {
        props.getTimeouts().setRawFetch(Duration.ofMillis(50));
        RawFetchBackend backend = backend(req -> Mono.never());

        assertThatThrownBy(() -> backend.search("laptop"))
                .isInstanceOf(ScrapeTimeoutException.class);
    }
}
