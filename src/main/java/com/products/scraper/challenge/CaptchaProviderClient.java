package com.products.scraper.challenge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.scraper.config.ScraperProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.decorators.Decorators;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Client for the 2captcha image recognition API.
 * <p>
 * An image is submitted to {@code /in.php}; the answer is then polled from
 * {@code /res.php} every {@code scraper.captcha.poll-interval} until it is
 * ready or {@code scraper.captcha.solve-timeout} has passed. Both calls go
 * through the {@code captchaSolver} retry and circuit breaker.
 * </p>
 */
@Slf4j
@Component
public class CaptchaProviderClient {

    private static final String SUBMIT_PATH = "/in.php";

    private static final String RESULT_PATH = "/res.php";

    private static final String NOT_READY = "CAPCHA_NOT_READY";

    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(30);

    /** WebClient bound to the provider base URL. */
    private final WebClient webClient;

    /** Parses the provider's JSON answers. */
    private final ObjectMapper mapper;

    /** Resilience4j retry for transient provider failures. */
    private final Retry retry;

    /** Resilience4j circuit breaker guarding the provider. */
    private final CircuitBreaker circuitBreaker;

    /** API key, polling interval and solve timeout. */
    private final ScraperProperties.Captcha cfg;

    public CaptchaProviderClient(@Qualifier("captchaWebClient") final WebClient webClient,
                                 @Qualifier("scraperObjectMapper") final ObjectMapper mapper,
                                 final Retry captchaRetry,
                                 final CircuitBreaker captchaCircuitBreaker,
                                 final ScraperProperties props) {
        this.webClient = Objects.requireNonNull(webClient);
        this.mapper = Objects.requireNonNull(mapper);
        this.retry = Objects.requireNonNull(captchaRetry);
        this.circuitBreaker = Objects.requireNonNull(captchaCircuitBreaker);
        this.cfg = props.getCaptcha();
    }

    /**
     * @return {@code true} when an API key is configured
     */
    public boolean isEnabled() {
        return StringUtils.isNotBlank(cfg.getApiKey());
    }

    /**
     * Sends {@code image} for recognition and waits for the answer.
     *
     * @param image raw image bytes (JPEG or PNG)
     * @return the recognized text, or empty when the provider could not solve it in time
     * @throws IllegalStateException when the provider rejects the request
     */
    public Optional<String> solveImage(final byte[] image) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        String id = decorate(() -> submit(image)).get();
        log.info("Captcha submitted to provider, id={}", id);

        PollResult result = pollUntilReady(id);
        if (result.pending()) {
            log.warn("Captcha {} not solved within {}s", id, cfg.getSolveTimeout().toSeconds());
            return Optional.empty();
        }
        if (result.error() != null) {
            log.warn("Captcha {} failed at provider: {}", id, result.error());
            return Optional.empty();
        }
        return Optional.of(result.answer());
    }

    private String submit(final byte[] image) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("key", cfg.getApiKey());
        form.add("method", "base64");
        form.add("body", Base64.getEncoder().encodeToString(image));
        form.add("json", "1");

        JsonNode rsp = read(webClient.post()
                .uri(SUBMIT_PATH)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(String.class)
                .block(CALL_TIMEOUT));

        if (rsp.path("status").asInt() != 1) {
            throw new IllegalStateException("Captcha provider rejected submission: "
                    + rsp.path("request").asText());
        }
        return rsp.path("request").asText();
    }

    private PollResult pollUntilReady(final String id) {
        long interval = Math.max(1, cfg.getPollInterval().toMillis());
        int attempts = (int) Math.max(1, cfg.getSolveTimeout().toMillis() / interval);

        Retry poller = Retry.of("captchaPoll-" + id, RetryConfig.<PollResult>custom()
                .maxAttempts(attempts)
                .waitDuration(Duration.ofMillis(interval))
                .retryOnResult(PollResult::pending)
                .build());

        return Retry.decorateSupplier(poller, decorate(() -> poll(id))).get();
    }

    private PollResult poll(final String id) {
        JsonNode rsp = read(webClient.get()
                .uri(b -> b.path(RESULT_PATH)
                        .queryParam("key", cfg.getApiKey())
                        .queryParam("action", "get")
                        .queryParam("id", id)
                        .queryParam("json", "1")
                        .build())
                .retrieve()
                .bodyToMono(String.class)
                .block(CALL_TIMEOUT));

        String request = rsp.path("request").asText();
        if (rsp.path("status").asInt() == 1) {
            return new PollResult(false, request, null);
        }
        if (NOT_READY.equals(request)) {
            return new PollResult(true, null, null);
        }
        return new PollResult(false, null, request);
    }

    private <T> Supplier<T> decorate(final Supplier<T> call) {
        return Decorators.ofSupplier(call)
                .withRetry(retry)
                .withCircuitBreaker(circuitBreaker)
                .decorate();
    }

    private JsonNode read(final String body) {
        if (body == null) {
            throw new IllegalStateException("Empty response from captcha provider");
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Malformed response from captcha provider: "
                    + StringUtils.abbreviate(body, 80), ex);
        }
    }

    private record PollResult(boolean pending, String answer, String error) {
    }
}
