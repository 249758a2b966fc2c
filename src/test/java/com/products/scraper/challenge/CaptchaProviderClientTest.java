package com.products.scraper.challenge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.scraper.config.ScraperProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaptchaProviderClientTest {

    private static final byte[] IMAGE = {(byte) 0xFF, (byte) 0xD8, 1, 2, 3};

    private ScraperProperties props;

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private final Deque<String> submitReplies = new ArrayDeque<>();

    private final Deque<String> pollReplies = new ArrayDeque<>();

    @BeforeEach
    void setUp() {
        props = new ScraperProperties();
        props.getCaptcha().setApiKey("test-key");
        props.getCaptcha().setPollInterval(Duration.ofMillis(5));
        props.getCaptcha().setSolveTimeout(Duration.ofSeconds(1));
    }

    private CaptchaProviderClient client() {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://solver.test")
                .exchangeFunction(req -> {
                    requests.add(req);
                    String body = req.url().getPath().endsWith("/in.php")
                            ? submitReplies.poll()
                            : pollReplies.size() > 1 ? pollReplies.poll() : pollReplies.peek();
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        Retry retry = Retry.of("test", RetryConfig.custom().maxAttempts(1).build());
        return new CaptchaProviderClient(webClient, new ObjectMapper(), retry,
                CircuitBreaker.ofDefaults("test"), props);
    }

    @Test
    void solveImage_pollsUntilAnswerIsReady() {
        submitReplies.add("{\"status\":1,\"request\":\"4711\"}");
        pollReplies.add("{\"status\":0,\"request\":\"CAPCHA_NOT_READY\"}");
        pollReplies.add("{\"status\":0,\"request\":\"CAPCHA_NOT_READY\"}");
        pollReplies.add("{\"status\":1,\"request\":\"xkcdpq\"}");

        assertThat(client().solveImage(IMAGE)).contains("xkcdpq");

        assertThat(requests).hasSize(4);
        ClientRequest submit = requests.get(0);
        assertThat(submit.method()).isEqualTo(HttpMethod.POST);
        assertThat(submit.url().getPath()).isEqualTo("/in.php");
        assertThat(submit.headers().getContentType()).isEqualTo(MediaType.APPLICATION_FORM_URLENCODED);

        ClientRequest poll = requests.get(1);
        assertThat(poll.method()).isEqualTo(HttpMethod.GET);
        assertThat(poll.url().getPath()).isEqualTo("/res.php");
        assertThat(poll.url().getQuery())
                .contains("key=test-key", "action=get", "id=4711", "json=1");
    }

    @Test
    void solveImage_providerReportsFailure_returnsEmpty() {
        submitReplies.add("{\"status\":1,\"request\":\"4711\"}");
        pollReplies.add("{\"status\":0,\"request\":\"ERROR_CAPTCHA_UNSOLVABLE\"}");

        assertThat(client().solveImage(IMAGE)).isEmpty();
        assertThat(requests).hasSize(2);
    }

    @Test
    void solveImage_notReadyWithinTimeout_returnsEmpty() {
        props.getCaptcha().setSolveTimeout(Duration.ofMillis(20));
        submitReplies.add("{\"status\":1,\"request\":\"4711\"}");
        pollReplies.add("{\"status\":0,\"request\":\"CAPCHA_NOT_READY\"}");

        assertThat(client().solveImage(IMAGE)).isEmpty();
        // one submit plus solveTimeout / pollInterval polls
        assertThat(requests).hasSize(5);
    }

    @Test
    void solveImage_rejectedSubmission_throws() {
        submitReplies.add("{\"status\":0,\"request\":\"ERROR_WRONG_USER_KEY\"}");

        assertThatThrownBy(() -> client().solveImage(IMAGE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ERROR_WRONG_USER_KEY");
    }

    @Test
    void solveImage_malformedReply_throws() {
        submitReplies.add("<html>maintenance</html>");

        assertThatThrownBy(() -> client().solveImage(IMAGE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Malformed response");
    }

    @Test
    void withoutApiKey_isDisabledAndNeverCallsProvider() {
        props.getCaptcha().setApiKey(" ");
        CaptchaProviderClient client = client();

        assertThat(client.isEnabled()).isFalse();
        assertThat(client.solveImage(IMAGE)).isEmpty();
        assertThat(requests).isEmpty();
    }
}
