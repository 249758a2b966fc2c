package com.products.scraper.orchestrator;

import com.products.scraper.backend.ProductSearchBackend;
import com.products.scraper.backend.RenderingBackend;
import com.products.scraper.backend.SearchResultExtractor;
import com.products.scraper.backend.SearchTarget;
import com.products.scraper.challenge.ChallengeSolver;
import com.products.scraper.config.ScraperProperties;
import com.products.scraper.exception.BlockedException;
import com.products.scraper.exception.ChallengeException;
import com.products.scraper.exception.ErrorKind;
import com.products.scraper.exception.NoResultsException;
import com.products.scraper.exception.ScrapeTimeoutException;
import com.products.scraper.identity.IdentityGenerator;
import com.products.scraper.identity.IdentityProfile;
import com.products.scraper.model.Backend;
import com.products.scraper.model.ProductRecord;
import com.products.scraper.model.RequestOutcome;
import com.products.scraper.render.RenderPage;
import com.products.scraper.render.RenderSession;
import com.products.scraper.render.RenderSessionManager;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeOrchestratorTest {

    private static final Duration STEP = Duration.ofMillis(1);

    @Mock
    private ProductSearchBackend rendering;

    @Mock
    private ProductSearchBackend rawFetch;

    private ScrapeOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        lenient().when(rendering.kind()).thenReturn(Backend.RENDERING);
        lenient().when(rawFetch.kind()).thenReturn(Backend.RAW_FETCH);
        orchestrator = new ScrapeOrchestrator(rendering, rawFetch, 3, STEP);
    }

    private static String fixture(final String name) throws IOException {
        try (InputStream in = ScrapeOrchestratorTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static List<ProductRecord> products(final int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> new ProductRecord("Item " + i, "$" + i, null, null,
                        "https://www.amazon.com/dp/B" + i))
                .toList();
    }

    @Test
    @DisplayName("first non-empty rendering attempt wins without backoff")
    void run_renderingSucceedsFirstTime() {
        when(rendering.search("laptop")).thenReturn(products(17));

        RequestOutcome outcome = orchestrator.run("laptop", 3);

        assertThat(outcome.records()).hasSize(17);
        assertThat(outcome.backendUsed()).isEqualTo(Backend.RENDERING);
        assertThat(outcome.attemptsUsed()).isEqualTo(1);
        assertThat(outcome.error()).isEmpty();
        verify(rawFetch, never()).search(anyString());
    }

    @Test
    @DisplayName("budget 0: one rendering call, then exactly one raw fetch")
    void run_zeroBudget_atMostTwoBackendCalls() {
        when(rendering.search("laptop")).thenThrow(new ScrapeTimeoutException("Timed out"));
        when(rawFetch.search("laptop")).thenReturn(products(2));

        RequestOutcome outcome = orchestrator.run("laptop", 0);

        verify(rendering, times(1)).search("laptop");
        verify(rawFetch, times(1)).search("laptop");
        assertThat(outcome.attemptsUsed()).isEqualTo(2);
    }

    @Test
    @DisplayName("budget 3: four rendering attempts before falling back")
    void run_fullBudget_fourRenderingAttempts() {
        when(rendering.search("laptop")).thenThrow(new ScrapeTimeoutException("Timed out"));
        when(rawFetch.search("laptop")).thenReturn(products(1));

        RequestOutcome outcome = orchestrator.run("laptop", 3);

        verify(rendering, times(4)).search("laptop");
        verify(rawFetch, times(1)).search("laptop");
        assertThat(outcome.attemptsUsed()).isEqualTo(5);
        assertThat(outcome.error()).get()
                .extracting(RequestOutcome.AttemptError::kind)
                .isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    void linearBackoff_waitsOneStepMorePerRetry() {
        IntervalFunction backoff = ScrapeOrchestrator.linearBackoff(Duration.ofMillis(2000));

        assertThat(backoff.apply(1)).isEqualTo(2000L);
        assertThat(backoff.apply(2)).isEqualTo(4000L);
        assertThat(backoff.apply(3)).isEqualTo(6000L);
    }

    @Test
    @DisplayName("retries actually wait step, 2*step and 3*step")
    void run_waitsBetweenAttempts() {
        ScrapeOrchestrator slow = new ScrapeOrchestrator(rendering, rawFetch, 3, Duration.ofMillis(40));
        when(rendering.search("laptop")).thenReturn(List.of());
        when(rawFetch.search("laptop")).thenReturn(products(1));

        long t0 = System.nanoTime();
        slow.run("laptop", 3);
        long elapsedMillis = (System.nanoTime() - t0) / 1_000_000;

        assertThat(elapsedMillis).isGreaterThanOrEqualTo(40 + 80 + 120);
        verify(rendering, times(4)).search("laptop");
    }

    @Test
    void run_laterAttemptSucceeds_reportsEarlierError() {
        when(rendering.search("laptop"))
                .thenThrow(new ChallengeException("CAPTCHA verification required"))
                .thenReturn(products(4));

        RequestOutcome outcome = orchestrator.run("laptop", 2);

        assertThat(outcome.records()).hasSize(4);
        assertThat(outcome.attemptsUsed()).isEqualTo(2);
        assertThat(outcome.error()).get()
                .extracting(RequestOutcome.AttemptError::kind)
                .isEqualTo(ErrorKind.CHALLENGE);
    }

    @Test
    @DisplayName("empty rendering results also fall through to the raw fetch")
    void run_emptyRendering_fallsBack() {
        when(rendering.search("laptop")).thenReturn(List.of());
        when(rawFetch.search("laptop")).thenReturn(products(3));

        RequestOutcome outcome = orchestrator.run("laptop", 1);

        assertThat(outcome.backendUsed()).isEqualTo(Backend.RAW_FETCH);
        verify(rendering, times(2)).search("laptop");
    }

    @ParameterizedTest
    @CsvSource({"-1, 0", "0, 0", "2, 2", "3, 3", "7, 3"})
    void clampBudget_keepsBudgetInRange(final int requested, final int expected) {
        assertThat(orchestrator.clampBudget(requested)).isEqualTo(expected);
    }

    @Test
    void run_blankKeyword_rejected() {
        assertThatThrownBy(() -> orchestrator.run("  ", 0)).isInstanceOf(IllegalArgumentException.class);
        verify(rendering, never()).search(anyString());
    }

    @Nested
    class Scenarios {

        @Test
        @DisplayName("A: 20 rendered tiles, 3 without a price, yield 17 records")
        void scenarioA_renderedPageIsFiltered() throws IOException {
            RenderSessionManager sessionManager = mock(RenderSessionManager.class);
            RenderSession session = mock(RenderSession.class);
            RenderPage page = mock(RenderPage.class);
            when(sessionManager.acquire()).thenReturn(session);
            when(session.openPage(any(IdentityProfile.class))).thenReturn(page);
            when(page.content()).thenReturn(fixture("search-results-20.html"));
            when(page.url()).thenReturn("https://www.amazon.com/s?k=wireless%20mouse");

            ScraperProperties props = new ScraperProperties();
            SearchTarget target = new SearchTarget(props);
            RenderingBackend renderingBackend = new RenderingBackend(sessionManager, new IdentityGenerator(),
                    mock(ChallengeSolver.class), target, new SearchResultExtractor(target), props);

            RequestOutcome outcome = new ScrapeOrchestrator(renderingBackend, rawFetch, 3, STEP)
                    .run("wireless mouse", 0);

            assertThat(outcome.backendUsed()).isEqualTo(Backend.RENDERING);
            assertThat(outcome.attemptsUsed()).isEqualTo(1);
            assertThat(outcome.records())
                    .hasSize(17)
                    .allMatch(ProductRecord::isValid)
                    .extracting(ProductRecord::title)
                    .doesNotContain("Wireless Mouse Model 5", "Wireless Mouse Model 11", "Wireless Mouse Model 18");
            verify(page).close();
            verify(rawFetch, never()).search(anyString());
        }

        @Test
        @DisplayName("B: challenge on every rendering attempt, raw fetch returns 5")
        void scenarioB_challengeThenRawFetch() {
            when(rendering.search("laptop")).thenThrow(new ChallengeException("CAPTCHA verification required"));
            when(rawFetch.search("laptop")).thenReturn(products(5));

            RequestOutcome outcome = orchestrator.run("laptop", 1);

            assertThat(outcome.records()).hasSize(5);
            assertThat(outcome.backendUsed()).isEqualTo(Backend.RAW_FETCH);
            assertThat(outcome.attemptsUsed()).isEqualTo(3);
            verify(rendering, times(2)).search("laptop");
        }

        @Test
        @DisplayName("C: nothing anywhere ends in NoResultsException")
        void scenarioC_noResultsAnywhere() {
            when(rendering.search("laptop")).thenReturn(List.of());
            when(rawFetch.search("laptop")).thenReturn(List.of());

            assertThatThrownBy(() -> orchestrator.run("laptop", 1))
                    .isInstanceOf(NoResultsException.class)
                    .hasMessage(ScrapeOrchestrator.NOTHING_FOUND)
                    .extracting("causeKind").isNull();
        }

        @Test
        void lastUnderlyingErrorIsCarried() {
            when(rendering.search("laptop")).thenThrow(new ScrapeTimeoutException("Timed out"));
            when(rawFetch.search("laptop")).thenThrow(new BlockedException("CAPTCHA detected"));

            assertThatThrownBy(() -> orchestrator.run("laptop", 0))
                    .isInstanceOfSatisfying(NoResultsException.class, ex -> {
                        assertThat(ex.getCauseKind()).isEqualTo(ErrorKind.BLOCKED);
                        assertThat(ex.getMessage()).isEqualTo("CAPTCHA detected");
                        assertThat(ex.getCause()).isInstanceOf(BlockedException.class);
                    });
        }

        @Test
        void rawFetchEmptyKeepsRenderingError() {
            when(rendering.search("laptop")).thenThrow(new ChallengeException("CAPTCHA verification required"));
            when(rawFetch.search("laptop")).thenReturn(List.of());

            assertThatThrownBy(() -> orchestrator.run("laptop", 0))
                    .isInstanceOfSatisfying(NoResultsException.class,
                            ex -> assertThat(ex.getCauseKind()).isEqualTo(ErrorKind.CHALLENGE));
        }
    }
}
