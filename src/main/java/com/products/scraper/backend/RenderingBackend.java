package com.products.scraper.backend;

import com.products.scraper.challenge.ChallengeSolver;
import com.products.scraper.config.ScraperProperties;
import com.products.scraper.exception.ChallengeException;
import com.products.scraper.exception.NavigationException;
import com.products.scraper.exception.ScrapeException;
import com.products.scraper.identity.IdentityGenerator;
import com.products.scraper.model.Backend;
import com.products.scraper.model.ProductRecord;
import com.products.scraper.render.RenderPage;
import com.products.scraper.render.RenderSession;
import com.products.scraper.render.RenderSessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Renders the search results page in the shared headless browser.
 * <p>
 * Every call opens its own page with a fresh identity, blocks images, fonts
 * and stylesheets, navigates, gives a challenge page exactly one remediation
 * pass, waits for the first result tile and extracts the records. The page is
 * closed on every exit path; the session stays up for the next request.
 * </p>
 */
@Slf4j
@Service
public class RenderingBackend implements ProductSearchBackend {

    /** Resource types that never reach the network. */
    public static final Set<String> BLOCKED_RESOURCE_TYPES = Set.of("image", "font", "stylesheet");

    /** Input field that only exists on the bot-check page. */
    public static final String CHALLENGE_SELECTOR = "#captchacharacters";

    /** Owner of the shared browser session. */
    private final RenderSessionManager sessionManager;

    /** Source of a fresh page identity per attempt. */
    private final IdentityGenerator identityGenerator;

    /** One-shot remediation for the bot-check page. */
    private final ChallengeSolver challengeSolver;

    /** Search URL of the target site. */
    private final SearchTarget searchTarget;

    /** Shared result page parser. */
    private final SearchResultExtractor extractor;

    /** Navigation and selector wait budgets. */
    private final ScraperProperties.Timeouts timeouts;

    public RenderingBackend(final RenderSessionManager sessionManager,
                            final IdentityGenerator identityGenerator,
                            final ChallengeSolver challengeSolver,
                            final SearchTarget searchTarget,
                            final SearchResultExtractor extractor,
                            final ScraperProperties props) {
        this.sessionManager = sessionManager;
        this.identityGenerator = identityGenerator;
        this.challengeSolver = challengeSolver;
        this.searchTarget = searchTarget;
        this.extractor = extractor;
        this.timeouts = props.getTimeouts();
    }

    @Override
    public Backend kind() {
        return Backend.RENDERING;
    }

    @Override
    public List<ProductRecord> search(final String keyword) {
        RenderSession session;
        try {
            session = sessionManager.acquire();
        } catch (RuntimeException ex) {
            throw new NavigationException("Render session unavailable: " + ex.getMessage(), ex);
        }
        return extract(keyword, session);
    }

    /**
     * Runs one rendering pass against {@code session}.
     *
     * @param keyword raw search keyword
     * @param session live session to open the page in
     * @return valid records in page order
     */
    public List<ProductRecord> extract(final String keyword, final RenderSession session) {
        String url = searchTarget.searchUri(keyword).toString();

        long t0 = System.nanoTime();
        try (RenderPage page = session.openPage(identityGenerator.generate())) {
            page.blockResourceTypes(BLOCKED_RESOURCE_TYPES);
            page.navigate(url, timeouts.getNavigation());
            long t1 = System.nanoTime();

            resolveChallenge(page);
            page.waitForSelector(SearchResultExtractor.RESULT_ITEM_SELECTOR, timeouts.getSelectorWait());

            List<ProductRecord> records = extractor.extract(page.content(), page.url());
            long t2 = System.nanoTime();

            log.info("RENDER '{}' records={} NAV={}ms EXTRACT={}ms TOTAL={}ms", keyword, records.size(),
                    (t1 - t0) / 1_000_000, (t2 - t1) / 1_000_000, (t2 - t0) / 1_000_000);
            return records;
        } catch (ScrapeException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new NavigationException("Rendering failed: " + ex.getMessage(), ex);
        }
    }

    private void resolveChallenge(final RenderPage page) {
        if (!page.exists(CHALLENGE_SELECTOR)) {
            return;
        }
        log.warn("Challenge page served for {}, attempting remediation", page.url());

        boolean submitted;
        try {
            submitted = challengeSolver.solve(page);
        } catch (RuntimeException ex) {
            throw new ChallengeException("CAPTCHA verification required: " + ex.getMessage(), ex);
        }

        if (page.exists(CHALLENGE_SELECTOR)) {
            throw new ChallengeException(submitted
                    ? "CAPTCHA verification required: answer was rejected"
                    : "CAPTCHA verification required");
        }
        log.info("Challenge page cleared");
    }
}
