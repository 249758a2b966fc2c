package com.products.scraper.challenge;

import com.products.scraper.config.ScraperProperties;
import com.products.scraper.render.RenderPage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Optional;

/**
 * Solves the target site's text captcha through {@link CaptchaProviderClient}.
 * <p>
 * The challenge image is downloaded directly (images are blocked inside the
 * page), its text is recognized by the provider, typed into the challenge
 * field and the form is submitted. Whether the answer was accepted is left
 * to the caller to check.
 * </p>
 */
@Slf4j
@Component
public class CaptchaChallengeSolver implements ChallengeSolver {

    static final String IMAGE_SELECTOR = "form img";

    static final String INPUT_SELECTOR = "#captchacharacters";

    static final String SUBMIT_SELECTOR = "button[type=submit]";

    private static final Duration IMAGE_TIMEOUT = Duration.ofSeconds(15);

    private final CaptchaProviderClient provider;

    private final WebClient webClient;

    private final Duration navigationTimeout;

    public CaptchaChallengeSolver(final CaptchaProviderClient provider,
                                  @Qualifier("targetWebClient") final WebClient webClient,
                                  final ScraperProperties props) {
        this.provider = provider;
        this.webClient = webClient;
        this.navigationTimeout = props.getTimeouts().getNavigation();
    }

    @Override
    public boolean solve(final RenderPage page) {
        if (!provider.isEnabled()) {
            log.warn("Challenge page shown but no captcha API key is configured");
            return false;
        }

        String imageUrl = page.attribute(IMAGE_SELECTOR, "src");
        if (StringUtils.isBlank(imageUrl)) {
            log.warn("Challenge page has no captcha image");
            return false;
        }

        byte[] image = webClient.get()
                .uri(imageUrl)
                .retrieve()
                .bodyToMono(byte[].class)
                .block(IMAGE_TIMEOUT);
        if (image == null || image.length == 0) {
            log.warn("Captcha image at {} was empty", imageUrl);
            return false;
        }

        Optional<String> answer = provider.solveImage(image);
        if (answer.isEmpty()) {
            return false;
        }

        page.fill(INPUT_SELECTOR, answer.get());
        page.submit(SUBMIT_SELECTOR, navigationTimeout);
        return true;
    }
}
