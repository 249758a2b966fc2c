package com.products.scraper.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds scraper configuration from <code>application.yml</code> under the
 * <code>scraper</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * scraper:
 *   target:
 *     base-url: https://www.amazon.com
 *     search-path: /s
 *   browser:
 *     work-dir: ./render_data
 *     proxy-server: ${PROXY_SERVER:}
 *   captcha:
 *     api-key: ${TWO_CAPTCHA_API_KEY:}
 * }</pre>
 */
@Component
@Validated
@ConfigurationProperties(prefix = "scraper")
@Getter
@Setter
public class ScraperProperties {

    @Valid
    private Target target = new Target();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Timeouts timeouts = new Timeouts();

    @Valid
    private Admission admission = new Admission();

    @Valid
    private Browser browser = new Browser();

    @Valid
    private Captcha captcha = new Captcha();

    private Cors cors = new Cors();

    /**
     * The site being searched and the markers that identify its pages.
     */
    @Data
    public static class Target {

        /** Origin all product links are canonicalized against. */
        @NotBlank
        private String baseUrl = "https://www.amazon.com";

        /** Path of the search results page, relative to {@link #baseUrl}. */
        @NotBlank
        private String searchPath = "/s";

        /** Query parameter carrying the keyword. */
        @NotBlank
        private String keywordParam = "k";

        /** Text that only appears in a raw response when the request was rejected. */
        @NotBlank
        private String blockMarker = "robot-verification";
    }

    @Data
    public static class Retry {

        /** Upper bound for the caller supplied retry budget. */
        @Min(0)
        @Max(3)
        private int maxRetries = 3;

        /** Delay before attempt {@code i} is {@code backoffStep * i}. */
        @NotNull
        private Duration backoffStep = Duration.ofMillis(2000);
    }

    @Data
    public static class Timeouts {

        @NotNull
        private Duration navigation = Duration.ofSeconds(30);

        @NotNull
        private Duration selectorWait = Duration.ofSeconds(10);

        @NotNull
        private Duration rawFetch = Duration.ofSeconds(15);
    }

    @Data
    public static class Admission {

        /** Requests admitted per client inside one window. */
        @Min(1)
        private int maxRequests = 10;

        /** Window length, counted from the first request of the window. */
        @NotNull
        private Duration window = Duration.ofSeconds(60);
    }

    @Data
    public static class Browser {

        /** Scratch directory wiped before every launch. */
        @NotNull
        private Path workDir = Path.of("render_data");

        private boolean headless = true;

        /** Launch the browser when the application is ready instead of on first use. */
        private boolean launchOnStartup = false;

        @NotNull
        private Duration launchTimeout = Duration.ofSeconds(60);

        @Min(1)
        private int viewportWidth = 1920;

        @Min(1)
        private int viewportHeight = 1080;

        /** Optional upstream proxy, e.g. {@code http://proxy:3128}. Blank means direct. */
        private String proxyServer;
    }

    @Data
    public static class Captcha {

        /** 2captcha API key. Blank disables challenge remediation. */
        private String apiKey;

        @NotBlank
        private String baseUrl = "https://2captcha.com";

        @NotNull
        private Duration pollInterval = Duration.ofSeconds(5);

        @NotNull
        private Duration solveTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Cors {

        private List<String> allowedOrigins = new ArrayList<>();
    }
}
