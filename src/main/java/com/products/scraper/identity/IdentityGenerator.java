package com.products.scraper.identity;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Produces a randomized desktop Chrome identity per call.
 * <p>
 * Only the major version varies; it is drawn from a window of recent
 * releases and written into both the user agent and the {@code sec-ch-ua}
 * hint so the two never disagree.
 * </p>
 */
@Component
public class IdentityGenerator {

    /** Lowest major version handed out. */
    public static final int MIN_CHROME_VERSION = 115;

    /** Highest major version handed out. */
    public static final int MAX_CHROME_VERSION = 124;

    private static final String USER_AGENT_TEMPLATE =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/%d.0.0.0 Safari/537.36";

    private static final String SEC_CH_UA_TEMPLATE =
            "\"Google Chrome\";v=\"%d\", \"Chromium\";v=\"%d\", \"Not=A?Brand\";v=\"24\"";

    private static final String ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,image/apng,*/*;q=0.8";

    private static final String ACCEPT_LANGUAGE = "en-US,en;q=0.9";

    private final Random random;

    @Autowired
    public IdentityGenerator() {
        this(new Random());
    }

    IdentityGenerator(final Random random) {
        this.random = random;
    }

    /**
     * @return a fresh, internally consistent identity
     */
    public IdentityProfile generate() {
        int version = MIN_CHROME_VERSION
                + random.nextInt(MAX_CHROME_VERSION - MIN_CHROME_VERSION + 1);

        Map<String, String> hints = new LinkedHashMap<>();
        hints.put("sec-ch-ua", String.format(SEC_CH_UA_TEMPLATE, version, version));
        hints.put("sec-ch-ua-mobile", "?0");
        hints.put("sec-ch-ua-platform", "\"Windows\"");

        Map<String, String> fetch = new LinkedHashMap<>();
        fetch.put("accept", ACCEPT);
        fetch.put("cache-control", "max-age=0");
        fetch.put("sec-fetch-dest", "document");
        fetch.put("sec-fetch-mode", "navigate");
        fetch.put("sec-fetch-site", "none");
        fetch.put("sec-fetch-user", "?1");
        fetch.put("upgrade-insecure-requests", "1");

        return new IdentityProfile(
                version,
                String.format(USER_AGENT_TEMPLATE, version),
                ACCEPT_LANGUAGE,
                hints,
                fetch);
    }
}
