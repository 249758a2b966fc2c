package com.products.scraper.backend;

import com.products.scraper.config.ScraperProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Builds URLs on the target site.
 */
@Component
public class SearchTarget {

    private final ScraperProperties.Target target;

    public SearchTarget(final ScraperProperties props) {
        this.target = props.getTarget();
    }

    /**
     * @param keyword raw keyword; every reserved character is percent-encoded
     * @return the search results URL, e.g. {@code https://www.amazon.com/s?k=usb%20c%20cable}
     */
    public URI searchUri(final String keyword) {
        return UriComponentsBuilder.fromUriString(target.getBaseUrl())
                .path(target.getSearchPath())
                .queryParam(target.getKeywordParam(), "{keyword}")
                .encode()
                .buildAndExpand(keyword)
                .toUri();
    }

    public String baseUrl() {
        return target.getBaseUrl();
    }

    public String blockMarker() {
        return target.getBlockMarker();
    }
}
