package com.products.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Product Scraper application.
 *
 * <p>This Spring Boot application exposes a single RESTful endpoint that
 * extracts product listings for a search keyword:
 * <ul>
 *   <li>a headless-browser backend (Playwright) that renders the results page,</li>
 *   <li>a raw HTTP backend (WebClient + jsoup) used as a last-resort fallback.</li>
 * </ul>
 * The orchestrator sequences the two with a linear backoff between attempts.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   mvn spring-boot:run
 *
 *   curl 'http://localhost:3000/api/scrape?keyword=laptop&retry=2'
 * }</pre>
 */
@SpringBootApplication
@EnableScheduling
public class ProductScraperApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(ProductScraperApplication.class, args);
    }
}
