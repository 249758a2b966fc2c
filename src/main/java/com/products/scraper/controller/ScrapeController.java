package com.products.scraper.controller;

import com.products.scraper.dto.ScrapeResponse;
import com.products.scraper.model.RequestOutcome;
import com.products.scraper.orchestrator.ScrapeOrchestrator;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the product scrape.
 * <p>
 * Endpoint: <code>GET /api/scrape?keyword=laptop&amp;retry=2</code><br>
 * Produces: <code>application/json</code>
 * </p>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * {
 *   "success": true,
 *   "count": 17,
 *   "products": [
 *     {
 *       "title": "Acme 14\" Laptop",
 *       "price": "$499.99",
 *       "rating": "4.5 out of 5 stars",
 *       "imageUrl": "https://m.media-amazon.com/images/I/abc.jpg",
 *       "link": "https://www.amazon.com/Acme-Laptop/dp/B0TEST0001"
 *     }
 *   ]
 * }
 * }</pre>
 *
 * <p>Failures are rendered by {@link ScrapeExceptionHandler}.</p>
 */
@RestController
@RequestMapping("/api/scrape")
@RequiredArgsConstructor
public class ScrapeController {

    private final ScrapeOrchestrator orchestrator;

    /**
     * @param keyword search keyword; required
     * @param retry   extra rendering attempts; anything non-numeric counts as 0
     * @return the products found
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ScrapeResponse scrape(@RequestParam(required = false) @NotBlank final String keyword,
                                 @RequestParam(required = false) final String retry) {
        RequestOutcome outcome = orchestrator.run(keyword, NumberUtils.toInt(retry, 0));
        return ScrapeResponse.of(outcome.records());
    }
}
