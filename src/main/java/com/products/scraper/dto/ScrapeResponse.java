package com.products.scraper.dto;

import com.products.scraper.model.ProductRecord;

import java.util.List;

/**
 * Successful scrape payload.
 *
 * @param success  always {@code true}
 * @param count    number of products
 * @param products valid products in page order
 */
public record ScrapeResponse(
        boolean success,
        int count,
        List<ProductRecord> products
) {

    public static ScrapeResponse of(final List<ProductRecord> products) {
        return new ScrapeResponse(true, products.size(), List.copyOf(products));
    }
}
