package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.apache.commons.lang3.StringUtils;

/**
 * One product listing as shown on a search results page.
 *
 * @param title    product title; required
 * @param price    price as displayed (e.g. {@code "$19.99"}); required, never parsed
 * @param rating   raw accessible rating label, e.g. {@code "4.5 out of 5 stars"}
 * @param imageUrl thumbnail URL
 * @param link     absolute canonical product URL
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProductRecord(
        String title,
        String price,
        String rating,
        String imageUrl,
        String link
) {

    /**
     * @return {@code true} when both title and price carry text
     */
    public boolean isValid() {
        return StringUtils.isNotBlank(title) && StringUtils.isNotBlank(price);
    }
}
