package com.products.scraper.backend;

import com.products.scraper.model.Backend;
import com.products.scraper.model.ProductRecord;

import java.util.List;

/**
 * One way of turning a keyword into product records.
 * <p>
 * Implementations return only valid records (title and price present) and
 * signal every failure with a {@link com.products.scraper.exception.ScrapeException}.
 * </p>
 */
public interface ProductSearchBackend {

    /**
     * @return which backend this is
     */
    Backend kind();

    /**
     * @param keyword non-blank search keyword, not yet encoded
     * @return a non-null, possibly empty list of valid records in page order
     */
    List<ProductRecord> search(String keyword);
}
