package com.products.scraper.model;

/**
 * The extraction backend that produced a result set.
 */
public enum Backend {

    /** Headless browser rendering of the results page. */
    RENDERING,

    /** Single HTTP GET parsed with jsoup. */
    RAW_FETCH
}
