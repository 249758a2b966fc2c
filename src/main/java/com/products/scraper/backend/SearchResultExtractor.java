package com.products.scraper.backend;

import com.products.scraper.model.ProductRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

/**
 * Reads product records out of a search results page.
 * <p>
 * Both backends feed their markup through this class, so a record looks the
 * same whichever backend produced it. Items missing a title or a price are
 * dropped here.
 * </p>
 */
@Slf4j
@Component
public class SearchResultExtractor {

    /** Every result tile carries the product identifier in this attribute. */
    public static final String RESULT_ITEM_SELECTOR = "[data-asin]";

    private static final String ITEM_ID_ATTR = "data-asin";

    private static final String TITLE_SELECTOR = "h2 span";

    private static final String PRICE_SELECTOR = ".a-price span";

    private static final String RATING_SELECTOR = "[aria-label*=stars]";

    private static final String IMAGE_SELECTOR = "img.s-image";

    private static final String PRODUCT_LINK_SELECTOR = "a[href*=/dp/], a[href*=/gp/product/]";

    private static final String PRODUCT_PATH = "/dp/";

    private final String origin;

    public SearchResultExtractor(final SearchTarget searchTarget) {
        this.origin = StringUtils.removeEnd(searchTarget.baseUrl(), "/");
    }

    /**
     * @param html    page markup
     * @param pageUrl URL the markup was served from, used to resolve relative links
     * @return valid records in page order
     */
    public List<ProductRecord> extract(final String html, final String pageUrl) {
        Document doc = Jsoup.parse(html, pageUrl);
        List<Element> items = doc.select(RESULT_ITEM_SELECTOR);

        List<ProductRecord> records = items.stream()
                .map(this::toRecord)
                .filter(ProductRecord::isValid)
                .toList();

        log.debug("Extracted {} valid records from {} result items", records.size(), items.size());
        return records;
    }

    private ProductRecord toRecord(final Element item) {
        return new ProductRecord(
                text(item.selectFirst(TITLE_SELECTOR)),
                text(item.selectFirst(PRICE_SELECTOR)),
                attr(item.selectFirst(RATING_SELECTOR), "aria-label"),
                imageUrl(item.selectFirst(IMAGE_SELECTOR)),
                link(item));
    }

    /**
     * Canonical product URL: the site origin plus the path of the item's
     * product anchor (query and fragment dropped), or {@code /dp/<id>} when the
     * item has no usable anchor.
     */
    @Nullable
    private String link(final Element item) {
        Element anchor = item.selectFirst(PRODUCT_LINK_SELECTOR);
        if (anchor != null) {
            String path = pathOf(anchor.absUrl("href"));
            if (StringUtils.isNotBlank(path)) {
                return origin + path;
            }
        }
        String id = item.attr(ITEM_ID_ATTR).trim();
        return id.isEmpty() ? null : origin + PRODUCT_PATH + id;
    }

    @Nullable
    private static String pathOf(final String absoluteUrl) {
        if (StringUtils.isBlank(absoluteUrl)) {
            return null;
        }
        try {
            return new URI(absoluteUrl).getRawPath();
        } catch (URISyntaxException ex) {
            log.debug("Unparseable product href {}: {}", absoluteUrl, ex.getMessage());
            return null;
        }
    }

    @Nullable
    private static String imageUrl(@Nullable final Element img) {
        if (img == null) {
            return null;
        }
        String abs = img.absUrl("src");
        return StringUtils.defaultIfBlank(abs, StringUtils.trimToNull(img.attr("src")));
    }

    @Nullable
    private static String text(@Nullable final Element el) {
        return el == null ? null : StringUtils.trimToNull(el.text());
    }

    @Nullable
    private static String attr(@Nullable final Element el, final String name) {
        return el == null ? null : StringUtils.trimToNull(el.attr(name));
    }
}
