package com.products.scraper.identity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request-identifying attributes presented to the target site. Every field
 * that names a browser version names the same one.
 *
 * @param chromeVersion  major Chrome version embedded everywhere below
 * @param userAgent      the {@code User-Agent} value
 * @param acceptLanguage the {@code Accept-Language} value
 * @param clientHints    {@code sec-ch-ua*} headers
 * @param fetchHeaders   the remaining navigation headers ({@code accept}, {@code sec-fetch-*}, ...)
 */
public record IdentityProfile(
        int chromeVersion,
        String userAgent,
        String acceptLanguage,
        Map<String, String> clientHints,
        Map<String, String> fetchHeaders
) {

    public IdentityProfile {
        clientHints = Collections.unmodifiableMap(new LinkedHashMap<>(clientHints));
        fetchHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(fetchHeaders));
    }

    /**
     * Full header set for a raw request, in the order a browser sends them.
     *
     * @return ordered, unmodifiable header map including {@code user-agent}
     */
    public Map<String, String> headers() {
        Map<String, String> all = new LinkedHashMap<>(fetchHeaders);
        all.put("accept-language", acceptLanguage);
        all.putAll(clientHints);
        all.put("user-agent", userAgent);
        return Collections.unmodifiableMap(all);
    }

    /**
     * Headers a browser context should add on top of what the engine already
     * sends; the user agent is configured separately on the context.
     *
     * @return client hints plus {@code accept-language}
     */
    public Map<String, String> extraBrowserHeaders() {
        Map<String, String> extra = new LinkedHashMap<>(clientHints);
        extra.put("accept-language", acceptLanguage);
        return Collections.unmodifiableMap(extra);
    }
}
