package com.ytscraper.crawl.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result filters forwarded to search and related-video queries. Blank values are not sent.
 */
public record ApiSearchOptions(String regionCode, String relevanceLanguage, String safeSearch) {
    public static ApiSearchOptions none() {
        return new ApiSearchOptions(null, null, null);
    }

    public Map<String, String> toQueryParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        putIfPresent(params, "regionCode", regionCode);
        putIfPresent(params, "relevanceLanguage", relevanceLanguage);
        putIfPresent(params, "safeSearch", safeSearch);
        return params;
    }

    private static void putIfPresent(Map<String, String> params, String key, String value) {
        if (value != null && !value.isBlank()) {
            params.put(key, value.trim());
        }
    }
}
