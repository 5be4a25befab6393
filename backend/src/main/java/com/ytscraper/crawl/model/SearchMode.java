package com.ytscraper.crawl.model;

import com.ytscraper.crawl.service.InvalidInputException;

import java.util.Locale;

public enum SearchMode {
    TERM,
    URL,
    ID;

    public static SearchMode fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException("Missing search type, expected one of term, url, id");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        try {
            return SearchMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Wrong search type '" + raw + "', expected one of term, url, id");
        }
    }
}
