package com.ytscraper.crawl.model;

/**
 * Per-invocation settings that every component receives explicitly.
 */
public record CrawlContext(boolean verbose) {
    public static CrawlContext quiet() {
        return new CrawlContext(false);
    }
}
