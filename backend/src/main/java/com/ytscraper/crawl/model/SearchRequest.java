package com.ytscraper.crawl.model;

public record SearchRequest(SearchMode mode, String query, SearchSettings settings, CrawlContext context) {
}
