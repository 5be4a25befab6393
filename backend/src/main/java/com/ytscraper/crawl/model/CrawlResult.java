package com.ytscraper.crawl.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a completed crawl. {@code exportDirectory} is null when nothing was exported and {@code rendering}
 * is null when the tree was not rendered.
 */
public record CrawlResult(List<CrawlNode> nodes, Path exportDirectory, String rendering) {
    public CrawlResult {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }
}
