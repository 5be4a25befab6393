package com.ytscraper.crawl.model;

import com.ytscraper.crawl.options.ScraperConfigException;

import java.util.List;

/**
 * Validated traversal bounds. Items at {@code maxDepth} are recorded but never expanded; {@code branchCounts}
 * holds the number of children requested per level, the last entry applying to every deeper level.
 */
public record TraversalConfig(int maxDepth, List<Integer> branchCounts) {
    public TraversalConfig {
        if (maxDepth < 0) {
            throw new ScraperConfigException("max_depth must be >= 0 but was " + maxDepth);
        }
        if (branchCounts == null || branchCounts.isEmpty()) {
            throw new ScraperConfigException("number must contain at least one branch count");
        }
        for (Integer count : branchCounts) {
            if (count == null || count < 1) {
                throw new ScraperConfigException("branch counts must be positive but got " + branchCounts);
            }
        }
        branchCounts = List.copyOf(branchCounts);
    }
}
