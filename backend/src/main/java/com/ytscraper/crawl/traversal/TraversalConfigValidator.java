package com.ytscraper.crawl.traversal;

import com.ytscraper.crawl.model.TraversalConfig;
import com.ytscraper.crawl.options.ScraperConfigException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Turns raw option values into a {@link TraversalConfig}. A single branch count is wrapped into a one-element
 * schedule; the caller's values are never modified.
 */
@Component
public class TraversalConfigValidator {
    public static final int MAX_BRANCH_COUNT = 50;
    public static final int MAX_DEPTH_LIMIT = 100;

    public TraversalConfig normalize(TraversalConfig config) {
        return normalize(config.maxDepth(), config.branchCounts());
    }

    /**
     * @param rawMaxDepth an integer, or a string holding one
     * @param rawNumber   a single count, a collection of counts, or a comma-separated string of counts
     */
    public TraversalConfig normalize(Object rawMaxDepth, Object rawNumber) {
        int maxDepth = toInt(rawMaxDepth, "max_depth");
        if (maxDepth < 0) {
            throw new ScraperConfigException("max_depth must be >= 0 but was " + maxDepth);
        }
        if (maxDepth > MAX_DEPTH_LIMIT) {
            throw new ScraperConfigException("max_depth must be <= " + MAX_DEPTH_LIMIT + " but was " + maxDepth);
        }

        List<Integer> branchCounts = toBranchCounts(rawNumber);
        if (branchCounts.isEmpty()) {
            throw new ScraperConfigException("number must contain at least one branch count");
        }
        for (int count : branchCounts) {
            if (count < 1 || count > MAX_BRANCH_COUNT) {
                throw new ScraperConfigException(
                    "branch counts must be between 1 and " + MAX_BRANCH_COUNT + " but got " + branchCounts
                );
            }
        }
        return new TraversalConfig(maxDepth, branchCounts);
    }

    private List<Integer> toBranchCounts(Object rawNumber) {
        if (rawNumber == null) {
            throw new ScraperConfigException("number is not configured");
        }
        List<Integer> counts = new ArrayList<>();
        if (rawNumber instanceof Collection<?> values) {
            for (Object value : values) {
                counts.add(toInt(value, "number"));
            }
        } else if (rawNumber instanceof int[] values) {
            for (int value : values) {
                counts.add(value);
            }
        } else if (rawNumber instanceof String text && text.contains(",")) {
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    counts.add(toInt(part, "number"));
                }
            }
        } else {
            counts.add(toInt(rawNumber, "number"));
        }
        return counts;
    }

    private int toInt(Object value, String name) {
        if (value instanceof Integer || value instanceof Short) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long longValue) {
            try {
                return Math.toIntExact(longValue);
            } catch (ArithmeticException e) {
                throw new ScraperConfigException(name + " is out of range: " + longValue, e);
            }
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new ScraperConfigException(name + " must be an integer but was '" + text + "'");
            }
        }
        throw new ScraperConfigException(name + " must be an integer but was " + value);
    }
}
