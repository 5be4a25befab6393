package com.ytscraper.crawl.traversal;

import com.ytscraper.crawl.options.ScraperConfigException;

import java.util.List;

/**
 * Resolves how many related videos to request for an item at a given depth.
 *
 * <p>The depth indexes into the configured schedule and is clamped to the nearest valid index: levels past the
 * end of the schedule reuse its last entry and a negative depth uses the first. Out-of-range depths are not an
 * error, so "10 at level 0, 3 thereafter" is written as {@code [10, 3]}.
 */
public final class BranchingPolicy {
    private final List<Integer> branchCounts;

    private BranchingPolicy(List<Integer> branchCounts) {
        this.branchCounts = branchCounts;
    }

    /**
     * Validates the schedule once; {@link #childrenAt(int)} does no further checks.
     */
    public static BranchingPolicy of(List<Integer> branchCounts) {
        if (branchCounts == null || branchCounts.isEmpty()) {
            throw new ScraperConfigException("branch count schedule must not be empty");
        }
        return new BranchingPolicy(List.copyOf(branchCounts));
    }

    public int childrenAt(int depth) {
        int index = Math.max(0, Math.min(depth, branchCounts.size() - 1));
        return branchCounts.get(index);
    }
}
