package com.ytscraper.crawl.traversal;

import com.ytscraper.crawl.model.VideoRecord;

import java.util.List;

/**
 * Returns at most {@code count} videos related to {@code videoId}, in API order. Failures are thrown and end the
 * traversal.
 */
@FunctionalInterface
public interface RelatedVideoFetcher {
    List<VideoRecord> fetchRelated(String videoId, int count);
}
