package com.ytscraper.crawl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * One visited video in a traversal. {@code rank} is the position among the siblings returned for the same
 * parent (or among the seeds), {@code depth} the BFS level.
 */
public record CrawlNode(
    String videoId,
    int rank,
    int depth,
    List<String> relatedVideoIds,
    Map<String, String> attributes
) {
    public CrawlNode {
        relatedVideoIds = relatedVideoIds == null ? List.of() : List.copyOf(relatedVideoIds);
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static CrawlNode of(VideoRecord video, int rank, int depth) {
        return new CrawlNode(video.videoId(), rank, depth, List.of(), video.attributes());
    }

    public CrawlNode withRelatedVideoIds(List<String> ids) {
        return new CrawlNode(videoId, rank, depth, ids, attributes);
    }

    /**
     * Applies {@code fn} to every string-valued field: the id and each attribute value.
     */
    public CrawlNode mapStrings(UnaryOperator<String> fn) {
        Map<String, String> mapped = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            mapped.put(entry.getKey(), entry.getValue() == null ? null : fn.apply(entry.getValue()));
        }
        return new CrawlNode(videoId == null ? null : fn.apply(videoId), rank, depth, relatedVideoIds, mapped);
    }

    public String title() {
        return attributes.get("title");
    }
}
