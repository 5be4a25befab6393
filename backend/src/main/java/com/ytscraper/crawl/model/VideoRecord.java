package com.ytscraper.crawl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A video as returned by the API, before it is placed in a traversal.
 */
public record VideoRecord(String videoId, Map<String, String> attributes) {
    public VideoRecord {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String title() {
        return attributes.get("title");
    }
}
