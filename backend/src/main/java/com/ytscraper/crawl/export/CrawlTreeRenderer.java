package com.ytscraper.crawl.export;

import com.ytscraper.crawl.model.CrawlNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plain-text view of a traversal, each node indented four spaces per depth level.
 */
@Component
public class CrawlTreeRenderer {
    private static final String INDENT = "    ";
    private static final String DETAIL_INDENT = "           ";

    public String render(List<CrawlNode> nodes) {
        StringBuilder out = new StringBuilder();
        out.append("Result:").append(System.lineSeparator());
        for (CrawlNode node : nodes) {
            String indent = INDENT.repeat(Math.max(0, node.depth()));
            line(out, indent + "Depth: " + node.depth() + ", Rank: " + node.rank() + ", ID: " + node.videoId());
            line(out, indent + DETAIL_INDENT + "Title: " + node.title());
            line(out, indent + DETAIL_INDENT + "Related Videos: " + node.relatedVideoIds());
        }
        return out.toString();
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append(System.lineSeparator());
    }
}
