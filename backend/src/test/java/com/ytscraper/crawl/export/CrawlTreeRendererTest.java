package com.ytscraper.crawl.export;

import com.ytscraper.crawl.model.CrawlNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlTreeRendererTest {

    @Test
    void indentsEachNodeByDepth() {
        String nl = System.lineSeparator();
        List<CrawlNode> nodes = List.of(
            new CrawlNode("S", 0, 0, List.of("X"), Map.of("title", "Seed")),
            new CrawlNode("X", 0, 1, List.of(), Map.of("title", "Child"))
        );

        String rendered = new CrawlTreeRenderer().render(nodes);

        assertThat(rendered).isEqualTo(
            "Result:" + nl
                + "Depth: 0, Rank: 0, ID: S" + nl
                + "           Title: Seed" + nl
                + "           Related Videos: [X]" + nl
                + "    Depth: 1, Rank: 0, ID: X" + nl
                + "               Title: Child" + nl
                + "               Related Videos: []" + nl
        );
    }

    @Test
    void emptyResultRendersOnlyTheHeading() {
        assertThat(new CrawlTreeRenderer().render(List.of())).isEqualTo("Result:" + System.lineSeparator());
    }
}
