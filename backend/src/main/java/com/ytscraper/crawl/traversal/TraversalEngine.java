package com.ytscraper.crawl.traversal;

import com.ytscraper.crawl.model.CrawlContext;
import com.ytscraper.crawl.model.CrawlNode;
import com.ytscraper.crawl.model.TraversalConfig;
import com.ytscraper.crawl.model.VideoRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Level-order walk over the related-videos relation.
 *
 * <p>Nodes are emitted in visitation order, so every node of depth {@code d} precedes every node of depth
 * {@code d + 1}. Nodes at {@code maxDepth} are emitted with no related ids and never expanded. Each expanded
 * node costs exactly one fetcher call; a failing call is not caught and aborts the walk. Items reached through
 * several parents are visited once per parent.
 */
@Component
public class TraversalEngine {
    private static final Logger log = LoggerFactory.getLogger(TraversalEngine.class);

    public List<CrawlNode> traverse(
        List<CrawlNode> seeds,
        TraversalConfig config,
        RelatedVideoFetcher fetcher,
        CrawlContext context
    ) {
        List<CrawlNode> output = new ArrayList<>();
        traverseInto(seeds, config, fetcher, context, output);
        return output;
    }

    /**
     * Same as {@link #traverse} but appends to a caller-owned list, which keeps the nodes emitted so far when the
     * fetcher throws. A node is appended before its related videos are fetched, so the node whose fetch failed is
     * the last entry and has no related ids.
     */
    public void traverseInto(
        List<CrawlNode> seeds,
        TraversalConfig config,
        RelatedVideoFetcher fetcher,
        CrawlContext context,
        List<CrawlNode> output
    ) {
        BranchingPolicy branching = BranchingPolicy.of(config.branchCounts());
        Level progressLevel = context.verbose() ? Level.INFO : Level.DEBUG;

        Deque<CrawlNode> queue = new ArrayDeque<>(seeds);
        while (!queue.isEmpty()) {
            CrawlNode node = queue.pollFirst();
            log.atLevel(progressLevel).log("Processing video {} (Depth: {}).", node.videoId(), node.depth());

            int position = output.size();
            output.add(node.withRelatedVideoIds(List.of()));
            if (node.depth() >= config.maxDepth()) {
                continue;
            }

            int count = branching.childrenAt(node.depth());
            List<VideoRecord> related = fetcher.fetchRelated(node.videoId(), count);
            List<String> relatedIds = new ArrayList<>(related.size());
            List<CrawlNode> children = new ArrayList<>(related.size());
            for (int rank = 0; rank < related.size(); rank++) {
                VideoRecord video = related.get(rank);
                relatedIds.add(video.videoId());
                children.add(CrawlNode.of(video, rank, node.depth() + 1));
            }
            output.set(position, node.withRelatedVideoIds(relatedIds));
            queue.addAll(children);
        }
        log.atLevel(progressLevel).log("Traversal finished with {} videos.", output.size());
    }
}
