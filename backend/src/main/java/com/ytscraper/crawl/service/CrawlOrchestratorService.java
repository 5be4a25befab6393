package com.ytscraper.crawl.service;

import com.ytscraper.crawl.export.CrawlTreeRenderer;
import com.ytscraper.crawl.export.CsvExportService;
import com.ytscraper.crawl.model.ApiSearchOptions;
import com.ytscraper.crawl.model.CrawlContext;
import com.ytscraper.crawl.model.CrawlNode;
import com.ytscraper.crawl.model.CrawlResult;
import com.ytscraper.crawl.model.SearchRequest;
import com.ytscraper.crawl.model.SearchSettings;
import com.ytscraper.crawl.model.TraversalConfig;
import com.ytscraper.crawl.model.VideoRecord;
import com.ytscraper.crawl.text.TextEncoding;
import com.ytscraper.crawl.text.TextNormalizer;
import com.ytscraper.crawl.traversal.TraversalConfigValidator;
import com.ytscraper.crawl.traversal.TraversalEngine;
import com.ytscraper.crawl.youtube.YoutubeApiClient;
import com.ytscraper.crawl.youtube.YoutubeApiHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one search: validates the traversal bounds, authenticates, resolves the seed videos, walks the
 * related-videos graph and hands the normalized result to export or rendering.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);
    private static final String VIDEO_ID_PARAMETER = "v";

    private final YoutubeApiClient apiClient;
    private final TraversalConfigValidator configValidator;
    private final TraversalEngine traversalEngine;
    private final TextNormalizer textNormalizer;
    private final CsvExportService exportService;
    private final CrawlTreeRenderer treeRenderer;

    public CrawlOrchestratorService(
        YoutubeApiClient apiClient,
        TraversalConfigValidator configValidator,
        TraversalEngine traversalEngine,
        TextNormalizer textNormalizer,
        CsvExportService exportService,
        CrawlTreeRenderer treeRenderer
    ) {
        this.apiClient = apiClient;
        this.configValidator = configValidator;
        this.traversalEngine = traversalEngine;
        this.textNormalizer = textNormalizer;
        this.exportService = exportService;
        this.treeRenderer = treeRenderer;
    }

    public CrawlResult run(SearchRequest request) {
        SearchSettings settings = request.settings();
        CrawlContext context = request.context();
        Level level = context.verbose() ? Level.INFO : Level.DEBUG;

        TraversalConfig config = configValidator.normalize(settings.maxDepth(), settings.number());
        TextEncoding encoding = TextEncoding.fromOption(settings.encoding());
        ApiSearchOptions apiOptions = settings.apiOptions();

        log.atLevel(level).log("Starting YouTube authentication.");
        YoutubeApiHandle handle = apiClient.authenticate(settings.apiKey());
        log.atLevel(level).log("API access established.");

        log.atLevel(level).log("Starting search using query {}.", request.query());
        List<VideoRecord> seedVideos = resolveSeeds(request, handle, config, apiOptions);
        List<CrawlNode> seeds = new ArrayList<>(seedVideos.size());
        for (int rank = 0; rank < seedVideos.size(); rank++) {
            seeds.add(CrawlNode.of(seedVideos.get(rank), rank, 0));
        }

        List<CrawlNode> visited = traversalEngine.traverse(
            seeds,
            config,
            (videoId, count) -> apiClient.relatedVideos(handle, count, videoId, apiOptions),
            context
        );

        List<CrawlNode> nodes = new ArrayList<>(visited.size());
        for (CrawlNode node : visited) {
            nodes.add(node.mapStrings(text -> textNormalizer.normalize(text, encoding)));
        }

        Path exportDirectory = null;
        if (settings.exportsCsv()) {
            log.atLevel(level).log("Query finished! Start exporting files!");
            exportDirectory = exportService.export(nodes, Paths.get(settings.outputDir()));
            log.atLevel(level).log("Exported results to: {}", exportDirectory);
        }

        String rendering = null;
        if (exportDirectory == null || context.verbose()) {
            rendering = treeRenderer.render(nodes);
        }
        return new CrawlResult(nodes, exportDirectory, rendering);
    }

    private List<VideoRecord> resolveSeeds(
        SearchRequest request,
        YoutubeApiHandle handle,
        TraversalConfig config,
        ApiSearchOptions apiOptions
    ) {
        String query = request.query();
        if (query == null || query.isBlank()) {
            throw new InvalidInputException("A search query is required.");
        }
        return switch (request.mode()) {
            case TERM -> apiClient.searchVideos(handle, config.branchCounts().get(0), query, apiOptions);
            case ID -> apiClient.videoInfo(handle, query.trim());
            case URL -> apiClient.videoInfo(handle, videoIdFromUrl(query));
        };
    }

    static String videoIdFromUrl(String url) {
        String rawQuery;
        try {
            rawQuery = new URI(url.trim()).getRawQuery();
        } catch (URISyntaxException e) {
            throw new InvalidInputException("Could not parse URL '" + url + "': " + e.getMessage());
        }
        if (rawQuery != null) {
            for (String pair : rawQuery.split("&")) {
                int eq = pair.indexOf('=');
                String name = eq < 0 ? pair : pair.substring(0, eq);
                if (!VIDEO_ID_PARAMETER.equals(decode(name))) {
                    continue;
                }
                String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
                if (!value.isBlank()) {
                    return value;
                }
            }
        }
        throw new InvalidInputException(
            "URL '" + url + "' has no '" + VIDEO_ID_PARAMETER + "' query parameter with a video id."
        );
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
