package com.ytscraper.crawl.service;

import com.ytscraper.crawl.model.CrawlContext;
import com.ytscraper.crawl.model.CrawlResult;
import com.ytscraper.crawl.model.SearchMode;
import com.ytscraper.crawl.model.SearchRequest;
import com.ytscraper.crawl.model.SearchSettings;
import com.ytscraper.crawl.options.ScraperConfigService;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * {@code search [term|url|id] <query> [options]}. The mode defaults to {@code term}.
 */
@Component
public class SearchCommand {
    private final ScraperConfigService configService;
    private final CrawlOrchestratorService orchestratorService;

    public SearchCommand(ScraperConfigService configService, CrawlOrchestratorService orchestratorService) {
        this.configService = configService;
        this.orchestratorService = orchestratorService;
    }

    int execute(CommandLineOptions options, PrintStream out) {
        List<String> words = options.words();
        SearchMode mode;
        String query;
        if (words.size() == 2) {
            if (isModeName(words.get(1))) {
                throw new InvalidInputException(
                    "Missing search query after '" + words.get(1) + "'. Usage: search [term|url|id] <query>"
                );
            }
            mode = SearchMode.TERM;
            query = words.get(1);
        } else if (words.size() == 3) {
            mode = SearchMode.fromRaw(words.get(1));
            query = words.get(2);
        } else if (words.size() < 2) {
            throw new InvalidInputException("Missing search query. Usage: search [term|url|id] <query>");
        } else {
            throw new InvalidInputException("Too many arguments for search; quote multi-word queries.");
        }

        CrawlContext context = new CrawlContext(options.verbose());
        SearchSettings settings = configService.effectiveSettings(options.overrides(), context);
        CrawlResult result = orchestratorService.run(new SearchRequest(mode, query, settings, context));

        if (result.rendering() != null) {
            out.print(result.rendering());
        }
        if (result.exportDirectory() != null) {
            out.println("Exported " + result.nodes().size() + " videos to: " + result.exportDirectory());
        }
        return 0;
    }

    private static boolean isModeName(String word) {
        for (SearchMode mode : SearchMode.values()) {
            if (mode.name().equalsIgnoreCase(word.trim())) {
                return true;
            }
        }
        return false;
    }
}
