package com.ytscraper.crawl.service;

import com.ytscraper.crawl.export.CsvExportService;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class SearchEndToEndTest {
    private static MockWebServer server;

    @TempDir
    Path outputDir;

    @Autowired
    private ScraperCliRunner runner;

    @DynamicPropertySource
    static void youtubeApi(DynamicPropertyRegistry registry) throws IOException {
        server = new MockWebServer();
        server.start();
        registry.add("scraper.api.base-url", () -> server.url("/youtube/v3").toString());
    }

    @AfterAll
    static void tearDown() throws IOException {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void termSearchCrawlsOneLevelAndExportsCsv() throws Exception {
        server.enqueue(json("""
            {"items": [{"id": {"videoId": "S"}, "snippet": {"title": "Seed &amp; Co"}}]}
            """));
        server.enqueue(json("""
            {"items": [
              {"id": {"videoId": "X"}, "snippet": {"title": "Ex"}},
              {"id": {"videoId": "Y"}, "snippet": {"title": "Why"}}
            ]}
            """));

        int exitCode = runner.execute(new DefaultApplicationArguments(
            "search", "term", "cats",
            "--api-key=test-key",
            "--number=2",
            "--max-depth=1",
            "--output-dir=" + outputDir
        ));

        assertThat(exitCode).isZero();
        RecordedRequest seedSearch = server.takeRequest();
        assertThat(seedSearch.getRequestUrl().queryParameter("q")).isEqualTo("cats");
        assertThat(seedSearch.getRequestUrl().queryParameter("maxResults")).isEqualTo("2");
        RecordedRequest related = server.takeRequest();
        assertThat(related.getRequestUrl().queryParameter("relatedToVideoId")).isEqualTo("S");
        assertThat(related.getRequestUrl().queryParameter("key")).isEqualTo("test-key");

        List<String> nodes = Files.readAllLines(outputDir.resolve(CsvExportService.NODES_FILE));
        assertThat(nodes).hasSize(4);
        assertThat(nodes.get(1)).startsWith("S,0,0,X;Y,Seed & Co");
        assertThat(nodes.get(2)).startsWith("X,0,1,");
        assertThat(nodes.get(3)).startsWith("Y,1,1,");
        assertThat(Files.readAllLines(outputDir.resolve(CsvExportService.EDGES_FILE)))
            .containsExactly("source,target,rank", "S,X,0", "S,Y,1");
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
