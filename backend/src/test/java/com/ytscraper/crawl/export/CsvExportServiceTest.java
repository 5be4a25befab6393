package com.ytscraper.crawl.export;

import com.ytscraper.crawl.model.CrawlNode;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvExportServiceTest {

    @TempDir
    Path tempDir;

    private final CsvExportService exporter = new CsvExportService();

    @Test
    void writesNodesInTraversalOrderWithAttributeColumns() throws Exception {
        Path out = exporter.export(sampleNodes(), tempDir.resolve("run"));

        List<CSVRecord> records = read(out.resolve(CsvExportService.NODES_FILE));
        assertThat(records).hasSize(3);
        assertThat(records.get(0).getParser().getHeaderNames())
            .containsExactly("videoId", "rank", "depth", "relatedVideos", "title", "channelTitle");
        assertThat(records.get(0).get("videoId")).isEqualTo("S");
        assertThat(records.get(0).get("relatedVideos")).isEqualTo("X;Y");
        assertThat(records.get(0).get("title")).isEqualTo("Seed, with \"quotes\"");
        assertThat(records.get(2).get("rank")).isEqualTo("1");
        assertThat(records.get(2).get("depth")).isEqualTo("1");
        assertThat(records.get(2).get("relatedVideos")).isEmpty();
        assertThat(records.get(1).get("channelTitle")).isEmpty();
    }

    @Test
    void writesOneEdgePerRelatedLink() throws Exception {
        Path out = exporter.export(sampleNodes(), tempDir);

        List<CSVRecord> edges = read(out.resolve(CsvExportService.EDGES_FILE));
        assertThat(edges).hasSize(2);
        assertThat(edges.get(0).get("source")).isEqualTo("S");
        assertThat(edges.get(0).get("target")).isEqualTo("X");
        assertThat(edges.get(0).get("rank")).isEqualTo("0");
        assertThat(edges.get(1).get("target")).isEqualTo("Y");
        assertThat(edges.get(1).get("rank")).isEqualTo("1");
    }

    @Test
    void emptyTraversalStillWritesHeaders() throws Exception {
        Path out = exporter.export(List.of(), tempDir.resolve("empty"));

        assertThat(Files.readAllLines(out.resolve(CsvExportService.NODES_FILE)))
            .containsExactly("videoId,rank,depth,relatedVideos");
        assertThat(Files.readAllLines(out.resolve(CsvExportService.EDGES_FILE)))
            .containsExactly("source,target,rank");
    }

    @Test
    void unwritableTargetIsAnExportError() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThatThrownBy(() -> exporter.export(sampleNodes(), blocker.resolve("out")))
            .isInstanceOfSatisfying(ExportException.class, e -> assertThat(e.exitCode()).isEqualTo(5));
    }

    private static List<CrawlNode> sampleNodes() {
        Map<String, String> seedAttributes = new LinkedHashMap<>();
        seedAttributes.put("title", "Seed, with \"quotes\"");
        seedAttributes.put("channelTitle", "Chan");
        Map<String, String> childAttributes = new LinkedHashMap<>();
        childAttributes.put("title", "Child");
        childAttributes.put("channelTitle", null);
        return List.of(
            new CrawlNode("S", 0, 0, List.of("X", "Y"), seedAttributes),
            new CrawlNode("X", 0, 1, List.of(), childAttributes),
            new CrawlNode("Y", 1, 1, List.of(), Map.of("title", "Other"))
        );
    }

    private static List<CSVRecord> read(Path file) throws Exception {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            return parser.getRecords();
        }
    }
}
