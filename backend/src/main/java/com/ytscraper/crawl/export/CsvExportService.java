package com.ytscraper.crawl.export;

import com.ytscraper.crawl.model.CrawlNode;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes a traversal as two CSV files: {@code nodes.csv} with one record per visited video in traversal order,
 * and {@code edges.csv} with one record per parent to related-video link.
 */
@Service
public class CsvExportService {
    private static final Logger log = LoggerFactory.getLogger(CsvExportService.class);

    public static final String NODES_FILE = "nodes.csv";
    public static final String EDGES_FILE = "edges.csv";
    private static final List<String> NODE_COLUMNS = List.of("videoId", "rank", "depth", "relatedVideos");
    private static final List<String> EDGE_COLUMNS = List.of("source", "target", "rank");

    public Path export(List<CrawlNode> nodes, Path directory) {
        try {
            Files.createDirectories(directory);
            writeNodes(nodes, directory.resolve(NODES_FILE));
            writeEdges(nodes, directory.resolve(EDGES_FILE));
        } catch (IOException e) {
            throw new ExportException("Could not export results to " + directory + ": " + e.getMessage(), e);
        }
        log.debug("Exported {} videos to {}", nodes.size(), directory);
        return directory;
    }

    private void writeNodes(List<CrawlNode> nodes, Path file) throws IOException {
        List<String> attributeColumns = attributeColumns(nodes);
        List<String> header = new ArrayList<>(NODE_COLUMNS);
        header.addAll(attributeColumns);

        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = csvFormat(header).print(writer)) {
            for (CrawlNode node : nodes) {
                List<Object> record = new ArrayList<>(header.size());
                record.add(node.videoId());
                record.add(node.rank());
                record.add(node.depth());
                record.add(String.join(";", node.relatedVideoIds()));
                for (String column : attributeColumns) {
                    record.add(node.attributes().get(column));
                }
                printer.printRecord(record);
            }
        }
    }

    private void writeEdges(List<CrawlNode> nodes, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = csvFormat(EDGE_COLUMNS).print(writer)) {
            for (CrawlNode node : nodes) {
                List<String> related = node.relatedVideoIds();
                for (int rank = 0; rank < related.size(); rank++) {
                    printer.printRecord(node.videoId(), related.get(rank), rank);
                }
            }
        }
    }

    private List<String> attributeColumns(List<CrawlNode> nodes) {
        Set<String> columns = new LinkedHashSet<>();
        for (CrawlNode node : nodes) {
            columns.addAll(node.attributes().keySet());
        }
        columns.removeAll(NODE_COLUMNS);
        return new ArrayList<>(columns);
    }

    private CSVFormat csvFormat(List<String> header) {
        return CSVFormat.DEFAULT.builder()
            .setHeader(header.toArray(String[]::new))
            .setNullString("")
            .build();
    }
}
