package com.ytscraper.crawl.options;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON file holding the persisted option mapping. A missing or empty file reads as an empty mapping.
 */
@Service
public class ScraperConfigFile {
    private static final Logger log = LoggerFactory.getLogger(ScraperConfigFile.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAPPING = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ScraperConfigFile(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> load(Path path) {
        if (!Files.exists(path)) {
            log.debug("No configuration file at {}", path);
            return new LinkedHashMap<>();
        }
        try {
            if (Files.size(path) == 0) {
                return new LinkedHashMap<>();
            }
            Map<String, Object> loaded = objectMapper.readValue(path.toFile(), MAPPING);
            return loaded == null ? new LinkedHashMap<>() : loaded;
        } catch (IOException e) {
            throw new ScraperConfigException("Could not read configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Replaces the file contents through a temporary sibling so readers never observe a partial write.
     */
    public void write(Path path, Map<String, Object> mapping) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), mapping);
                moveIntoPlace(temp, path);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new ScraperConfigException("Could not write configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
