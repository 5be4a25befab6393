package com.ytscraper.crawl.options;

import com.ytscraper.config.ScraperProperties;
import com.ytscraper.crawl.model.CrawlContext;
import com.ytscraper.crawl.model.SearchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads, merges and mutates the persisted option mapping.
 */
@Service
public class ScraperConfigService {
    private static final Logger log = LoggerFactory.getLogger(ScraperConfigService.class);

    private final ScraperProperties properties;
    private final ScraperConfigFile configFile;

    public ScraperConfigService(ScraperProperties properties, ScraperConfigFile configFile) {
        this.properties = properties;
        this.configFile = configFile;
    }

    public Path configPath() {
        return properties.resolveConfigFile();
    }

    public Map<String, Object> load() {
        return configFile.load(configPath());
    }

    public Optional<Object> get(ConfigOption option) {
        return Optional.ofNullable(load().get(option.key()));
    }

    public Map<String, Object> set(ConfigOption option, String rawValue, CrawlContext context) {
        Object value = option.convert(rawValue);
        Map<String, Object> mapping = load();
        mapping.put(option.key(), value);
        persist(mapping, context);
        return mapping;
    }

    public Map<String, Object> unset(ConfigOption option, CrawlContext context) {
        Map<String, Object> mapping = load();
        mapping.remove(option.key());
        persist(mapping, context);
        return mapping;
    }

    public void clear(CrawlContext context) {
        persist(new LinkedHashMap<>(), context);
    }

    /**
     * Defaults, then persisted values, then {@code overrides}. An override only counts when it was actually
     * given: null, blank strings and empty collections leave the lower layer in place.
     */
    public SearchSettings effectiveSettings(Map<ConfigOption, Object> overrides, CrawlContext context) {
        Level level = context.verbose() ? Level.INFO : Level.DEBUG;
        Map<String, Object> persisted = load();
        Map<ConfigOption, Object> merged = new LinkedHashMap<>();
        for (ConfigOption option : ConfigOption.values()) {
            merged.put(option, option.defaultValue());
            Object stored = persisted.get(option.key());
            if (stored != null) {
                if (!option.accepts(stored)) {
                    throw new ScraperConfigException(
                        "Configuration file " + configPath() + " holds an invalid value for "
                            + option.key() + ": " + stored
                    );
                }
                merged.put(option, stored);
            }
            Object override = overrides == null ? null : overrides.get(option);
            if (isProvided(override)) {
                merged.put(option, override);
            }
        }
        Map<String, Object> byKey = new LinkedHashMap<>();
        merged.forEach((option, value) -> byKey.put(option.key(), value));
        log.atLevel(level).log("Working with the following configuration: {}", redacted(byKey));

        return new SearchSettings(
            merged.get(ConfigOption.NUMBER),
            merged.get(ConfigOption.MAX_DEPTH),
            (String) merged.get(ConfigOption.API_KEY),
            (String) merged.get(ConfigOption.OUTPUT_DIR),
            (String) merged.get(ConfigOption.OUTPUT_FORMAT),
            (String) merged.get(ConfigOption.REGION_CODE),
            (String) merged.get(ConfigOption.LANG_CODE),
            (String) merged.get(ConfigOption.SAFE_SEARCH),
            (String) merged.get(ConfigOption.ENCODING)
        );
    }

    private void persist(Map<String, Object> mapping, CrawlContext context) {
        configFile.write(configPath(), mapping);
        log.atLevel(context.verbose() ? Level.INFO : Level.DEBUG)
            .log("The new configuration file {} is: {}", configPath(), redacted(mapping));
    }

    private static boolean isProvided(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Collection<?> values) {
            return !values.isEmpty();
        }
        return true;
    }

    private static Map<String, Object> redacted(Map<String, Object> mapping) {
        Map<String, Object> out = new LinkedHashMap<>(mapping);
        if (isProvided(out.get(ConfigOption.API_KEY.key()))) {
            out.put(ConfigOption.API_KEY.key(), "***");
        }
        return out;
    }
}
