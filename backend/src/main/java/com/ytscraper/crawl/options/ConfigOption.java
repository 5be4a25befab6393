package com.ytscraper.crawl.options;

import java.util.Locale;
import java.util.Set;

/**
 * Options that can be persisted in the config file and overridden on the command line.
 */
public enum ConfigOption {
    NUMBER("number", OptionType.INTEGER_LIST, 10),
    MAX_DEPTH("max_depth", OptionType.INTEGER, 1),
    API_KEY("api_key", OptionType.STRING, ""),
    OUTPUT_DIR("output_dir", OptionType.STRING, ""),
    OUTPUT_FORMAT("output_format", OptionType.CHOICE, "csv", "csv"),
    REGION_CODE("region_code", OptionType.STRING, ""),
    LANG_CODE("lang_code", OptionType.STRING, ""),
    SAFE_SEARCH("safe_search", OptionType.CHOICE, "none", "none", "moderate", "strict"),
    ENCODING("encoding", OptionType.CHOICE, "utf-8", "ascii", "utf-8", "smart");

    private final String key;
    private final OptionType type;
    private final Object defaultValue;
    private final Set<String> choices;

    ConfigOption(String key, OptionType type, Object defaultValue, String... choices) {
        this.key = key;
        this.type = type;
        this.defaultValue = defaultValue;
        this.choices = Set.of(choices);
    }

    public String key() {
        return key;
    }

    public OptionType type() {
        return type;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    public Set<String> choices() {
        return choices;
    }

    public Object convert(String raw) {
        return type.convert(key, raw, choices);
    }

    public boolean accepts(Object value) {
        return type.accepts(value, choices);
    }

    /**
     * Accepts both the persisted key ({@code max_depth}) and its command-line spelling ({@code max-depth}).
     */
    public static ConfigOption fromKey(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (ConfigOption option : values()) {
                if (option.key.equals(normalized)) {
                    return option;
                }
            }
        }
        throw new ScraperConfigException("Unknown option '" + raw + "'. Known options: " + knownKeys());
    }

    private static String knownKeys() {
        StringBuilder out = new StringBuilder();
        for (ConfigOption option : values()) {
            if (out.length() > 0) {
                out.append(", ");
            }
            out.append(option.key);
        }
        return out.toString();
    }
}
