package com.ytscraper.crawl.model;

/**
 * Effective search options after persisted values and command-line overrides have been merged.
 * {@code number} and {@code maxDepth} are kept in their raw shape until the traversal config is normalized.
 */
public record SearchSettings(
    Object number,
    Object maxDepth,
    String apiKey,
    String outputDir,
    String outputFormat,
    String regionCode,
    String langCode,
    String safeSearch,
    String encoding
) {
    public ApiSearchOptions apiOptions() {
        return new ApiSearchOptions(regionCode, langCode, safeSearch);
    }

    public boolean exportsCsv() {
        return outputDir != null && !outputDir.isBlank() && "csv".equalsIgnoreCase(outputFormat);
    }
}
