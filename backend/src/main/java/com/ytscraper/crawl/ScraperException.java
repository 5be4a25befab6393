package com.ytscraper.crawl;

/**
 * Base type for failures that end a command with a user-facing message.
 * Each subtype maps to its own process exit code.
 */
public abstract class ScraperException extends RuntimeException {
    protected ScraperException(String message) {
        super(message);
    }

    protected ScraperException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract int exitCode();
}
