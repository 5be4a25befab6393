package com.ytscraper.crawl.options;

import com.ytscraper.crawl.ScraperException;

public class ScraperConfigException extends ScraperException {
    public ScraperConfigException(String message) {
        super(message);
    }

    public ScraperConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitCode() {
        return 2;
    }
}
