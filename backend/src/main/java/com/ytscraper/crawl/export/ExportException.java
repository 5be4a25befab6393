package com.ytscraper.crawl.export;

import com.ytscraper.crawl.ScraperException;

public class ExportException extends ScraperException {
    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitCode() {
        return 5;
    }
}
