package com.ytscraper.crawl.service;

import com.ytscraper.crawl.ScraperException;

public class InvalidInputException extends ScraperException {
    public InvalidInputException(String message) {
        super(message);
    }

    @Override
    public int exitCode() {
        return 2;
    }
}
