package com.ytscraper.crawl.youtube;

import com.ytscraper.crawl.ScraperException;

public class ApiAuthenticationException extends ScraperException {
    public ApiAuthenticationException(String message) {
        super(message);
    }

    @Override
    public int exitCode() {
        return 3;
    }
}
