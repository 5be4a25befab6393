package com.ytscraper.crawl.youtube;

import com.ytscraper.crawl.ScraperException;

/**
 * A call to the YouTube Data API failed. {@code statusCode} is 0 when no HTTP response was received.
 */
public class YoutubeApiException extends ScraperException {
    private final int statusCode;
    private final String reason;

    public YoutubeApiException(int statusCode, String reason, String message) {
        super(message);
        this.statusCode = statusCode;
        this.reason = reason;
    }

    public YoutubeApiException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.reason = reason;
    }

    public int statusCode() {
        return statusCode;
    }

    public String reason() {
        return reason;
    }

    @Override
    public int exitCode() {
        return 4;
    }
}
