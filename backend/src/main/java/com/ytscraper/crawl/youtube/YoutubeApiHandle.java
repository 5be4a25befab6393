package com.ytscraper.crawl.youtube;

/**
 * Authenticated access to the YouTube Data API.
 */
public record YoutubeApiHandle(String apiKey) {
    @Override
    public String toString() {
        return "YoutubeApiHandle[apiKey=***]";
    }
}
