package com.ytscraper.crawl.youtube;

import com.ytscraper.crawl.model.ApiSearchOptions;
import com.ytscraper.crawl.model.VideoRecord;

import java.util.List;

public interface YoutubeApiClient {
    YoutubeApiHandle authenticate(String apiKey);

    List<VideoRecord> searchVideos(YoutubeApiHandle handle, int count, String query, ApiSearchOptions options);

    List<VideoRecord> videoInfo(YoutubeApiHandle handle, String videoId);

    List<VideoRecord> relatedVideos(YoutubeApiHandle handle, int count, String videoId, ApiSearchOptions options);
}
