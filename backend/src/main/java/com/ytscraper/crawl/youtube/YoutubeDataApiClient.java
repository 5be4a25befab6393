package com.ytscraper.crawl.youtube;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ytscraper.config.ScraperProperties;
import com.ytscraper.crawl.model.ApiSearchOptions;
import com.ytscraper.crawl.model.VideoRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
public class YoutubeDataApiClient implements YoutubeApiClient {
    private static final Logger log = LoggerFactory.getLogger(YoutubeDataApiClient.class);
    private static final Set<String> AUTH_REASONS = Set.of("keyinvalid", "keyexpired", "accessnotconfigured");
    private static final List<String> SNIPPET_FIELDS = List.of(
        "title",
        "description",
        "channelId",
        "channelTitle",
        "publishedAt"
    );

    private final ScraperProperties properties;
    private final HttpClient client;
    private final ObjectMapper objectMapper;

    public YoutubeDataApiClient(ScraperProperties properties, HttpClient youtubeHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.client = youtubeHttpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public YoutubeApiHandle authenticate(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ApiAuthenticationException(
                "You need to provide an API key using --api-key or the configuration file "
                    + "in order to query YouTube's API."
            );
        }
        return new YoutubeApiHandle(apiKey.trim());
    }

    @Override
    public List<VideoRecord> searchVideos(YoutubeApiHandle handle, int count, String query, ApiSearchOptions options) {
        Map<String, String> params = searchParams(count, options);
        params.put("q", query == null ? "" : query);
        return parseItems(get("search", params, handle), count);
    }

    @Override
    public List<VideoRecord> videoInfo(YoutubeApiHandle handle, String videoId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("part", "snippet");
        params.put("id", videoId);
        return parseItems(get("videos", params, handle), Integer.MAX_VALUE);
    }

    @Override
    public List<VideoRecord> relatedVideos(YoutubeApiHandle handle, int count, String videoId, ApiSearchOptions options) {
        Map<String, String> params = searchParams(count, options);
        params.put("relatedToVideoId", videoId);
        return parseItems(get("search", params, handle), count);
    }

    private Map<String, String> searchParams(int count, ApiSearchOptions options) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("part", "snippet");
        params.put("type", "video");
        params.put("maxResults", String.valueOf(Math.max(1, count)));
        if (options != null) {
            params.putAll(options.toQueryParameters());
        }
        return params;
    }

    private JsonNode get(String resource, Map<String, String> params, YoutubeApiHandle handle) {
        URI uri = buildUri(resource, params, handle);
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", ScraperProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", "application/json")
            .GET()
            .build();
        log.debug("GET {} {}", resource, params);

        HttpResponse<byte[]> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new YoutubeApiException("timeout", "YouTube API request timed out: " + resource, e);
        } catch (IOException e) {
            throw new YoutubeApiException("io_error", "YouTube API request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new YoutubeApiException("interrupted", "YouTube API request interrupted", e);
        }

        byte[] bytes = response.body();
        String body = bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8);
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw errorFor(status, body);
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new YoutubeApiException("invalid_response", "YouTube API returned an unreadable response", e);
        }
    }

    private RuntimeException errorFor(int status, String body) {
        String reason = null;
        String message = "HTTP " + status;
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            JsonNode first = error.path("errors").path(0);
            reason = textOrNull(first.path("reason"));
            String apiMessage = textOrNull(error.path("message"));
            if (apiMessage != null) {
                message = apiMessage;
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Could not parse error body for HTTP {}", status, e);
        }

        String normalizedReason = reason == null ? "" : reason.toLowerCase(Locale.ROOT);
        boolean invalidKey = message.toLowerCase(Locale.ROOT).contains("api key not valid");
        if (AUTH_REASONS.contains(normalizedReason) || invalidKey) {
            return new ApiAuthenticationException("YouTube rejected the API key: " + message);
        }
        return new YoutubeApiException(status, reason, "YouTube API call failed (" + status + "): " + message);
    }

    private List<VideoRecord> parseItems(JsonNode root, int limit) {
        List<VideoRecord> videos = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            if (videos.size() >= limit) {
                break;
            }
            String videoId = videoIdOf(item);
            if (videoId == null) {
                continue;
            }
            JsonNode snippet = item.path("snippet");
            Map<String, String> attributes = new LinkedHashMap<>();
            for (String field : SNIPPET_FIELDS) {
                attributes.put(field, textOrNull(snippet.path(field)));
            }
            videos.add(new VideoRecord(videoId, attributes));
        }
        return videos;
    }

    // search results nest the id as {"kind": ..., "videoId": ...}; the videos resource uses a plain string
    private String videoIdOf(JsonNode item) {
        JsonNode id = item.path("id");
        if (id.isTextual()) {
            return blankToNull(id.asText());
        }
        return textOrNull(id.path("videoId"));
    }

    private URI buildUri(String resource, Map<String, String> params, YoutubeApiHandle handle) {
        StringBuilder url = new StringBuilder(properties.getApi().getBaseUrl())
            .append('/')
            .append(resource)
            .append('?');
        Map<String, String> all = new LinkedHashMap<>(params);
        all.put("key", handle.apiKey());
        boolean first = true;
        for (Map.Entry<String, String> entry : all.entrySet()) {
            if (!first) {
                url.append('&');
            }
            first = false;
            url.append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
        }
        return URI.create(url.toString());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return blankToNull(node.asText());
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value;
    }
}
