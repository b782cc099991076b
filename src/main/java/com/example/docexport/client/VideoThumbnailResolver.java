package com.example.docexport.client;

import com.example.docexport.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a still image for YouTube and Vimeo links. Other providers have no
 * thumbnail.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VideoThumbnailResolver {

    private static final Pattern VIMEO = Pattern.compile(
            "https?://(?:www\\.|player\\.)?vimeo.com/(?:channels/(?:\\w+/)?|groups/([^/]*)/videos/|album/(\\d+)/video/|video/|)(\\d+)(?:$|/|\\?)");

    private static final String YOUTUBE_THUMBNAIL = "https://img.youtube.com/vi/%s/sddefault.jpg";
    private static final String VIMEO_METADATA = "http://vimeo.com/api/v2/video/%s.json";

    private final BlobFetcher blobFetcher;
    private final ObjectMapper objectMapper;

    /**
     * @throws ExternalServiceException when the Vimeo metadata lookup fails
     */
    public Optional<String> thumbnailUrl(String videoUrl) {
        if (videoUrl == null) {
            return Optional.empty();
        }
        if (videoUrl.contains("youtu")) {
            return youtubeId(videoUrl).map(id -> String.format(YOUTUBE_THUMBNAIL, id));
        }
        if (videoUrl.contains("vimeo")) {
            Optional<String> id = vimeoId(videoUrl);
            if (id.isPresent()) {
                return vimeoThumbnail(id.get());
            }
        }
        return Optional.empty();
    }

    /**
     * Supports youtu.be/ID, /watch?v=ID, /embed/ID and /v/ID links
     */
    public Optional<String> youtubeId(String url) {
        UriComponents uri;
        try {
            uri = UriComponentsBuilder.fromUriString(url).build();
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable video URL {}", url);
            return Optional.empty();
        }
        String host = uri.getHost();
        String path = uri.getPath() == null ? "" : uri.getPath();
        if ("youtu.be".equals(host)) {
            return nonEmpty(path.length() > 1 ? path.substring(1) : "");
        }
        if ("www.youtube.com".equals(host) || "youtube.com".equals(host)) {
            if ("/watch".equals(path)) {
                return nonEmpty(uri.getQueryParams().getFirst("v"));
            }
            if (path.startsWith("/embed/") || path.startsWith("/v/")) {
                String[] segments = path.split("/");
                return segments.length > 2 ? nonEmpty(segments[2]) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<String> vimeoId(String url) {
        Matcher matcher = VIMEO.matcher(url);
        if (!matcher.find()) {
            return Optional.empty();
        }
        // group 3 is the numeric video id; 1 and 2 are group/album names
        return nonEmpty(matcher.group(3));
    }

    private Optional<String> vimeoThumbnail(String id) {
        byte[] metadata = blobFetcher.get(String.format(VIMEO_METADATA, id));
        try {
            JsonNode root = objectMapper.readTree(metadata);
            JsonNode first = root.isArray() && root.size() > 0 ? root.get(0) : root;
            return nonEmpty(first.path("thumbnail_large").asText(null));
        } catch (IOException e) {
            throw new ExternalServiceException("Unreadable Vimeo metadata for video " + id, e);
        }
    }

    private static Optional<String> nonEmpty(String value) {
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
