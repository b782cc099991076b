package com.example.docexport.client;

import com.example.docexport.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("Video Thumbnail Resolver Tests")
public class VideoThumbnailResolverTest {

    private BlobFetcher blobFetcher;
    private VideoThumbnailResolver resolver;

    @BeforeEach
    public void setup() {
        blobFetcher = mock(BlobFetcher.class);
        resolver = new VideoThumbnailResolver(blobFetcher, new ObjectMapper());
    }

    @Test
    @DisplayName("YouTube ids are read from every common link shape")
    public void testYoutubeIds() {
        assertEquals(Optional.of("dQw4w9WgXcQ"), resolver.youtubeId("https://youtu.be/dQw4w9WgXcQ"));
        assertEquals(Optional.of("dQw4w9WgXcQ"), resolver.youtubeId("https://www.youtube.com/watch?v=dQw4w9WgXcQ&t=42"));
        assertEquals(Optional.of("dQw4w9WgXcQ"), resolver.youtubeId("https://www.youtube.com/embed/dQw4w9WgXcQ"));
        assertEquals(Optional.of("dQw4w9WgXcQ"), resolver.youtubeId("https://youtube.com/v/dQw4w9WgXcQ"));
        assertEquals(Optional.empty(), resolver.youtubeId("https://www.youtube.com/channel/abc"));
    }

    @Test
    public void testYoutubeThumbnailNeedsNoLookup() {
        Optional<String> thumbnail = resolver.thumbnailUrl("https://www.youtube.com/watch?v=dQw4w9WgXcQ");

        assertEquals(Optional.of("https://img.youtube.com/vi/dQw4w9WgXcQ/sddefault.jpg"), thumbnail);
        verifyNoInteractions(blobFetcher);
    }

    @Test
    @DisplayName("Vimeo ids are the numeric part of the link")
    public void testVimeoIds() {
        assertEquals(Optional.of("76979871"), resolver.vimeoId("https://vimeo.com/76979871"));
        assertEquals(Optional.of("76979871"), resolver.vimeoId("https://player.vimeo.com/video/76979871?h=1"));
        assertEquals(Optional.of("76979871"), resolver.vimeoId("https://vimeo.com/channels/staffpicks/76979871"));
        assertEquals(Optional.of("76979871"), resolver.vimeoId("https://vimeo.com/album/2222/video/76979871"));
        assertEquals(Optional.empty(), resolver.vimeoId("https://vimeo.com/about"));
    }

    @Test
    public void testVimeoThumbnailComesFromMetadata() {
        when(blobFetcher.get("http://vimeo.com/api/v2/video/76979871.json"))
                .thenReturn("[{\"id\": 76979871, \"thumbnail_large\": \"https://i.vimeocdn.com/video/452001751_640.jpg\"}]"
                        .getBytes(StandardCharsets.UTF_8));

        assertEquals(Optional.of("https://i.vimeocdn.com/video/452001751_640.jpg"),
                resolver.thumbnailUrl("https://vimeo.com/76979871"));
    }

    @Test
    public void testUnreadableVimeoMetadata() {
        when(blobFetcher.get(anyString())).thenReturn("<html>".getBytes(StandardCharsets.UTF_8));

        assertThrows(ExternalServiceException.class, () -> resolver.thumbnailUrl("https://vimeo.com/76979871"));
    }

    @Test
    public void testOtherProvidersHaveNoThumbnail() {
        assertEquals(Optional.empty(), resolver.thumbnailUrl("https://videos.example.com/42"));
        assertEquals(Optional.empty(), resolver.thumbnailUrl(null));
        verifyNoInteractions(blobFetcher);
    }
}
