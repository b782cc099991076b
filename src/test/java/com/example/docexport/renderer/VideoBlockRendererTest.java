package com.example.docexport.renderer;

import com.example.docexport.client.VideoThumbnailResolver;
import com.example.docexport.core.RenderContext;
import com.example.docexport.exception.ExternalServiceException;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.model.ErrorCategory;
import com.example.docexport.service.PictureInserter;
import com.example.docexport.util.DocxStyles;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class VideoBlockRendererTest {

    private static final String SRC = "https://www.youtube.com/watch?v=dQw4w9WgXcQ";
    private static final String THUMBNAIL = "https://img.youtube.com/vi/dQw4w9WgXcQ/sddefault.jpg";

    private VideoThumbnailResolver thumbnailResolver;
    private PictureInserter pictureInserter;
    private VideoBlockRenderer renderer;

    @BeforeEach
    public void setup() {
        thumbnailResolver = mock(VideoThumbnailResolver.class);
        pictureInserter = mock(PictureInserter.class);
        renderer = new VideoBlockRenderer(thumbnailResolver, pictureInserter, RenderTestSupport.runWriter(pictureInserter));
    }

    private static Block video(Map<String, Object> data) {
        return Block.builder().key("v").type(BlockType.VIDEO).data(data).build();
    }

    @Test
    public void testThumbnailAndCaption() {
        when(thumbnailResolver.thumbnailUrl(SRC)).thenReturn(Optional.of(THUMBNAIL));
        Block block = video(Map.of("src", SRC, "label", "Demo"));
        RenderContext context = RenderTestSupport.context(List.of(block), 3);

        renderer.render(block, context);

        verify(pictureInserter).insertPicture(any(XWPFRun.class), eq(THUMBNAIL), eq(true));
        XWPFParagraph caption = context.getDocument().getParagraphs().get(1);
        assertEquals(DocxStyles.CAPTION, caption.getStyle());
        List<XWPFRun> runs = caption.getRuns();
        assertEquals("Demo", runs.get(0).getText(0));
        assertTrue(runs.get(0).isBold());
        assertEquals(SRC, runs.get(runs.size() - 1).getText(0));
        assertTrue(runs.get(runs.size() - 1).isBold());
    }

    @Test
    public void testUnknownProviderOnlyGetsCaption() {
        when(thumbnailResolver.thumbnailUrl(anyString())).thenReturn(Optional.empty());
        Block block = video(Map.of("src", "https://videos.example.com/42"));
        RenderContext context = RenderTestSupport.context(List.of(block), 3);

        renderer.render(block, context);

        verify(pictureInserter, never()).insertPicture(any(), anyString(), anyBoolean());
        assertEquals(2, context.getDocument().getParagraphs().size());
        assertFalse(context.getReport().hasErrors());
    }

    @Test
    public void testThumbnailLookupFailureIsRecorded() {
        when(thumbnailResolver.thumbnailUrl(anyString())).thenThrow(new ExternalServiceException("vimeo down"));
        Block block = video(Map.of("src", "https://vimeo.com/123456"));
        RenderContext context = RenderTestSupport.context(List.of(block), 3);

        renderer.render(block, context);

        assertEquals(1, context.getReport().getErrors().size());
        assertEquals(ErrorCategory.EXTERNAL_SERVICE, context.getReport().getErrors().get(0).getCategory());
        assertEquals("v", context.getReport().getErrors().get(0).getBlockKey());
        assertEquals(DocxStyles.CAPTION, context.getDocument().getParagraphs().get(1).getStyle());
    }

    @Test
    public void testNoSourceRendersNothing() {
        Block block = video(Map.of());
        RenderContext context = RenderTestSupport.context(List.of(block), 3);

        renderer.render(block, context);

        assertTrue(context.getDocument().getParagraphs().isEmpty());
        verifyNoInteractions(thumbnailResolver);
    }
}
