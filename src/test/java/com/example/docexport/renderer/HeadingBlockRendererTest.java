package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.service.PictureInserter;
import com.example.docexport.util.DocxStyles;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class HeadingBlockRendererTest {

    private final HeadingBlockRenderer renderer = new HeadingBlockRenderer(
            RenderTestSupport.runWriter(mock(PictureInserter.class)));

    @Test
    public void testHeaderTwoUsesHeadingStyleAndHeaderColor() {
        Block block = Block.builder().key("h").type(BlockType.HEADER_TWO).text("Intro").build();
        RenderContext context = RenderTestSupport.context(List.of(block), 3);

        renderer.render(block, context);

        XWPFParagraph paragraph = context.getDocument().getParagraphs().get(0);
        assertEquals(DocxStyles.HEADING_1, paragraph.getStyle());
        XWPFRun run = paragraph.getRuns().get(0);
        assertEquals("Intro", run.getText(0));
        assertEquals("34AB76", run.getColor());
        assertEquals(16.0, run.getFontSizeAsDouble(), 0.001);
        assertTrue(run.isBold());
    }

    @Test
    public void testHeaderThreeIsBoldNormalParagraph() {
        Block block = Block.builder().key("h").type(BlockType.HEADER_THREE).text("Details").build();
        RenderContext context = RenderTestSupport.context(List.of(block), 3);

        renderer.render(block, context);

        XWPFParagraph paragraph = context.getDocument().getParagraphs().get(0);
        assertEquals(DocxStyles.NORMAL, paragraph.getStyle());
        XWPFRun run = paragraph.getRuns().get(0);
        assertTrue(run.isBold());
        assertEquals(12.0, run.getFontSizeAsDouble(), 0.001);
        assertEquals("404040", run.getColor());
    }
}
