package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.service.PictureInserter;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class HeaderStepBlockRendererTest {

    private final HeaderStepBlockRenderer renderer = new HeaderStepBlockRenderer(
            RenderTestSupport.runWriter(mock(PictureInserter.class)), RenderTestSupport.textRunBuilder());

    private static Block step(String text) {
        return Block.builder().key(text).type(BlockType.HEADER_STEP).text(text).build();
    }

    @Test
    public void testStepsAreNumberedInOrder() {
        List<Block> blocks = List.of(step("Install"), step("Run"));
        RenderContext context = RenderTestSupport.context(blocks, 3);

        renderer.render(blocks.get(0), context);
        renderer.render(blocks.get(1), context);

        List<XWPFParagraph> paragraphs = context.getDocument().getParagraphs();
        assertEquals("1. Install", paragraphs.get(0).getText());
        assertEquals("2. Run", paragraphs.get(1).getText());
    }

    @Test
    public void testPrefixAndTextUseHeaderStepFormatting() {
        Block block = step("Deploy");
        RenderContext context = RenderTestSupport.context(List.of(block), 3);

        renderer.render(block, context);

        for (XWPFRun run : context.getDocument().getParagraphs().get(0).getRuns()) {
            assertTrue(run.isBold());
            assertEquals(10.5, run.getFontSizeAsDouble(), 0.001);
        }
    }

    @Test
    public void testNumberingRestartsWithNewContext() {
        Block block = step("Again");
        RenderContext first = RenderTestSupport.context(List.of(block), 3);
        renderer.render(block, first);
        renderer.render(block, first);

        RenderContext second = RenderTestSupport.context(List.of(block), 3);
        renderer.render(block, second);

        assertEquals("1. Again", second.getDocument().getParagraphs().get(0).getText());
    }
}
