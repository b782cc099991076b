package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.model.Entity;
import com.example.docexport.model.EntityRange;
import lombok.RequiredArgsConstructor;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Plain paragraphs. An unstyled block carrying a link entity with style
 * "block" is rendered as a link card instead: the text, then the URL below it.
 */
@Component
@RequiredArgsConstructor
public class ParagraphBlockRenderer implements BlockRenderer {

    static final String LINK_CARD_COLOR = "4CAEE3";
    private static final double LINK_CARD_FONT_SIZE = 12;

    private final RunWriter runWriter;

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.UNSTYLED;
    }

    @Override
    public void render(Block block, RenderContext context) {
        context.closeTable();
        Optional<Entity.EntityData> card = blockLink(block, context);
        XWPFParagraph paragraph = context.getCursor().newParagraph();
        if (card.isPresent()) {
            writeLinkCard(paragraph, block.textOrEmpty(), card.get().getHref(), context);
        } else {
            runWriter.writeBlock(paragraph, block, context);
        }
    }

    private Optional<Entity.EntityData> blockLink(Block block, RenderContext context) {
        Entity.EntityData found = null;
        for (EntityRange range : block.entitiesOrEmpty()) {
            Entity entity = context.getEntityMap().get(range.getKey());
            if (entity != null && entity.getData() != null && "block".equals(entity.getData().getStyle())) {
                found = entity.getData();
            }
        }
        return Optional.ofNullable(found);
    }

    private void writeLinkCard(XWPFParagraph paragraph, String text, String href, RenderContext context) {
        XWPFRun title = runWriter.plainRun(paragraph, text, context);
        title.setItalic(true);
        title.setFontSize(LINK_CARD_FONT_SIZE);
        title.setColor(LINK_CARD_COLOR);
        title.addBreak();

        XWPFRun url = runWriter.plainRun(paragraph, href == null ? "" : href, context);
        url.setItalic(true);
        url.setFontSize(LINK_CARD_FONT_SIZE);
    }
}
