package com.example.docexport.renderer;

import com.example.docexport.core.DocumentCursor;
import com.example.docexport.core.ListLevelPolicy;
import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.util.DocxStyles;
import lombok.RequiredArgsConstructor;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Ordered and unordered list items, styled "List Number n" / "List Bullet n".
 * When an ordered item's style differs from the current paragraph's style a
 * blank paragraph is inserted first so Word keeps the lists apart.
 */
@Component
@RequiredArgsConstructor
public class ListItemBlockRenderer implements BlockRenderer {

    private static final String ORDERED_STYLE_NAME = "List Number";
    private static final String BULLET_STYLE_NAME = "List Bullet";
    private static final int MAX_NUMBERING_LEVEL = 8;

    private final RunWriter runWriter;

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.ORDERED_LIST_ITEM || type == BlockType.UNORDERED_LIST_ITEM;
    }

    @Override
    public void render(Block block, RenderContext context) {
        DocumentCursor cursor = context.getCursor();
        XWPFParagraph paragraph;
        int level;
        if (block.getType() == BlockType.ORDERED_LIST_ITEM) {
            level = ListLevelPolicy.orderedLevel(block.getDepth());
            String styleName = ORDERED_STYLE_NAME + " " + level;
            String currentStyle = cursor.currentStyleName();
            boolean continuesList = currentStyle != null && currentStyle.startsWith(ORDERED_STYLE_NAME);
            if (!styleName.equals(currentStyle)) {
                cursor.newParagraph().createRun().addBreak();
            }
            if (!continuesList) {
                context.startOrderedList();
            }
            paragraph = cursor.newParagraph(DocxStyles.ensureStyle(context.getDocument(), "ListNumber" + level, styleName));
            paragraph.setNumID(context.orderedListNumId());
        } else {
            level = ListLevelPolicy.unorderedLevel(block.getDepth());
            String styleName = BULLET_STYLE_NAME + " " + level;
            paragraph = cursor.newParagraph(DocxStyles.ensureStyle(context.getDocument(), "ListBullet" + level, styleName));
            paragraph.setNumID(cursor.getNumbering().bulletList());
        }
        paragraph.setNumILvl(BigInteger.valueOf(Math.min(Math.max(level - 2, 0), MAX_NUMBERING_LEVEL)));
        runWriter.writeBlock(paragraph, block, context);
    }
}
