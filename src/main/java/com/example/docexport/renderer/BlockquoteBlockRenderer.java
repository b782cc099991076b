package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.util.DocxStyles;
import com.example.docexport.util.DocxTables;
import lombok.RequiredArgsConstructor;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.springframework.stereotype.Component;

/**
 * Callout box: a borderless 1x2 table with the variant icon on the left and
 * the quote text on the right, both shaded, with a colored bar on the left
 * edge. Nested quotes are indented by the accumulated depth.
 */
@Component
@RequiredArgsConstructor
public class BlockquoteBlockRenderer implements BlockRenderer {

    private static final double ICON_WIDTH_IN = 0.5;
    private static final double TEXT_WIDTH_IN = 6.0;
    private static final int BORDER_SIZE = 12;
    private static final int INDENT_PER_LEVEL_TWIPS = 360;

    private final RunWriter runWriter;

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.BLOCKQUOTE;
    }

    @Override
    public void render(Block block, RenderContext context) {
        BlockquoteVariant variant = BlockquoteVariant.fromStyle(block.dataString("style"));
        String styleId = DocxStyles.ensureStyle(context.getDocument(), variant.styleId(), variant.styleName());

        context.closeTable();
        context.getCursor().newParagraph();

        XWPFTable table = DocxTables.createPlain(context.getDocument(), 1, 2);
        if (context.getCurrentDepth() > 1) {
            DocxTables.indent(table, (context.getCurrentDepth() - 1) * INDENT_PER_LEVEL_TWIPS);
        }
        XWPFTableCell iconCell = table.getRow(0).getCell(0);
        XWPFTableCell textCell = table.getRow(0).getCell(1);
        DocxTables.setWidth(iconCell, ICON_WIDTH_IN);
        DocxTables.setWidth(textCell, TEXT_WIDTH_IN);

        iconCell.getParagraphs().get(0).setStyle(styleId);
        XWPFRun icon = runWriter.plainRun(iconCell.getParagraphs().get(0), variant.getIcon(), context);
        icon.setColor(variant.getAccentColor());

        textCell.getParagraphs().get(0).setStyle(styleId);
        runWriter.writeBlock(textCell.getParagraphs().get(0), block, context);

        DocxTables.leftBorder(iconCell, BORDER_SIZE, variant.getBorderColor());
        DocxTables.shade(iconCell, variant.getShading());
        DocxTables.shade(textCell, variant.getShading());
    }
}
