package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.util.DocxStyles;
import com.example.docexport.util.DocxTables;
import lombok.RequiredArgsConstructor;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.springframework.stereotype.Component;

/**
 * Code listings: a label/language header row followed by the code in a
 * monospace cell with a blue bar on its left edge.
 */
@Component
@RequiredArgsConstructor
public class CodeBlockRenderer implements BlockRenderer {

    static final String BAR_COLOR = "365FDD";
    static final String CODE_FONT = "Courier New";
    static final double CODE_FONT_SIZE = 10;
    private static final int BAR_SIZE = 12;

    private final RunWriter runWriter;

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.CODE_BLOCK || type == BlockType.GIST_BLOCK;
    }

    @Override
    public void render(Block block, RenderContext context) {
        context.getCursor().newParagraph();
        if (block.getType() == BlockType.CODE_BLOCK) {
            XWPFTable header = DocxTables.createGrid(context.getDocument(), 1, 2);
            runWriter.plainRun(header.getRow(0).getCell(0).getParagraphs().get(0), nullToEmpty(block.dataString("label")), context);
            runWriter.plainRun(header.getRow(0).getCell(1).getParagraphs().get(0), nullToEmpty(block.dataString("type")), context);
            writeCode(block.textOrEmpty(), context);
        } else {
            // gists are exported as their source URL
            writeCode(nullToEmpty(block.dataString("src")), context);
        }
    }

    private void writeCode(String code, RenderContext context) {
        XWPFTable table = DocxTables.createGrid(context.getDocument(), 1, 1);
        XWPFTableCell cell = table.getRow(0).getCell(0);
        DocxTables.leftBorder(cell, BAR_SIZE, BAR_COLOR);
        XWPFParagraph paragraph = cell.getParagraphs().get(0);
        paragraph.setStyle(DocxStyles.PREFORMATTED);
        XWPFRun run = runWriter.plainRun(paragraph, code, context);
        run.setFontFamily(CODE_FONT);
        run.setFontSize(CODE_FONT_SIZE);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
