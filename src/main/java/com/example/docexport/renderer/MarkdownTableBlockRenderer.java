package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.util.DocxTables;
import com.example.docexport.util.MarkdownTableParser;
import com.example.docexport.util.MarkdownTableParser.ParsedTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pipe-delimited markdown tables: header row, then one row per data line
 */
@Slf4j
@Component
public class MarkdownTableBlockRenderer implements BlockRenderer {

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.MDTABLE;
    }

    @Override
    public void render(Block block, RenderContext context) {
        ParsedTable parsed = MarkdownTableParser.parse(block.getText());
        if (parsed.isEmpty()) {
            log.debug("Markdown table {} has no data rows, skipping", block.getKey());
            return;
        }
        XWPFTable table = DocxTables.createGrid(context.getDocument(), 1, parsed.getColumnCount());
        fill(table.getRow(0), parsed.getHeader());
        for (List<String> values : parsed.getRows()) {
            fill(table.createRow(), values);
        }
    }

    private static void fill(XWPFTableRow row, List<String> values) {
        for (int i = 0; i < values.size(); i++) {
            row.getCell(i).setText(values.get(i));
        }
    }
}
