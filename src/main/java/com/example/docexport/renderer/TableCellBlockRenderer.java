package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.core.TableColumnPolicy;
import com.example.docexport.core.TableCursor;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.util.DocxTables;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.springframework.stereotype.Component;

/**
 * Table cells arrive as a flat run of cell blocks.
 *
 * Format version 3: the first cell of a table declares the column count in
 * {@code data.table.cols}; following cells fill the open table.
 *
 * Every other version: a cell continues the open table when the previous
 * block is a cell at the same depth; otherwise a new table is opened with the
 * column count derived from the depth.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableCellBlockRenderer implements BlockRenderer {

    private final RunWriter runWriter;

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.CELL;
    }

    @Override
    public void render(Block block, RenderContext context) {
        TableCursor table = context.declaresTableColumns() ? declaredTable(block, context) : lookbackTable(block, context);
        XWPFTableCell cell = table.nextCell();
        runWriter.writeBlock(cell.getParagraphs().get(0), block, context);
    }

    private TableCursor lookbackTable(Block block, RenderContext context) {
        Block previous = context.previousBlock();
        boolean continues = context.hasOpenTable()
                && previous != null
                && previous.getType() == BlockType.CELL
                && previous.getDepth() == block.getDepth();
        if (continues) {
            return context.getTable();
        }
        return open(context, TableColumnPolicy.columnsForDepth(block.getDepth()));
    }

    private TableCursor declaredTable(Block block, RenderContext context) {
        Integer columns = declaredColumns(block);
        if (columns != null) {
            return open(context, columns);
        }
        if (context.hasOpenTable()) {
            return context.getTable();
        }
        log.debug("Cell {} has no open table, falling back to depth-based columns", block.getKey());
        return open(context, TableColumnPolicy.columnsForDepth(block.getDepth()));
    }

    private TableCursor open(RenderContext context, int columns) {
        context.closeTable();
        return context.openTable(new TableCursor(DocxTables.createGrid(context.getDocument(), 1, columns), columns));
    }

    private static Integer declaredColumns(Block block) {
        Object cols = block.dataPath("table", "cols");
        if (cols instanceof Number) {
            int value = ((Number) cols).intValue();
            return value > 0 ? value : null;
        }
        if (cols instanceof String) {
            try {
                int value = Integer.parseInt(((String) cols).trim());
                return value > 0 ? value : null;
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric column count '{}' on cell {}", cols, block.getKey());
            }
        }
        return null;
    }
}
