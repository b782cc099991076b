package com.example.docexport.core;

import lombok.Getter;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

/**
 * Write position inside an open table. Cells are filled left to right; once
 * the last column is used the next call appends a fresh row.
 */
@Getter
public class TableCursor {

    private final XWPFTable table;
    private final int columnCount;
    private int cellIndex;

    public TableCursor(XWPFTable table, int columnCount) {
        this.table = table;
        this.columnCount = columnCount;
    }

    public XWPFTableCell nextCell() {
        if (cellIndex >= columnCount) {
            cellIndex = 0;
            table.createRow();
        }
        XWPFTableRow row = table.getRow(table.getNumberOfRows() - 1);
        return row.getCell(cellIndex++);
    }
}
