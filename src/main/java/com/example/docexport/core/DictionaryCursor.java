package com.example.docexport.core;

import com.example.docexport.util.DocxTables;
import lombok.Getter;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

/**
 * Write position inside a dictionary: a three column table of term, narrow
 * separator and definition. The separator column never receives text and
 * every even row is shaded.
 */
@Getter
public class DictionaryCursor {

    public static final int COLUMNS = 3;
    public static final String ROW_SHADING = "E7E7F9";

    private static final int SEPARATOR = 1;
    private static final double SEPARATOR_WIDTH_IN = 0.17;
    private static final double SKIPPED_SEPARATOR_WIDTH_IN = 0.3;

    private final XWPFTable table;
    private int cellIndex;

    public DictionaryCursor(XWPFTable table) {
        this.table = table;
        XWPFTableRow first = table.getRow(0);
        DocxTables.setWidth(first.getCell(SEPARATOR), SEPARATOR_WIDTH_IN);
        shadeIfEven(first, 0);
    }

    public XWPFTableCell nextCell() {
        if (cellIndex >= COLUMNS) {
            cellIndex = 0;
            XWPFTableRow row = table.createRow();
            DocxTables.setWidth(row.getCell(SEPARATOR), SEPARATOR_WIDTH_IN);
            shadeIfEven(row, table.getNumberOfRows() - 1);
        }
        XWPFTableRow row = table.getRow(table.getNumberOfRows() - 1);
        if (cellIndex == SEPARATOR) {
            DocxTables.setWidth(row.getCell(SEPARATOR), SKIPPED_SEPARATOR_WIDTH_IN);
            cellIndex = SEPARATOR + 1;
        }
        return row.getCell(cellIndex++);
    }

    private static void shadeIfEven(XWPFTableRow row, int rowIndex) {
        if (rowIndex % 2 == 0) {
            for (XWPFTableCell cell : row.getTableCells()) {
                DocxTables.shade(cell, ROW_SHADING);
            }
        }
    }
}
