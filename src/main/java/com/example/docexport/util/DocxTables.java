package com.example.docexport.util;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblLayoutType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblWidth;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcBorders;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTblLayoutType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTblWidth;

import java.math.BigInteger;

/**
 * Table and cell helpers on top of XWPF. Widths are given in inches.
 */
public final class DocxTables {

    private static final int TWIPS_PER_INCH = 1440;

    private DocxTables() {
    }

    /**
     * Bordered table with a fixed layout (no autofit)
     */
    public static XWPFTable createGrid(XWPFDocument document, int rows, int columns) {
        XWPFTable table = document.createTable(rows, columns);
        fixedLayout(table);
        return table;
    }

    /**
     * Fixed-layout table without any borders
     */
    public static XWPFTable createPlain(XWPFDocument document, int rows, int columns) {
        XWPFTable table = document.createTable(rows, columns);
        table.removeBorders();
        fixedLayout(table);
        return table;
    }

    public static void fixedLayout(XWPFTable table) {
        CTTblPr tblPr = table.getCTTbl().getTblPr() != null
                ? table.getCTTbl().getTblPr()
                : table.getCTTbl().addNewTblPr();
        CTTblLayoutType layout = tblPr.isSetTblLayout() ? tblPr.getTblLayout() : tblPr.addNewTblLayout();
        layout.setType(STTblLayoutType.FIXED);
    }

    /**
     * Shifts the whole table right by the given number of twips
     */
    public static void indent(XWPFTable table, int twips) {
        CTTblPr tblPr = table.getCTTbl().getTblPr() != null
                ? table.getCTTbl().getTblPr()
                : table.getCTTbl().addNewTblPr();
        CTTblWidth ind = tblPr.isSetTblInd() ? tblPr.getTblInd() : tblPr.addNewTblInd();
        ind.setType(STTblWidth.DXA);
        ind.setW(BigInteger.valueOf(twips));
    }

    public static void setWidth(XWPFTableCell cell, double inches) {
        CTTcPr tcPr = cellProperties(cell);
        CTTblWidth width = tcPr.isSetTcW() ? tcPr.getTcW() : tcPr.addNewTcW();
        width.setType(STTblWidth.DXA);
        width.setW(BigInteger.valueOf(Math.round(inches * TWIPS_PER_INCH)));
    }

    public static void shade(XWPFTableCell cell, String fill) {
        cell.setColor(fill);
    }

    public static void leftBorder(XWPFTableCell cell, int size, String color) {
        CTTcBorders borders = borders(cell);
        configure(borders.isSetLeft() ? borders.getLeft() : borders.addNewLeft(), size, color);
    }

    private static void configure(CTBorder border, int size, String color) {
        border.setVal(STBorder.SINGLE);
        border.setSz(BigInteger.valueOf(size));
        border.setSpace(BigInteger.ZERO);
        border.setColor(color);
    }

    private static CTTcBorders borders(XWPFTableCell cell) {
        CTTcPr tcPr = cellProperties(cell);
        return tcPr.isSetTcBorders() ? tcPr.getTcBorders() : tcPr.addNewTcBorders();
    }

    private static CTTcPr cellProperties(XWPFTableCell cell) {
        return cell.getCTTc().isSetTcPr() ? cell.getCTTc().getTcPr() : cell.getCTTc().addNewTcPr();
    }
}
