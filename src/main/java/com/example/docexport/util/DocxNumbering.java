package com.example.docexport.util;

import org.apache.poi.xwpf.usermodel.XWPFAbstractNum;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFNumbering;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTAbstractNum;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTInd;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTLvl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTNumLvl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STNumberFormat;

import java.math.BigInteger;

/**
 * Bullet and decimal list definitions. Bullets share one numbering instance;
 * every ordered list gets its own instance so that it restarts at 1.
 */
public class DocxNumbering {

    private static final int LEVELS = 9;

    private final XWPFNumbering numbering;
    private final BigInteger decimalAbstractId;
    private final BigInteger bulletNumId;

    private DocxNumbering(XWPFNumbering numbering, BigInteger bulletAbstractId, BigInteger decimalAbstractId) {
        this.numbering = numbering;
        this.decimalAbstractId = decimalAbstractId;
        this.bulletNumId = numbering.addNum(bulletAbstractId);
    }

    public static DocxNumbering install(XWPFDocument document) {
        XWPFNumbering numbering = document.createNumbering();
        BigInteger bullet = numbering.addAbstractNum(
                new XWPFAbstractNum(abstractNum(0, STNumberFormat.BULLET), numbering));
        BigInteger decimal = numbering.addAbstractNum(
                new XWPFAbstractNum(abstractNum(1, STNumberFormat.DECIMAL), numbering));
        return new DocxNumbering(numbering, bullet, decimal);
    }

    public BigInteger bulletList() {
        return bulletNumId;
    }

    public BigInteger newOrderedList() {
        BigInteger numId = numbering.addNum(decimalAbstractId);
        for (int level = 0; level < LEVELS; level++) {
            CTNumLvl override = numbering.getNum(numId).getCTNum().addNewLvlOverride();
            override.setIlvl(BigInteger.valueOf(level));
            override.addNewStartOverride().setVal(BigInteger.ONE);
        }
        return numId;
    }

    private static CTAbstractNum abstractNum(int id, STNumberFormat.Enum format) {
        CTAbstractNum abstractNum = CTAbstractNum.Factory.newInstance();
        abstractNum.setAbstractNumId(BigInteger.valueOf(id));
        for (int level = 0; level < LEVELS; level++) {
            CTLvl lvl = abstractNum.addNewLvl();
            lvl.setIlvl(BigInteger.valueOf(level));
            lvl.addNewStart().setVal(BigInteger.ONE);
            lvl.addNewNumFmt().setVal(format);
            lvl.addNewLvlText().setVal(format == STNumberFormat.BULLET ? "\u2022" : "%" + (level + 1) + ".");
            CTInd ind = lvl.addNewPPr().addNewInd();
            ind.setLeft(BigInteger.valueOf(360L * (level + 1)));
            ind.setHanging(BigInteger.valueOf(360));
        }
        return abstractNum;
    }
}
