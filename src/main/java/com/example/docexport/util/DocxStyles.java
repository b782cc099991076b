package com.example.docexport.util;

import com.example.docexport.config.RenderProperties;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFonts;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

import java.math.BigInteger;

/**
 * Paragraph styles used by the exporter. Style ids follow Word's built-in
 * naming so that templates authored in Word line up by style name.
 */
public final class DocxStyles {

    public static final String NORMAL = "Normal";
    public static final String HEADING_1 = "Heading1";
    public static final String CAPTION = "Caption";
    public static final String PREFORMATTED = "HTMLPreformatted";

    private DocxStyles() {
    }

    public static void install(XWPFDocument document, RenderProperties properties) {
        XWPFStyles styles = document.createStyles();
        addParagraphStyle(styles, NORMAL, "Normal", null,
                properties.getFontName(), properties.getFontSize(), properties.getFontColor(), false);
        addParagraphStyle(styles, HEADING_1, "heading 1", NORMAL,
                properties.getFontName(), 16, properties.getHeaderColor(), true);
        addParagraphStyle(styles, CAPTION, "Caption", NORMAL,
                properties.getFontName(), 10, properties.getFontColor(), false);
        addParagraphStyle(styles, PREFORMATTED, "HTML Preformatted", NORMAL,
                "Courier New", 10, properties.getFontColor(), false);
    }

    /**
     * Registers a plain paragraph style based on Normal unless one with this id exists.
     */
    public static String ensureStyle(XWPFDocument document, String styleId, String name) {
        XWPFStyles styles = document.getStyles() != null ? document.getStyles() : document.createStyles();
        if (!styles.styleExist(styleId)) {
            CTStyle ctStyle = newParagraphStyle(styleId, name, NORMAL);
            styles.addStyle(new XWPFStyle(ctStyle, styles));
        }
        return styleId;
    }

    /**
     * Display name of the paragraph's style, "Normal" when it has none.
     */
    public static String styleName(XWPFDocument document, XWPFParagraph paragraph) {
        String styleId = paragraph.getStyleID();
        if (styleId == null) {
            return "Normal";
        }
        XWPFStyles styles = document.getStyles();
        XWPFStyle style = styles == null ? null : styles.getStyle(styleId);
        return style == null || style.getName() == null ? styleId : style.getName();
    }

    public static CTRPr runProperties(CTStyle style) {
        return style.isSetRPr() ? style.getRPr() : style.addNewRPr();
    }

    private static void addParagraphStyle(XWPFStyles styles, String styleId, String name, String basedOn,
                                          String fontName, double fontSize, String color, boolean bold) {
        CTStyle ctStyle = newParagraphStyle(styleId, name, basedOn);
        CTRPr rPr = ctStyle.addNewRPr();
        CTFonts fonts = rPr.addNewRFonts();
        fonts.setAscii(fontName);
        fonts.setHAnsi(fontName);
        fonts.setCs(fontName);
        rPr.addNewSz().setVal(BigInteger.valueOf(Math.round(fontSize * 2)));
        rPr.addNewColor().setVal(color);
        if (bold) {
            rPr.addNewB();
        }
        styles.addStyle(new XWPFStyle(ctStyle, styles));
    }

    private static CTStyle newParagraphStyle(String styleId, String name, String basedOn) {
        CTStyle ctStyle = CTStyle.Factory.newInstance();
        ctStyle.setStyleId(styleId);
        ctStyle.setType(STStyleType.PARAGRAPH);
        ctStyle.addNewName().setVal(name);
        if (basedOn != null) {
            ctStyle.addNewBasedOn().setVal(basedOn);
        }
        ctStyle.addNewQFormat();
        return ctStyle;
    }
}
