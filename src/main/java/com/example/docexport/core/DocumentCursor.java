package com.example.docexport.core;

import com.example.docexport.config.RenderProperties;
import com.example.docexport.util.DocxNumbering;
import com.example.docexport.util.DocxStyles;
import lombok.Getter;
import org.apache.poi.xwpf.usermodel.BreakType;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

/**
 * The document under construction and its current paragraph. Lives for the
 * whole export; per-article state is kept in {@link RenderContext}.
 */
@Getter
public class DocumentCursor {

    private final XWPFDocument document;
    private final RenderProperties properties;
    private final DocxNumbering numbering;
    private XWPFParagraph paragraph;

    private DocumentCursor(XWPFDocument document, RenderProperties properties) {
        this.document = document;
        this.properties = properties;
        this.numbering = DocxNumbering.install(document);
    }

    public static DocumentCursor create(RenderProperties properties) {
        XWPFDocument document = new XWPFDocument();
        DocxStyles.install(document, properties);
        return new DocumentCursor(document, properties);
    }

    public XWPFParagraph newParagraph() {
        return newParagraph(DocxStyles.NORMAL);
    }

    public XWPFParagraph newParagraph(String styleId) {
        paragraph = document.createParagraph();
        paragraph.setStyle(styleId);
        return paragraph;
    }

    /**
     * Current paragraph, creating a Normal one if nothing was written yet
     */
    public XWPFParagraph current() {
        return paragraph != null ? paragraph : newParagraph();
    }

    public String currentStyleName() {
        return paragraph == null ? null : DocxStyles.styleName(document, paragraph);
    }

    public void pageBreak() {
        current().createRun().addBreak(BreakType.PAGE);
    }
}
