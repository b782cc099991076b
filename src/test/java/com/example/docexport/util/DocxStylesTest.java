package com.example.docexport.util;

import com.example.docexport.config.RenderProperties;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class DocxStylesTest {

    @Test
    public void testStyleNamesResolveThroughStyleTable() throws IOException {
        try (XWPFDocument document = new XWPFDocument()) {
            DocxStyles.install(document, new RenderProperties());

            XWPFParagraph plain = document.createParagraph();
            assertEquals("Normal", DocxStyles.styleName(document, plain));

            XWPFParagraph heading = document.createParagraph();
            heading.setStyle(DocxStyles.HEADING_1);
            assertEquals("heading 1", DocxStyles.styleName(document, heading));

            XWPFParagraph list = document.createParagraph();
            list.setStyle(DocxStyles.ensureStyle(document, "ListNumber2", "List Number 2"));
            assertEquals("List Number 2", DocxStyles.styleName(document, list));
        }
    }

    @Test
    public void testEnsureStyleIsIdempotent() throws IOException {
        try (XWPFDocument document = new XWPFDocument()) {
            DocxStyles.install(document, new RenderProperties());
            DocxStyles.ensureStyle(document, "ListBullet3", "List Bullet 3");
            DocxStyles.ensureStyle(document, "ListBullet3", "List Bullet 3");

            assertTrue(document.getStyles().styleExist("ListBullet3"));
            assertEquals("List Bullet 3", document.getStyles().getStyle("ListBullet3").getName());
        }
    }
}
