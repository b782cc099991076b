package com.example.docexport.renderer;

import com.example.docexport.core.DocumentCursor;
import com.example.docexport.core.RenderContext;
import com.example.docexport.exception.ExternalServiceException;
import com.example.docexport.exception.ImageFormatException;
import com.example.docexport.model.Article;
import com.example.docexport.model.ErrorCategory;
import com.example.docexport.service.PictureInserter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Component;

/**
 * Fixed document furniture: the shelf title page, book titles and the
 * centered header (icon, name, description) above each article.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TitleWriter {

    private static final double SHELF_TITLE_SIZE = 28;
    private static final double BOOK_TITLE_SIZE = 24;
    private static final double ARTICLE_NAME_SIZE = 18;
    private static final double ARTICLE_DESCRIPTION_SIZE = 12;

    private final PictureInserter pictureInserter;

    public void writeShelfTitle(DocumentCursor cursor, String shelfName) {
        XWPFRun run = cursor.newParagraph().createRun();
        run.setText(shelfName == null ? "" : shelfName);
        run.setFontFamily(cursor.getProperties().getFontName());
        run.setFontSize(SHELF_TITLE_SIZE);
        run.setColor(cursor.getProperties().getHeaderColor());
        run.setBold(true);
        cursor.newParagraph();
    }

    /**
     * Book titles go into the current paragraph, right after the previous page break
     */
    public void writeBookTitle(DocumentCursor cursor, String bookName) {
        XWPFRun run = cursor.current().createRun();
        run.setText(bookName == null ? "" : bookName);
        run.setFontFamily(cursor.getProperties().getFontName());
        run.setFontSize(BOOK_TITLE_SIZE);
        run.setColor(cursor.getProperties().getFontColor());
        run.setBold(true);
    }

    public void writeArticleHeader(Article article, RenderContext context) {
        DocumentCursor cursor = context.getCursor();
        cursor.newParagraph();
        String icon = article.getMeta() == null ? null : article.getMeta().getIcon();
        if (icon != null && !icon.isBlank()) {
            writeIcon(icon, context);
        }

        XWPFParagraph name = cursor.newParagraph();
        name.setAlignment(ParagraphAlignment.CENTER);
        name.createRun().addBreak();
        styled(name.createRun(), article.getName(), ARTICLE_NAME_SIZE, context);

        XWPFParagraph description = cursor.newParagraph();
        description.setAlignment(ParagraphAlignment.CENTER);
        styled(description.createRun(), article.getDescription(), ARTICLE_DESCRIPTION_SIZE, context);

        cursor.newParagraph();
    }

    private void writeIcon(String icon, RenderContext context) {
        XWPFParagraph paragraph = context.getCursor().newParagraph();
        paragraph.setAlignment(ParagraphAlignment.CENTER);
        try {
            pictureInserter.insertPicture(paragraph.createRun(), icon, false);
        } catch (ExternalServiceException e) {
            log.warn("Article icon {} unavailable: {}", icon, e.getMessage());
            context.recordError(null, ErrorCategory.EXTERNAL_SERVICE, e.getMessage());
        } catch (ImageFormatException e) {
            log.warn("Article icon {} unreadable: {}", icon, e.getMessage());
            context.recordError(null, ErrorCategory.IMAGE_FORMAT, e.getMessage());
        }
    }

    private static void styled(XWPFRun run, String text, double size, RenderContext context) {
        run.setText(text == null ? "" : text);
        run.setFontFamily(context.getProperties().getFontName());
        run.setFontSize(size);
        run.setColor(context.getProperties().getFontColor());
        run.setBold(true);
    }
}
