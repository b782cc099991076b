package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.service.PictureInserter;
import com.example.docexport.util.DocxStyles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;

/**
 * Figures: a framed picture aligned per {@code data.align} with an optional
 * bold caption. Inline data-URL images are placed unframed and without caption.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FigureBlockRenderer implements BlockRenderer {

    private final PictureInserter pictureInserter;
    private final RunWriter runWriter;

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.FIGURE;
    }

    @Override
    public void render(Block block, RenderContext context) {
        String src = block.dataString("src");
        if (src == null || src.isBlank()) {
            log.debug("Figure block {} has no source", block.getKey());
            return;
        }
        context.closeTable();
        boolean inline = PictureInserter.isDataUrl(src);

        XWPFParagraph paragraph = context.getCursor().newParagraph();
        paragraph.setAlignment(alignment(block.dataString("align")));
        pictureInserter.insertPicture(paragraph.createRun(), src, !inline);

        String label = inline ? null : block.dataString("label");
        if (label != null && !label.isEmpty()) {
            XWPFParagraph caption = context.getCursor().newParagraph(DocxStyles.CAPTION);
            caption.setAlignment(ParagraphAlignment.CENTER);
            runWriter.plainRun(caption, label, context).setBold(true);
        }
    }

    static ParagraphAlignment alignment(String align) {
        if ("left".equals(align)) {
            return ParagraphAlignment.LEFT;
        }
        if ("right".equals(align)) {
            return ParagraphAlignment.RIGHT;
        }
        return ParagraphAlignment.CENTER;
    }
}
