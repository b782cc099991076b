package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.util.DocxStyles;
import lombok.RequiredArgsConstructor;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Component;

/**
 * header-two becomes a "heading 1" paragraph in the header color;
 * header-three is a bold Normal paragraph.
 */
@Component
@RequiredArgsConstructor
public class HeadingBlockRenderer implements BlockRenderer {

    private static final double HEADER_TWO_SIZE = 16;
    private static final double HEADER_THREE_SIZE = 12;

    private final RunWriter runWriter;

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.HEADER_TWO || type == BlockType.HEADER_THREE;
    }

    @Override
    public void render(Block block, RenderContext context) {
        if (block.getType() == BlockType.HEADER_TWO) {
            XWPFParagraph paragraph = context.getCursor().newParagraph(DocxStyles.HEADING_1);
            XWPFRun run = runWriter.plainRun(paragraph, block.textOrEmpty(), context);
            run.setFontSize(HEADER_TWO_SIZE);
            run.setColor(context.getProperties().getHeaderColor());
            run.setBold(true);
        } else {
            XWPFParagraph paragraph = context.getCursor().newParagraph();
            XWPFRun run = runWriter.plainRun(paragraph, block.textOrEmpty(), context);
            run.setFontSize(HEADER_THREE_SIZE);
            run.setBold(true);
        }
    }
}
