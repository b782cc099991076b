package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.text.RunDescriptor;
import com.example.docexport.text.StyleRange;
import com.example.docexport.text.StyleToken;
import com.example.docexport.text.TextRunBuilder;
import lombok.RequiredArgsConstructor;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Numbered step headings: "1. ", "2. ", ... prepended to the block text, both
 * in the header-step style. Numbering restarts with every article.
 */
@Component
@RequiredArgsConstructor
public class HeaderStepBlockRenderer implements BlockRenderer {

    private final RunWriter runWriter;
    private final TextRunBuilder textRunBuilder;

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.HEADER_STEP;
    }

    @Override
    public void render(Block block, RenderContext context) {
        XWPFParagraph paragraph = context.getCursor().newParagraph();

        String prefix = context.nextHeaderStep() + ". ";
        List<RunDescriptor> prefixRuns = textRunBuilder.build(prefix,
                List.of(new StyleRange(StyleToken.headerStep(), 0, prefix.length())), context.runDefaults());
        runWriter.writeRuns(paragraph, prefixRuns, block, context);

        String text = block.textOrEmpty();
        StyleRange wholeText = new StyleRange(StyleToken.headerStep(), 0, text.codePointCount(0, text.length()));
        runWriter.writeBlock(paragraph, block, context, List.of(wholeText));
    }
}
