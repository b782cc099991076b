package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.exception.ExternalServiceException;
import com.example.docexport.exception.ImageFormatException;
import com.example.docexport.model.Block;
import com.example.docexport.model.ErrorCategory;
import com.example.docexport.service.PictureInserter;
import com.example.docexport.text.RunDescriptor;
import com.example.docexport.text.StyleRange;
import com.example.docexport.text.TextRunBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTShd;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STShd;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes styled block text into a paragraph. Per-character descriptors from
 * {@link TextRunBuilder} are coalesced so that a uniformly styled word ends up
 * as a single run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunWriter {

    private final TextRunBuilder textRunBuilder;
    private final PictureInserter pictureInserter;

    public void writeBlock(XWPFParagraph paragraph, Block block, RenderContext context) {
        writeBlock(paragraph, block, context, List.of());
    }

    public void writeBlock(XWPFParagraph paragraph, Block block, RenderContext context, List<StyleRange> extraRanges) {
        List<StyleRange> ranges = textRunBuilder.collectRanges(
                block.inlineStylesOrEmpty(), block.entitiesOrEmpty(), context.getEntityMap(), extraRanges);
        List<RunDescriptor> runs = textRunBuilder.build(block.textOrEmpty(), ranges, context.runDefaults());
        writeRuns(paragraph, runs, block, context);
    }

    public void writeRuns(XWPFParagraph paragraph, List<RunDescriptor> runs, Block block, RenderContext context) {
        for (RunDescriptor descriptor : coalesce(runs)) {
            writeRun(paragraph, descriptor, block, context);
        }
    }

    /**
     * Run with the body defaults applied, for fixed text such as headings and captions
     */
    public XWPFRun plainRun(XWPFParagraph paragraph, String text, RenderContext context) {
        XWPFRun run = paragraph.createRun();
        run.setFontFamily(context.getProperties().getFontName());
        run.setFontSize(context.getProperties().getFontSize());
        run.setColor(context.getProperties().getFontColor());
        setMultilineText(run, text);
        return run;
    }

    /**
     * Sets text, turning newlines into line breaks
     */
    public static void setMultilineText(XWPFRun run, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                run.addBreak();
            }
            run.setText(lines[i], i);
        }
    }

    static List<RunDescriptor> coalesce(List<RunDescriptor> runs) {
        List<RunDescriptor> merged = new ArrayList<>();
        for (RunDescriptor run : runs) {
            RunDescriptor last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && last.sameFormatting(run)) {
                last.setText(last.getText() + run.getText());
            } else {
                merged.add(run.toBuilder().build());
            }
        }
        return merged;
    }

    private void writeRun(XWPFParagraph paragraph, RunDescriptor descriptor, Block block, RenderContext context) {
        XWPFRun run = descriptor.getHref() != null && descriptor.getImage() == null
                ? paragraph.createHyperlinkRun(descriptor.getHref())
                : paragraph.createRun();
        format(run, descriptor);
        setMultilineText(run, descriptor.getText());
        if (descriptor.getImage() != null) {
            try {
                pictureInserter.insertInline(run, descriptor.getImage());
            } catch (ImageFormatException e) {
                log.warn("Skipping inline image {} in block {}: {}", descriptor.getImage().getSrc(), block.getKey(), e.getMessage());
                context.recordError(block, ErrorCategory.IMAGE_FORMAT, e.getMessage());
            } catch (ExternalServiceException e) {
                log.warn("Skipping inline image {} in block {}: {}", descriptor.getImage().getSrc(), block.getKey(), e.getMessage());
                context.recordError(block, ErrorCategory.EXTERNAL_SERVICE, e.getMessage());
            }
        }
    }

    private static void format(XWPFRun run, RunDescriptor descriptor) {
        run.setBold(descriptor.isBold());
        run.setItalic(descriptor.isItalic());
        if (descriptor.isUnderline()) {
            run.setUnderline(UnderlinePatterns.SINGLE);
        }
        if (descriptor.getFontSize() != null) {
            run.setFontSize(descriptor.getFontSize());
        }
        if (descriptor.getColor() != null) {
            run.setColor(descriptor.getColor());
        }
        if (descriptor.getFontName() != null) {
            run.setFontFamily(descriptor.getFontName());
        }
        if (descriptor.getShading() != null) {
            CTRPr rPr = run.getCTR().isSetRPr() ? run.getCTR().getRPr() : run.getCTR().addNewRPr();
            CTShd shd = rPr.addNewShd();
            shd.setVal(STShd.CLEAR);
            shd.setColor("auto");
            shd.setFill(descriptor.getShading());
        }
    }
}
