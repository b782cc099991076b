package com.example.docexport.text;

import com.example.docexport.model.Entity;
import com.example.docexport.model.EntityRange;
import com.example.docexport.model.InlineStyleRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns block text plus its style and entity ranges into one run descriptor
 * per code point. Range offsets and lengths count code points.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextRunBuilder {

    private final StyleResolver styleResolver;

    public List<RunDescriptor> build(String text,
                                     List<InlineStyleRange> inlineStyleRanges,
                                     List<EntityRange> entityRanges,
                                     Map<String, Entity> entityMap,
                                     RunDefaults defaults) {
        return build(text, collectRanges(inlineStyleRanges, entityRanges, entityMap, List.of()), defaults);
    }

    public List<RunDescriptor> build(String text, List<StyleRange> sortedRanges, RunDefaults defaults) {
        String source = text == null ? "" : text;
        List<RunDescriptor> runs = new ArrayList<>(source.length());
        source.codePoints()
                .forEach(cp -> runs.add(RunDescriptor.base(new String(Character.toChars(cp)), defaults)));

        for (StyleRange range : sortedRanges) {
            FormattingInstruction instruction = styleResolver.resolve(range.getToken());
            int start = Math.max(0, range.getOffset());
            int end = Math.min(runs.size(), range.getOffset() + range.getLength());
            for (int i = start; i < end; i++) {
                FormattingInstruction applied = instruction;
                if (range.getToken().getKind() == StyleToken.Kind.IMG && i > start) {
                    applied = styleResolver.resolveImageTail();
                }
                applyOrReset(runs, i, applied, range, defaults);
            }
        }
        return runs;
    }

    /**
     * Folds LINK and IMG entity ranges into the inline ranges and stable-sorts
     * the result by offset. Extra ranges are appended after the entities.
     */
    public List<StyleRange> collectRanges(List<InlineStyleRange> inlineStyleRanges,
                                          List<EntityRange> entityRanges,
                                          Map<String, Entity> entityMap,
                                          List<StyleRange> extra) {
        List<StyleRange> ranges = new ArrayList<>();
        if (inlineStyleRanges != null) {
            for (InlineStyleRange r : inlineStyleRanges) {
                ranges.add(new StyleRange(StyleToken.named(r.getStyle()), r.getOffset(), r.getLength()));
            }
        }
        if (entityRanges != null && entityMap != null) {
            for (EntityRange r : entityRanges) {
                StyleToken token = entityToken(entityMap.get(r.getKey()));
                if (token != null) {
                    ranges.add(new StyleRange(token, r.getOffset(), r.getLength()));
                }
            }
        }
        ranges.addAll(extra);
        // List.sort is a stable merge sort: equal offsets keep their source order
        ranges.sort(Comparator.comparingInt(StyleRange::getOffset));
        return ranges;
    }

    private StyleToken entityToken(Entity entity) {
        if (entity == null || entity.getData() == null) {
            return null;
        }
        if (entity.isLink()) {
            return StyleToken.link(entity.getData().getHref());
        }
        if (entity.isImage()) {
            return StyleToken.image(new ImageDescriptor(entity.getData().getSrc(), entity.getData().getSize()));
        }
        return null;
    }

    private void applyOrReset(List<RunDescriptor> runs, int index, FormattingInstruction instruction,
                              StyleRange range, RunDefaults defaults) {
        RunDescriptor run = runs.get(index);
        try {
            instruction.applyTo(run);
        } catch (RuntimeException e) {
            log.warn("Style {} failed on character {}, falling back to default formatting: {}",
                    range.getToken().getName(), index, e.getMessage());
            runs.set(index, RunDescriptor.base(run.getText(), defaults));
        }
    }
}
