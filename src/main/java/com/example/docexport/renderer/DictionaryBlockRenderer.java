package com.example.docexport.renderer;

import com.example.docexport.core.DictionaryCursor;
import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.util.DocxTables;
import lombok.RequiredArgsConstructor;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.springframework.stereotype.Component;

/**
 * Term/definition pairs. Consecutive dictionary blocks share one table.
 */
@Component
@RequiredArgsConstructor
public class DictionaryBlockRenderer implements BlockRenderer {

    private final RunWriter runWriter;

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.DICTIONARY;
    }

    @Override
    public void render(Block block, RenderContext context) {
        Block previous = context.previousBlock();
        if (!context.hasOpenDictionary() || previous == null || previous.getType() != BlockType.DICTIONARY) {
            context.openDictionary(new DictionaryCursor(
                    DocxTables.createGrid(context.getDocument(), 1, DictionaryCursor.COLUMNS)));
        }
        XWPFTableCell cell = context.getDictionary().nextCell();
        runWriter.writeBlock(cell.getParagraphs().get(0), block, context);
    }
}
