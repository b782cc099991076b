package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Unknown block types, and snippet references that could not be resolved:
 * their text, if any, becomes a plain paragraph.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackBlockRenderer implements BlockRenderer {

    private final RunWriter runWriter;

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.OTHER || type == BlockType.SNIPPET;
    }

    @Override
    public void render(Block block, RenderContext context) {
        if (block.textOrEmpty().isEmpty()) {
            log.debug("Nothing to render for {} block {}", block.getType(), block.getKey());
            return;
        }
        runWriter.writeBlock(context.getCursor().newParagraph(), block, context);
    }
}
