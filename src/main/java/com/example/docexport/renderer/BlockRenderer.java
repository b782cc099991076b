package com.example.docexport.renderer;

import com.example.docexport.core.RenderContext;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;

/**
 * Interface for block renderers. Every {@link BlockType} must be supported by
 * exactly one registered renderer.
 */
public interface BlockRenderer {

    /**
     * Check if this renderer supports the given block type
     */
    boolean supports(BlockType type);

    /**
     * Append the block to the document held by the context, updating the
     * context's structural state as needed
     */
    void render(Block block, RenderContext context);
}
