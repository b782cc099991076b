package com.example.docexport.service;

import com.example.docexport.core.RenderContext;
import com.example.docexport.exception.ExternalServiceException;
import com.example.docexport.exception.ImageFormatException;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.model.ErrorCategory;
import com.example.docexport.renderer.BlockRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes each block to the renderer registered for its type. The routing
 * table is built once and must cover every {@link BlockType}; a missing
 * renderer fails application startup.
 *
 * A block whose rendering throws is logged, recorded in the export report and
 * skipped; structural state stays as the failed block left it.
 */
@Slf4j
@Service
public class BlockDispatcher {

    private final Map<BlockType, BlockRenderer> routes = new EnumMap<>(BlockType.class);

    public BlockDispatcher(List<BlockRenderer> renderers) {
        for (BlockType type : BlockType.values()) {
            BlockRenderer renderer = renderers.stream()
                    .filter(r -> r.supports(type))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No renderer registered for block type: " + type));
            routes.put(type, renderer);
        }
    }

    /**
     * Dispatches every block of the context in order and returns how many were dispatched
     */
    public int dispatchAll(RenderContext context) {
        List<Block> blocks = context.getBlocks();
        for (int i = 0; i < blocks.size(); i++) {
            context.moveTo(i);
            dispatch(blocks.get(i), context);
        }
        return blocks.size();
    }

    public void dispatch(Block block, RenderContext context) {
        BlockType type = block.getType() == null ? BlockType.UNSTYLED : block.getType();
        context.enterDepth(block.getDepth());
        try {
            routes.get(type).render(block, context);
        } catch (ImageFormatException e) {
            fail(block, context, ErrorCategory.IMAGE_FORMAT, e);
        } catch (ExternalServiceException e) {
            fail(block, context, ErrorCategory.EXTERNAL_SERVICE, e);
        } catch (RuntimeException e) {
            fail(block, context, ErrorCategory.BLOCK, e);
        } finally {
            context.exitDepth(block.getDepth());
        }
    }

    private void fail(Block block, RenderContext context, ErrorCategory category, RuntimeException e) {
        log.warn("Failed to render {} block {}: {}", block.getType(), block.getKey(), e.getMessage(), e);
        context.recordError(block, category, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
    }
}
