package com.example.docexport.service;

import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Legacy editors encoded three-column tables as cells with depths 1, ?, 2,
 * which collides with the depth-1 four-column encoding. Whenever a depth-1
 * cell is followed two blocks later by a depth-2 block, the three blocks are
 * rewritten to depth 3 so the table opens with three columns.
 *
 * This is a heuristic; it is not guaranteed to match every historical document.
 */
@Slf4j
@Component
public class DepthNormalizer {

    private static final int[] NEUTRAL = {1, 1, 1};

    /**
     * Returns a copy of the list with the rewritten blocks replaced; the
     * input blocks are not modified.
     */
    public List<Block> normalize(List<Block> blocks) {
        List<Block> result = new ArrayList<>(blocks);
        int rewritten = 0;
        int i = 0;
        while (i < result.size()) {
            Block block = result.get(i);
            if (block.getType() == BlockType.CELL) {
                int[] depths = peekDepths(result, i);
                if (block.getDepth() == 1 && depths[2] == 2) {
                    for (int k = i; k < i + 3; k++) {
                        result.set(k, result.get(k).toBuilder().depth(3).build());
                    }
                    rewritten++;
                    i++;
                }
            }
            i++;
        }
        if (rewritten > 0) {
            log.debug("Rewrote {} legacy cell triples to depth 3", rewritten);
        }
        return result;
    }

    private static int[] peekDepths(List<Block> blocks, int index) {
        if (index + 2 >= blocks.size()) {
            return NEUTRAL;
        }
        return new int[]{blocks.get(index).getDepth(), blocks.get(index + 1).getDepth(), blocks.get(index + 2).getDepth()};
    }
}
