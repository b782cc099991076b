package com.example.docexport.service;

import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.model.ErrorCategory;
import com.example.docexport.model.ExportReport;
import com.example.docexport.model.RenderError;
import com.example.docexport.model.SnippetSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Replaces snippet blocks with the blocks they reference. Only source blocks
 * whose key is listed by the snippet are spliced in, in source order. A
 * snippet that cannot be resolved contributes no blocks.
 */
@Slf4j
@Component
public class SnippetExpander {

    public List<Block> expand(List<Block> blocks, SnippetResolver resolver, ExportReport report) {
        List<Block> expanded = new ArrayList<>();
        if (blocks == null) {
            return expanded;
        }
        for (Block block : blocks) {
            if (block.getType() == BlockType.SNIPPET) {
                expanded.addAll(resolve(block, resolver, report));
            } else {
                expanded.add(block);
            }
        }
        return expanded;
    }

    private List<Block> resolve(Block snippet, SnippetResolver resolver, ExportReport report) {
        String snippetId = snippet.dataString("src");
        Optional<SnippetSource> source;
        try {
            source = resolver.resolveSnippet(snippetId);
        } catch (RuntimeException e) {
            log.warn("Snippet {} lookup failed: {}", snippetId, e.getMessage());
            report.add(RenderError.builder()
                    .blockKey(snippet.getKey())
                    .blockType(BlockType.SNIPPET)
                    .category(ErrorCategory.EXTERNAL_SERVICE)
                    .message("Snippet lookup failed: " + e.getMessage())
                    .build());
            return List.of();
        }
        if (source.isEmpty()) {
            log.warn("Snippet {} referenced by block {} not found", snippetId, snippet.getKey());
            return List.of();
        }
        Set<String> keys = new HashSet<>(source.get().getKeys() == null ? List.of() : source.get().getKeys());
        List<Block> included = new ArrayList<>();
        for (Block block : source.get().getBlocks()) {
            if (keys.contains(block.getKey())) {
                included.add(block);
            }
        }
        log.debug("Snippet {} expanded to {} blocks", snippetId, included.size());
        return included;
    }
}
