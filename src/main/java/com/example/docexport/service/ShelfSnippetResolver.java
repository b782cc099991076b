package com.example.docexport.service;

import com.example.docexport.model.Shelf;
import com.example.docexport.model.SnippetSource;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves snippets from the sources shipped inside the shelf payload
 */
public class ShelfSnippetResolver implements SnippetResolver {

    private final Map<String, SnippetSource> snippets;

    public ShelfSnippetResolver(Shelf shelf) {
        this.snippets = shelf.getSnippets() == null ? Map.of() : shelf.getSnippets();
    }

    @Override
    public Optional<SnippetSource> resolveSnippet(String snippetId) {
        return snippetId == null ? Optional.empty() : Optional.ofNullable(snippets.get(snippetId));
    }
}
