package com.example.docexport.service;

import com.example.docexport.model.SnippetSource;

import java.util.Optional;

/**
 * Looks up the content a snippet block refers to
 */
public interface SnippetResolver {

    /**
     * @return the source blocks and the keys to include, or empty when the snippet does not exist
     */
    Optional<SnippetSource> resolveSnippet(String snippetId);
}
