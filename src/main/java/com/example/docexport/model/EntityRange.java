package com.example.docexport.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Span of characters bound to an entry of the article's entity map
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EntityRange {
    private String key;
    private int offset;
    private int length;
}
