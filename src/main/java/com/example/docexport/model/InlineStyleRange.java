package com.example.docexport.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Span of characters carrying a named inline style such as BOLD or CODE
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InlineStyleRange {
    private String style;
    private int offset;
    private int length;
}
