package com.example.docexport.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Non-fatal problem recorded while producing a document
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderError {
    private String blockKey;
    private BlockType blockType;
    private ErrorCategory category;
    private String message;
}
