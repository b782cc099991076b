package com.example.docexport.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Export request: the shelf to convert plus an optional style template,
 * given either by id (looked up in the template directory) or inline as base64.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportRequest {

    private Shelf shelf;

    private String templateId;

    private String templateBase64;

    /**
     * File name used for the stored object; defaults to the shelf name
     */
    private String filename;
}
