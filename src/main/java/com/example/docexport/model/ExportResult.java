package com.example.docexport.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ExportResult {
    private final byte[] content;
    private final ExportReport report;
}
