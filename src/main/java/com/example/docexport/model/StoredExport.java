package com.example.docexport.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Location of an uploaded export: its object key and a time-limited download URL
 */
@Getter
@AllArgsConstructor
public class StoredExport {
    private final String key;
    private final String url;
}
