package com.example.docexport.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the non-fatal errors of one export run
 */
@Data
public class ExportReport {

    private final List<RenderError> errors = new ArrayList<>();

    private int blocksDispatched;

    public void add(RenderError error) {
        errors.add(error);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
