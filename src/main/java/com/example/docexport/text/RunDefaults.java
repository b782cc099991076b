package com.example.docexport.text;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Font settings every run starts from before inline styles are applied
 */
@Getter
@AllArgsConstructor
public class RunDefaults {
    private final String fontName;
    private final double fontSize;
    private final String color;
}
