package com.example.docexport.text;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * Formatting of one run. The builder produces one descriptor per character;
 * neighbours with identical formatting are coalesced when written.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RunDescriptor {
    private String text;
    private boolean bold;
    private boolean italic;
    private boolean underline;
    private Double fontSize;
    private String color;
    private String fontName;
    private String shading;
    private String href;
    private ImageDescriptor image;

    public static RunDescriptor base(String text, RunDefaults defaults) {
        return RunDescriptor.builder()
                .text(text)
                .fontName(defaults.getFontName())
                .fontSize(defaults.getFontSize())
                .color(defaults.getColor())
                .build();
    }

    /**
     * True when both runs render identically apart from their text.
     * Runs carrying an image are never merged.
     */
    public boolean sameFormatting(RunDescriptor other) {
        return image == null && other.image == null
                && bold == other.bold
                && italic == other.italic
                && underline == other.underline
                && Objects.equals(fontSize, other.fontSize)
                && Objects.equals(color, other.color)
                && Objects.equals(fontName, other.fontName)
                && Objects.equals(shading, other.shading)
                && Objects.equals(href, other.href);
    }
}
