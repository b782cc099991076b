package com.example.docexport.renderer;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Visual variants of blockquotes, picked by {@code data.style}
 */
@Getter
@AllArgsConstructor
public enum BlockquoteVariant {
    WARNING("warning", "\uD83D\uDEA8", "C0504D", "FFD9D9", "FF0000"),
    QUESTION("question", "\u2753", "8064A2", "E7FDF8", "00CC00"),
    DEFAULT("default", "\u2139\uFE0F", "4F81BD", "EAEEF2", "404040");

    private final String style;
    private final String icon;
    private final String accentColor;
    private final String shading;
    private final String borderColor;

    public static BlockquoteVariant fromStyle(String style) {
        for (BlockquoteVariant variant : values()) {
            if (variant.style.equalsIgnoreCase(style)) {
                return variant;
            }
        }
        return DEFAULT;
    }

    public String styleId() {
        return "Quote" + Character.toUpperCase(style.charAt(0)) + style.substring(1);
    }

    public String styleName() {
        return style + " quote";
    }
}
