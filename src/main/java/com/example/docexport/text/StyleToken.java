package com.example.docexport.text;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * A style applied to a span of text. Named tokens come from inline style
 * ranges; LINK and IMG tokens are produced from entity ranges.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StyleToken {

    public enum Kind {
        BOLD, ITALIC, UNDERLINE, CODE, KBD, DFN, HEADER_STEP, LINK, IMG, UNKNOWN
    }

    private static final Map<String, Kind> NAMED = Map.of(
            "BOLD", Kind.BOLD,
            "ITALIC", Kind.ITALIC,
            "UNDERLINE", Kind.UNDERLINE,
            "CODE", Kind.CODE,
            "KBD", Kind.KBD,
            "DFN", Kind.DFN,
            "header-step", Kind.HEADER_STEP);

    private final Kind kind;
    private final String name;
    private final String href;
    private final ImageDescriptor image;

    public static StyleToken named(String name) {
        Kind kind = name == null ? Kind.UNKNOWN : NAMED.getOrDefault(name, Kind.UNKNOWN);
        return new StyleToken(kind, name, null, null);
    }

    public static StyleToken link(String href) {
        return new StyleToken(Kind.LINK, "LINK", href, null);
    }

    public static StyleToken image(ImageDescriptor image) {
        return new StyleToken(Kind.IMG, "IMG", null, image);
    }

    public static StyleToken headerStep() {
        return named("header-step");
    }
}
