package com.example.docexport.text;

import org.springframework.stereotype.Component;

/**
 * Maps style tokens to the formatting they stand for. Unknown tokens resolve
 * to {@link FormattingInstruction#NO_OP}.
 */
@Component
public class StyleResolver {

    /**
     * Glyph upstream editors put where an inline image goes (U+1F5BC)
     */
    public static final String IMAGE_MARKER = "\uD83D\uDDBC";

    private static final String VARIATION_SELECTOR = "\uFE0F";

    public FormattingInstruction resolve(StyleToken token) {
        if (token == null) {
            return FormattingInstruction.NO_OP;
        }
        switch (token.getKind()) {
            case BOLD:
                return run -> run.setBold(true);
            case ITALIC:
                return run -> run.setItalic(true);
            case UNDERLINE:
                return run -> run.setUnderline(true);
            case CODE:
                return run -> {
                    run.setColor("4472C4");
                    run.setFontSize(12.0);
                    run.setFontName("Times New Roman");
                };
            case KBD:
                return run -> {
                    run.setShading("E7E6E6");
                    run.setFontSize(11.0);
                    run.setFontName("Courier New");
                };
            case DFN:
                return run -> run.setShading("B3C6E7");
            case HEADER_STEP:
                return run -> {
                    run.setBold(true);
                    run.setFontSize(10.5);
                };
            case LINK:
                return run -> run.setHref(token.getHref());
            case IMG:
                return run -> {
                    run.setImage(token.getImage());
                    run.setText(stripImageMarker(run.getText()));
                };
            default:
                return FormattingInstruction.NO_OP;
        }
    }

    /**
     * Instruction for the remaining characters an IMG range covers: they only
     * lose their share of the marker glyph.
     */
    public FormattingInstruction resolveImageTail() {
        return run -> run.setText(stripImageMarker(run.getText()));
    }

    static String stripImageMarker(String text) {
        if (text == null) {
            return "";
        }
        return text.replace(IMAGE_MARKER, "").replace(VARIATION_SELECTOR, "");
    }
}
