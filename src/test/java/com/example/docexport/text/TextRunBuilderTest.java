package com.example.docexport.text;

import com.example.docexport.model.Entity;
import com.example.docexport.model.EntityRange;
import com.example.docexport.model.InlineStyleRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Text Run Builder Tests")
public class TextRunBuilderTest {

    private static final RunDefaults DEFAULTS = new RunDefaults("Inter", 12, "404040");

    private TextRunBuilder builder;

    @BeforeEach
    public void setup() {
        builder = new TextRunBuilder(new StyleResolver());
    }

    @Test
    @DisplayName("Should emit one default-formatted run per character when no ranges are given")
    public void testPlainText() {
        List<RunDescriptor> runs = builder.build("Hi!", List.of(), List.of(), Map.of(), DEFAULTS);

        assertEquals(3, runs.size());
        for (RunDescriptor run : runs) {
            assertFalse(run.isBold());
            assertEquals("Inter", run.getFontName());
            assertEquals(12.0, run.getFontSize(), 0.001);
            assertEquals("404040", run.getColor());
        }
        assertEquals("H", runs.get(0).getText());
        assertEquals("!", runs.get(2).getText());
    }

    @Test
    @DisplayName("Should bold only the characters inside the range")
    public void testBoldRange() {
        List<RunDescriptor> runs = builder.build("Hello world",
                List.of(new InlineStyleRange("BOLD", 0, 5)), List.of(), Map.of(), DEFAULTS);

        assertTrue(runs.get(0).isBold());
        assertTrue(runs.get(4).isBold());
        assertFalse(runs.get(5).isBold());
        assertFalse(runs.get(10).isBold());
    }

    @Test
    @DisplayName("Should layer overlapping styles on the same characters")
    public void testOverlappingStyles() {
        List<RunDescriptor> runs = builder.build("abcdef",
                List.of(new InlineStyleRange("BOLD", 0, 4), new InlineStyleRange("ITALIC", 2, 4)),
                List.of(), Map.of(), DEFAULTS);

        assertTrue(runs.get(1).isBold());
        assertFalse(runs.get(1).isItalic());
        assertTrue(runs.get(2).isBold());
        assertTrue(runs.get(2).isItalic());
        assertFalse(runs.get(5).isBold());
        assertTrue(runs.get(5).isItalic());
    }

    @Test
    @DisplayName("Should apply code and kbd formatting")
    public void testCodeAndKbd() {
        List<RunDescriptor> runs = builder.build("ab",
                List.of(new InlineStyleRange("CODE", 0, 1), new InlineStyleRange("KBD", 1, 1)),
                List.of(), Map.of(), DEFAULTS);

        assertEquals("4472C4", runs.get(0).getColor());
        assertEquals("Times New Roman", runs.get(0).getFontName());
        assertEquals("E7E6E6", runs.get(1).getShading());
        assertEquals("Courier New", runs.get(1).getFontName());
        assertEquals(11.0, runs.get(1).getFontSize(), 0.001);
    }

    @Test
    @DisplayName("Should clip ranges that run past the end of the text")
    public void testRangePastEnd() {
        List<RunDescriptor> runs = builder.build("abc",
                List.of(new InlineStyleRange("UNDERLINE", 1, 10)), List.of(), Map.of(), DEFAULTS);

        assertEquals(3, runs.size());
        assertFalse(runs.get(0).isUnderline());
        assertTrue(runs.get(2).isUnderline());
    }

    @Test
    @DisplayName("Should ignore unknown style names")
    public void testUnknownStyle() {
        List<RunDescriptor> runs = builder.build("ab",
                List.of(new InlineStyleRange("SPARKLE", 0, 2)), List.of(), Map.of(), DEFAULTS);

        assertEquals(RunDescriptor.base("a", DEFAULTS), runs.get(0));
    }

    @Test
    @DisplayName("Should return no runs for empty text")
    public void testEmptyText() {
        assertTrue(builder.build("", List.of(new InlineStyleRange("BOLD", 0, 3)), List.of(), Map.of(), DEFAULTS).isEmpty());
        assertTrue(builder.build(null, List.of(), List.of(), Map.of(), DEFAULTS).isEmpty());
    }

    @Test
    @DisplayName("Should attach link targets from the entity map")
    public void testLinkEntity() {
        Map<String, Entity> entityMap = Map.of("0", Entity.builder()
                .type(Entity.LINK)
                .data(Entity.EntityData.builder().href("https://example.com").build())
                .build());

        List<RunDescriptor> runs = builder.build("go here",
                List.of(), List.of(new EntityRange("0", 3, 4)), entityMap, DEFAULTS);

        assertNull(runs.get(0).getHref());
        assertEquals("https://example.com", runs.get(3).getHref());
        assertEquals("https://example.com", runs.get(6).getHref());
    }

    @Test
    @DisplayName("Should put the image on the first character and strip the marker glyph")
    public void testImageEntity() {
        Map<String, Entity> entityMap = Map.of("img", Entity.builder()
                .type(Entity.IMG)
                .data(Entity.EntityData.builder().src("https://cdn.example.com/a.png").size(32).build())
                .build());
        String text = "x" + StyleResolver.IMAGE_MARKER + "y";

        List<RunDescriptor> runs = builder.build(text,
                List.of(), List.of(new EntityRange("img", 1, 1)), entityMap, DEFAULTS);

        assertEquals(3, runs.size());
        assertNotNull(runs.get(1).getImage());
        assertEquals(Integer.valueOf(32), runs.get(1).getImage().getSizePx());
        assertEquals("", runs.get(1).getText());
        assertEquals("y", runs.get(2).getText());
    }

    @Test
    @DisplayName("Should strip the variation selector when the image range covers it")
    public void testImageEntityWithVariationSelector() {
        Map<String, Entity> entityMap = Map.of("img", Entity.builder()
                .type(Entity.IMG)
                .data(Entity.EntityData.builder().src("https://cdn.example.com/a.png").size(32).build())
                .build());
        String text = StyleResolver.IMAGE_MARKER + "\uFE0F" + "z";

        List<RunDescriptor> runs = builder.build(text,
                List.of(), List.of(new EntityRange("img", 0, 2)), entityMap, DEFAULTS);

        assertEquals(3, runs.size());
        assertNotNull(runs.get(0).getImage());
        assertEquals("", runs.get(0).getText());
        assertNull(runs.get(1).getImage());
        assertEquals("", runs.get(1).getText());
        assertEquals("z", runs.get(2).getText());
    }

    @Test
    @DisplayName("Should count offsets in code points so ranges after an emoji stay aligned")
    public void testOffsetsAfterSupplementaryCharacter() {
        String text = "\uD83D\uDE00 ok";

        List<RunDescriptor> runs = builder.build(text,
                List.of(new InlineStyleRange("BOLD", 2, 2)), List.of(), Map.of(), DEFAULTS);

        assertEquals(4, runs.size());
        assertEquals("\uD83D\uDE00", runs.get(0).getText());
        assertFalse(runs.get(0).isBold());
        assertFalse(runs.get(1).isBold());
        assertEquals("o", runs.get(2).getText());
        assertTrue(runs.get(2).isBold());
        assertEquals("k", runs.get(3).getText());
        assertTrue(runs.get(3).isBold());
    }

    @Test
    @DisplayName("Should skip entity ranges whose key is missing from the entity map")
    public void testMissingEntity() {
        List<RunDescriptor> runs = builder.build("abc",
                List.of(), List.of(new EntityRange("nope", 0, 3)), Map.of(), DEFAULTS);

        assertNull(runs.get(0).getHref());
        assertNull(runs.get(0).getImage());
    }

    @Test
    @DisplayName("Should order collected ranges by offset and keep source order for ties")
    public void testCollectRangesOrdering() {
        List<StyleRange> ranges = builder.collectRanges(
                List.of(new InlineStyleRange("ITALIC", 4, 1), new InlineStyleRange("BOLD", 0, 2),
                        new InlineStyleRange("UNDERLINE", 0, 1)),
                List.of(), Map.of(), List.of(new StyleRange(StyleToken.headerStep(), 0, 5)));

        assertEquals(4, ranges.size());
        assertEquals("BOLD", ranges.get(0).getToken().getName());
        assertEquals("UNDERLINE", ranges.get(1).getToken().getName());
        assertEquals("header-step", ranges.get(2).getToken().getName());
        assertEquals("ITALIC", ranges.get(3).getToken().getName());
    }

    @Test
    @DisplayName("Should fall back to default formatting for a character whose style fails")
    public void testFailingInstructionResetsCharacter() {
        StyleResolver failing = new StyleResolver() {
            @Override
            public FormattingInstruction resolve(StyleToken token) {
                if (token.getKind() == StyleToken.Kind.ITALIC) {
                    return run -> {
                        throw new IllegalStateException("boom");
                    };
                }
                return super.resolve(token);
            }
        };
        TextRunBuilder failingBuilder = new TextRunBuilder(failing);

        List<RunDescriptor> runs = failingBuilder.build("ab",
                List.of(new InlineStyleRange("BOLD", 0, 2), new InlineStyleRange("ITALIC", 1, 1)),
                List.of(), Map.of(), DEFAULTS);

        assertTrue(runs.get(0).isBold());
        assertFalse(runs.get(1).isBold());
        assertFalse(runs.get(1).isItalic());
        assertEquals("b", runs.get(1).getText());
    }
}
