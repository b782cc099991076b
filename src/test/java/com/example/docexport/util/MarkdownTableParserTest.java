package com.example.docexport.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Markdown Table Parser Tests")
public class MarkdownTableParserTest {

    @Test
    @DisplayName("Should split header and data rows and skip the divider")
    public void testSimpleTable() {
        MarkdownTableParser.ParsedTable table = MarkdownTableParser.parse("|h1|h2|\n|--|--|\n|a|b|\n");

        assertEquals(List.of("h1", "h2"), table.getHeader());
        assertEquals(2, table.getColumnCount());
        assertEquals(List.of(List.of("a", "b")), table.getRows());
        assertFalse(table.isEmpty());
    }

    @Test
    @DisplayName("Should trim cells, ignore blank lines and accept rows without outer pipes")
    public void testWhitespaceAndBlankLines() {
        MarkdownTableParser.ParsedTable table = MarkdownTableParser.parse(
                "\n| Name | Value |\r\n|------|-------|\r\n\n  one |  1  \n| two | 2 |\n");

        assertEquals(List.of("Name", "Value"), table.getHeader());
        assertEquals(2, table.getRows().size());
        assertEquals(List.of("one", "1"), table.getRows().get(0));
        assertEquals(List.of("two", "2"), table.getRows().get(1));
    }

    @Test
    @DisplayName("Should pad short rows and truncate long ones to the header width")
    public void testRaggedRows() {
        MarkdownTableParser.ParsedTable table = MarkdownTableParser.parse(
                "|a|b|c|\n|-|-|-|\n|1|\n|1|2|3|4|\n");

        assertEquals(List.of("1", "", ""), table.getRows().get(0));
        assertEquals(List.of("1", "2", "3"), table.getRows().get(1));
    }

    @Test
    @DisplayName("Should keep empty cells in the middle of a row")
    public void testEmptyCell() {
        MarkdownTableParser.ParsedTable table = MarkdownTableParser.parse("|a|b|c|\n|-|-|-|\n|1||3|\n");

        assertEquals(List.of("1", "", "3"), table.getRows().get(0));
    }

    @Test
    @DisplayName("A header without data rows is an empty table")
    public void testHeaderOnly() {
        assertTrue(MarkdownTableParser.parse("|h1|h2|\n|--|--|\n").isEmpty());
        assertTrue(MarkdownTableParser.parse("").isEmpty());
        assertTrue(MarkdownTableParser.parse(null).isEmpty());
    }
}
