package com.example.docexport.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses pipe-delimited markdown tables:
 *
 * <pre>
 * | h1 | h2 |
 * |----|----|
 * | a  | b  |
 * </pre>
 *
 * The first non-blank line is the header, the second (divider) is skipped and
 * the rest are data rows. Rows shorter than the header are padded with empty
 * strings, longer ones are truncated.
 */
public final class MarkdownTableParser {

    private MarkdownTableParser() {
    }

    public static ParsedTable parse(String text) {
        if (text == null) {
            return new ParsedTable(List.of(), List.of());
        }
        List<String> lines = Arrays.stream(text.split("\\r?\\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
        if (lines.isEmpty()) {
            return new ParsedTable(List.of(), List.of());
        }
        List<String> header = cells(lines.get(0));
        List<List<String>> rows = new ArrayList<>();
        for (int i = 2; i < lines.size(); i++) {
            List<String> values = cells(lines.get(i));
            List<String> row = new ArrayList<>(header.size());
            for (int c = 0; c < header.size(); c++) {
                row.add(c < values.size() ? values.get(c) : "");
            }
            rows.add(row);
        }
        return new ParsedTable(header, rows);
    }

    private static List<String> cells(String line) {
        String body = line;
        if (body.startsWith("|")) {
            body = body.substring(1);
        }
        if (body.endsWith("|")) {
            body = body.substring(0, body.length() - 1);
        }
        return Arrays.stream(body.split("\\|", -1))
                .map(String::trim)
                .collect(Collectors.toList());
    }

    public static class ParsedTable {
        private final List<String> header;
        private final List<List<String>> rows;

        public ParsedTable(List<String> header, List<List<String>> rows) {
            this.header = List.copyOf(header);
            this.rows = List.copyOf(rows);
        }

        public List<String> getHeader() {
            return header;
        }

        public List<List<String>> getRows() {
            return rows;
        }

        public int getColumnCount() {
            return header.size();
        }

        /**
         * Tables without data rows are not rendered
         */
        public boolean isEmpty() {
            return header.isEmpty() || rows.isEmpty();
        }
    }
}
