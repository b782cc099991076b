package com.example.docexport.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One unit of article content. The meaning of {@code data} depends on the type
 * (table columns, figure source, code label, ...).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Block {

    private String key;

    @Builder.Default
    private BlockType type = BlockType.UNSTYLED;

    @Builder.Default
    private String text = "";

    private int depth;

    @Builder.Default
    @JsonProperty("inlineStyleRanges")
    private List<InlineStyleRange> inlineStyleRanges = new ArrayList<>();

    @Builder.Default
    @JsonProperty("entityRanges")
    private List<EntityRange> entityRanges = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    /**
     * Block appended after the last block of every article so that open
     * tables and lists are finished off by a regular paragraph.
     */
    public static Block terminal() {
        return Block.builder().key("terminal").type(BlockType.UNSTYLED).text("").depth(0).build();
    }

    public String textOrEmpty() {
        return text == null ? "" : text;
    }

    public List<InlineStyleRange> inlineStylesOrEmpty() {
        return inlineStyleRanges == null ? List.of() : inlineStyleRanges;
    }

    public List<EntityRange> entitiesOrEmpty() {
        return entityRanges == null ? List.of() : entityRanges;
    }

    public String dataString(String name) {
        if (data == null) {
            return null;
        }
        Object value = data.get(name);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * Reads a nested value such as {@code table.cols}.
     */
    public Object dataPath(String... path) {
        Object current = data;
        for (String segment : path) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return current;
    }
}
