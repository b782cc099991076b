package com.example.docexport.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of content blocks an article is made of. The tag is the value
 * found in the article JSON; anything unrecognised maps to {@link #OTHER}.
 */
public enum BlockType {
    UNSTYLED("unstyled"),
    HEADER_TWO("header-two"),
    HEADER_THREE("header-three"),
    HEADER_STEP("header-step"),
    ORDERED_LIST_ITEM("ordered-list-item"),
    UNORDERED_LIST_ITEM("unordered-list-item"),
    FIGURE("figure"),
    MDTABLE("mdtable"),
    DICTIONARY("dictionary"),
    CELL("cell"),
    BLOCKQUOTE("blockquote"),
    CODE_BLOCK("code-block"),
    VIDEO("video"),
    GIST_BLOCK("gist-block"),
    SNIPPET("snippet"),
    OTHER("other");

    private final String tag;

    BlockType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static BlockType fromTag(String tag) {
        if (tag == null) {
            return UNSTYLED;
        }
        return Arrays.stream(values())
                .filter(t -> t.tag.equalsIgnoreCase(tag))
                .findFirst()
                .orElse(OTHER);
    }
}
