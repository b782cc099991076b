package com.example.docexport.core;

/**
 * Maps list item depth to the level of the "List Number n" / "List Bullet n"
 * paragraph style. Ordered lists only have styles up to level 4; deeper items
 * fall back to level 3.
 */
public final class ListLevelPolicy {

    private static final int MAX_ORDERED_LEVEL = 4;
    private static final int ORDERED_FALLBACK_LEVEL = 3;

    private ListLevelPolicy() {
    }

    public static int orderedLevel(int depth) {
        int level = depth + 2;
        return level <= MAX_ORDERED_LEVEL ? level : ORDERED_FALLBACK_LEVEL;
    }

    public static int unorderedLevel(int depth) {
        return depth + 2;
    }
}
