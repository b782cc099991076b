package com.example.docexport.core;

/**
 * Column count of a legacy table, encoded in the depth of its cell blocks
 */
public final class TableColumnPolicy {

    private TableColumnPolicy() {
    }

    public static int columnsForDepth(int depth) {
        switch (depth) {
            case 0:
                return 2;
            case 1:
                return 4;
            case 2:
                return 2;
            case 3:
                return 3;
            default:
                return 1;
        }
    }
}
