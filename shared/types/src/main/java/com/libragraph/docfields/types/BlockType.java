package com.libragraph.docfields.types;

/**
 * Layout unit kinds reported by the document-analysis service.
 *
 * <p>The service adds kinds over time, so labels that are not listed here
 * decode to {@link #UNKNOWN} instead of failing.
 */
public enum BlockType {
    PAGE("PAGE"),
    LINE("LINE"),
    WORD("WORD"),
    KEY_VALUE_SET("KEY_VALUE_SET"),
    TABLE("TABLE"),
    CELL("CELL"),
    MERGED_CELL("MERGED_CELL"),
    SELECTION_ELEMENT("SELECTION_ELEMENT"),
    TITLE("TITLE"),
    QUERY("QUERY"),
    QUERY_RESULT("QUERY_RESULT"),
    SIGNATURE("SIGNATURE"),
    TABLE_TITLE("TABLE_TITLE"),
    TABLE_FOOTER("TABLE_FOOTER"),
    UNKNOWN("UNKNOWN");

    private final String label;

    BlockType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static BlockType fromLabel(String label) {
        if (label == null) return UNKNOWN;
        for (BlockType t : values()) {
            if (t.label.equals(label)) return t;
        }
        return UNKNOWN;
    }
}
