package com.libragraph.docfields.types;

/**
 * Edge kinds between blocks. A KEY block reaches its value through {@link #VALUE}.
 */
public enum RelationshipType {
    VALUE("VALUE"),
    CHILD("CHILD"),
    COMPLEX_FEATURES("COMPLEX_FEATURES"),
    MERGED_CELL("MERGED_CELL"),
    TITLE("TITLE"),
    ANSWER("ANSWER"),
    TABLE("TABLE"),
    TABLE_TITLE("TABLE_TITLE"),
    TABLE_FOOTER("TABLE_FOOTER"),
    UNKNOWN("UNKNOWN");

    private final String label;

    RelationshipType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static RelationshipType fromLabel(String label) {
        if (label == null) return UNKNOWN;
        for (RelationshipType t : values()) {
            if (t.label.equals(label)) return t;
        }
        return UNKNOWN;
    }
}
