package com.libragraph.docfields.types;

/**
 * Role tag carried by key/value and table blocks.
 * Only {@link #KEY} and {@link #VALUE} matter for field extraction.
 */
public enum EntityType {
    KEY("KEY"),
    VALUE("VALUE"),
    COLUMN_HEADER("COLUMN_HEADER"),
    TABLE_TITLE("TABLE_TITLE"),
    TABLE_FOOTER("TABLE_FOOTER"),
    TABLE_SECTION_TITLE("TABLE_SECTION_TITLE"),
    TABLE_SUMMARY("TABLE_SUMMARY"),
    STRUCTURED_TABLE("STRUCTURED_TABLE"),
    SEMI_STRUCTURED_TABLE("SEMI_STRUCTURED_TABLE"),
    UNKNOWN("UNKNOWN");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EntityType fromLabel(String label) {
        if (label == null) return UNKNOWN;
        for (EntityType t : values()) {
            if (t.label.equals(label)) return t;
        }
        return UNKNOWN;
    }
}
