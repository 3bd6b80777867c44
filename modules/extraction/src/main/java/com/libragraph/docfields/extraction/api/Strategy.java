package com.libragraph.docfields.extraction.api;

import java.util.Locale;

/**
 * The lookup algorithms a schema field can name.
 *
 * <p>Configuration uses camel-case labels ({@code keyValueSet}, {@code nextLine},
 * {@code sameLine}, {@code table}). Parsing ignores case and underscores, so
 * {@code KeyValueSet} and {@code KEY_VALUE_SET} are accepted too. Anything else
 * parses to {@link #UNKNOWN}, which no resolver serves.
 */
public enum Strategy {
    KEY_VALUE_SET("keyValueSet"),
    NEXT_LINE("nextLine"),
    SAME_LINE("sameLine"),
    TABLE("table"),
    UNKNOWN("unknown");

    private final String label;

    Strategy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Strategy fromLabel(String label) {
        if (label == null) return UNKNOWN;
        String normalized = normalize(label);
        for (Strategy s : values()) {
            if (s != UNKNOWN && normalize(s.label).equals(normalized)) return s;
        }
        return UNKNOWN;
    }

    private static String normalize(String label) {
        return label.trim().replace("_", "").toLowerCase(Locale.ROOT);
    }
}
