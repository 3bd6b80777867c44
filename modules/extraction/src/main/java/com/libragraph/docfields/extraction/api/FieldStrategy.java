package com.libragraph.docfields.extraction.api;

import java.util.Objects;

/**
 * How to find one field: the literal anchor text to search for and the
 * algorithm that turns a match into a value.
 */
public record FieldStrategy(String anchorKey, Strategy strategy) {

    public FieldStrategy {
        Objects.requireNonNull(anchorKey, "anchorKey cannot be null");
        strategy = strategy == null ? Strategy.UNKNOWN : strategy;
    }

    public static FieldStrategy of(String anchorKey, Strategy strategy) {
        return new FieldStrategy(anchorKey, strategy);
    }

    public static FieldStrategy of(String anchorKey, String strategyLabel) {
        return new FieldStrategy(anchorKey, Strategy.fromLabel(strategyLabel));
    }
}
