package com.libragraph.docfields.graph;

import com.libragraph.docfields.types.RelationshipType;

import java.util.List;
import java.util.Objects;

/**
 * Typed edge from one block to an ordered list of target block ids.
 * Targets are not guaranteed to exist in the graph.
 */
public record Relationship(RelationshipType type, List<String> ids) {
    public Relationship {
        Objects.requireNonNull(type, "type cannot be null");
        ids = ids == null ? List.of() : ids.stream().filter(Objects::nonNull).toList();
    }

    public static Relationship value(String... ids) {
        return new Relationship(RelationshipType.VALUE, List.of(ids));
    }

    public static Relationship child(String... ids) {
        return new Relationship(RelationshipType.CHILD, List.of(ids));
    }
}
