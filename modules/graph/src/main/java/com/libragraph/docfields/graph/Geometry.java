package com.libragraph.docfields.graph;

import java.util.List;
import java.util.Objects;

/**
 * Position of a block on its page. Carried through untouched; no resolver reads it.
 *
 * @param boundingBox coarse box, or null when the service omitted it
 * @param polygon     fine-grained outline, possibly empty
 */
public record Geometry(BoundingBox boundingBox, List<Point> polygon) {
    public Geometry {
        polygon = polygon == null ? List.of() : polygon.stream().filter(Objects::nonNull).toList();
    }
}
