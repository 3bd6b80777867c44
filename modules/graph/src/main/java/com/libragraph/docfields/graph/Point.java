package com.libragraph.docfields.graph;

/**
 * One polygon vertex, as a ratio of page width/height.
 */
public record Point(double x, double y) {
}
