package com.libragraph.docfields.graph;

/**
 * Axis-aligned box around a block, as ratios of the page dimensions.
 */
public record BoundingBox(double width, double height, double left, double top) {
}
