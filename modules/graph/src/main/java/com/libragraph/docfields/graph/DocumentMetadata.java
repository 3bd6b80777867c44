package com.libragraph.docfields.graph;

/**
 * Document-level facts reported alongside the blocks.
 */
public record DocumentMetadata(int pages) {

    public static DocumentMetadata unknown() {
        return new DocumentMetadata(0);
    }
}
