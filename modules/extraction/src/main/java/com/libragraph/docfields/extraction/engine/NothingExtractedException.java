package com.libragraph.docfields.extraction.engine;

import com.libragraph.docfields.graph.BlockGraph;

/**
 * Thrown when a schema matched but not a single field could be resolved.
 * Carries the input graph so callers can return or inspect the raw blocks.
 */
public class NothingExtractedException extends ExtractionException {

    private final transient BlockGraph graph;

    public NothingExtractedException(String documentType, BlockGraph graph) {
        super(documentType, "No information could be extracted from the document (type "
                + documentType + ", " + graph.size() + " blocks)");
        this.graph = graph;
    }

    public BlockGraph graph() {
        return graph;
    }
}
