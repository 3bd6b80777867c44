package com.libragraph.docfields.graph.textract;

/**
 * Thrown when an analysis response cannot be read or is not valid JSON of the
 * expected shape.
 */
public class BlockGraphFormatException extends RuntimeException {

    public BlockGraphFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public BlockGraphFormatException(String message) {
        super(message);
    }
}
