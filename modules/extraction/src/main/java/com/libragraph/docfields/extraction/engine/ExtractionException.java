package com.libragraph.docfields.extraction.engine;

/**
 * Base class for document-level extraction failures.
 * A single field that cannot be resolved is not a failure.
 */
public class ExtractionException extends RuntimeException {

    private final String documentType;

    public ExtractionException(String documentType, String message) {
        super(message);
        this.documentType = documentType;
    }

    public String documentType() {
        return documentType;
    }
}
