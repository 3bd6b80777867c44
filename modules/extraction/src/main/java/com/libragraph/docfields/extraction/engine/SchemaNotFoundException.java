package com.libragraph.docfields.extraction.engine;

/**
 * Thrown when extraction is requested for a document type with no registered schema.
 */
public class SchemaNotFoundException extends ExtractionException {

    public SchemaNotFoundException(String documentType) {
        super(documentType, "Schema not found for document type " + documentType);
    }
}
