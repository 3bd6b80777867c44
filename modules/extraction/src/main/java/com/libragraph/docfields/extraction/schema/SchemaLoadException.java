package com.libragraph.docfields.extraction.schema;

/**
 * Thrown when the schema configuration cannot be read or is invalid.
 * Raised during startup; the application does not start without schemas.
 */
public class SchemaLoadException extends RuntimeException {

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public SchemaLoadException(String message) {
        super(message);
    }
}
