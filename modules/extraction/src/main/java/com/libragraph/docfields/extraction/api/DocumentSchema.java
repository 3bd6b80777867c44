package com.libragraph.docfields.extraction.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declares the fields of one document type and how each one is located.
 * Immutable; fields are independent of each other and of their order.
 */
public record DocumentSchema(String documentType, Map<String, FieldStrategy> fields) {

    public DocumentSchema {
        Objects.requireNonNull(documentType, "documentType cannot be null");
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public static Builder builder(String documentType) {
        return new Builder(documentType);
    }

    /**
     * Copy of this schema without the named field.
     */
    public DocumentSchema withoutField(String fieldName) {
        Map<String, FieldStrategy> remaining = new LinkedHashMap<>(fields);
        remaining.remove(fieldName);
        return new DocumentSchema(documentType, remaining);
    }

    public static class Builder {
        private final String documentType;
        private final Map<String, FieldStrategy> fields = new LinkedHashMap<>();

        private Builder(String documentType) {
            this.documentType = documentType;
        }

        public Builder field(String name, String anchorKey, Strategy strategy) {
            fields.put(name, FieldStrategy.of(anchorKey, strategy));
            return this;
        }

        public Builder field(String name, FieldStrategy strategy) {
            fields.put(name, strategy);
            return this;
        }

        public DocumentSchema build() {
            return new DocumentSchema(documentType, fields);
        }
    }
}
