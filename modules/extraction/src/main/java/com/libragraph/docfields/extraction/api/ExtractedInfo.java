package com.libragraph.docfields.extraction.api;

import java.util.Map;
import java.util.Optional;

/**
 * Field values recovered from one document, keyed by field name.
 * A field that could not be found is absent; values are never empty.
 */
public record ExtractedInfo(Map<String, String> fields) {

    public ExtractedInfo {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
        if (fields.values().stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("ExtractedInfo values must not be empty");
        }
    }

    public Optional<String> get(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public boolean contains(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
