package com.libragraph.docfields.extraction.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.docfields.extraction.api.DocumentSchema;
import com.libragraph.docfields.extraction.api.FieldStrategy;
import com.libragraph.docfields.extraction.api.Strategy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes the schema configuration file.
 *
 * <p>Format: an object keyed by document type, each value
 * {@code {"type": ..., "fields": {name: {"key": anchor, "strategy": label}}}}.
 * Unknown strategy labels are kept as {@link Strategy#UNKNOWN} so the field
 * simply never resolves; structural problems fail the load.
 */
@ApplicationScoped
public class SchemaLoader {

    private static final Logger log = Logger.getLogger(SchemaLoader.class);

    private static final TypeReference<LinkedHashMap<String, SchemaEntry>> SCHEMA_FILE =
            new TypeReference<>() {
            };

    @Inject
    ObjectMapper objectMapper;

    public SchemaLoader() {
    }

    public SchemaLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, DocumentSchema> load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read schema file " + path, e);
        }
    }

    /**
     * Loads schemas from a classpath resource.
     */
    public Map<String, DocumentSchema> loadResource(String resourceName) {
        String name = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = SchemaLoader.class.getClassLoader();
        }
        try (InputStream in = cl.getResourceAsStream(name)) {
            if (in == null) {
                throw new SchemaLoadException("Schema resource not found on classpath: " + name);
            }
            return load(in, "classpath:" + name);
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read schema resource " + name, e);
        }
    }

    public Map<String, DocumentSchema> load(InputStream in, String source) {
        Map<String, SchemaEntry> entries;
        try {
            entries = objectMapper.readValue(in, SCHEMA_FILE);
        } catch (JsonProcessingException e) {
            throw new SchemaLoadException("Malformed schema file " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read schema file " + source, e);
        }
        if (entries == null) {
            throw new SchemaLoadException("Schema file " + source + " is empty");
        }

        Map<String, DocumentSchema> schemas = new LinkedHashMap<>();
        entries.forEach((documentType, entry) -> schemas.put(documentType, toSchema(documentType, entry, source)));
        return Map.copyOf(schemas);
    }

    private DocumentSchema toSchema(String documentType, SchemaEntry entry, String source) {
        if (entry == null) {
            throw new SchemaLoadException("Schema '" + documentType + "' in " + source + " has no definition");
        }
        if (entry.type() != null && !entry.type().equals(documentType)) {
            log.warnf("Schema '%s' in %s declares type '%s'; it is registered under '%s'",
                    documentType, source, entry.type(), documentType);
        }

        Map<String, FieldStrategy> fields = new LinkedHashMap<>();
        if (entry.fields() != null) {
            entry.fields().forEach((fieldName, field) ->
                    fields.put(fieldName, toField(documentType, fieldName, field, source)));
        }
        if (fields.isEmpty()) {
            log.warnf("Schema '%s' in %s declares no fields; every extraction will fail", documentType, source);
        }
        return new DocumentSchema(documentType, fields);
    }

    private FieldStrategy toField(String documentType, String fieldName, FieldEntry field, String source) {
        if (field == null || field.key() == null || field.key().isBlank()) {
            throw new SchemaLoadException("Field '" + fieldName + "' of schema '" + documentType
                    + "' in " + source + " has no anchor key");
        }
        Strategy strategy = Strategy.fromLabel(field.strategy());
        if (strategy == Strategy.UNKNOWN) {
            log.warnf("Field '%s' of schema '%s' uses unknown strategy '%s'; it will never resolve",
                    fieldName, documentType, field.strategy());
        }
        return new FieldStrategy(field.key(), strategy);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SchemaEntry(String type, Map<String, FieldEntry> fields) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FieldEntry(String key, String strategy) {
    }
}
