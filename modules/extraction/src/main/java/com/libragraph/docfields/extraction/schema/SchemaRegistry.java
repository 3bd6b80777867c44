package com.libragraph.docfields.extraction.schema;

import com.libragraph.docfields.extraction.api.DocumentSchema;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Document schemas keyed by document type.
 *
 * <p>Loaded once at startup, from {@code docfields.schemas.file} when set and
 * otherwise from the classpath resource {@code docfields.schemas.resource}.
 * The mapping is immutable afterwards, so lookups need no synchronization.
 */
@ApplicationScoped
@Startup
public class SchemaRegistry {

    private static final Logger log = Logger.getLogger(SchemaRegistry.class);

    @Inject
    SchemaLoader loader;

    @ConfigProperty(name = "docfields.schemas.file")
    Optional<String> schemaFile;

    @ConfigProperty(name = "docfields.schemas.resource", defaultValue = "schemas.json")
    String schemaResource;

    private Map<String, DocumentSchema> schemas = Map.of();

    /**
     * Builds a registry outside the container, e.g. for unit tests.
     */
    public static SchemaRegistry of(Map<String, DocumentSchema> schemas) {
        SchemaRegistry registry = new SchemaRegistry();
        registry.schemas = Map.copyOf(schemas);
        return registry;
    }

    public static SchemaRegistry of(DocumentSchema... schemas) {
        return of(Arrays.stream(schemas)
                .collect(Collectors.toMap(DocumentSchema::documentType, Function.identity())));
    }

    @PostConstruct
    void init() {
        if (schemaFile.isPresent() && !schemaFile.get().isBlank()) {
            Path path = Path.of(schemaFile.get());
            schemas = loader.load(path);
            log.infof("Loaded %d document schemas from %s: %s", schemas.size(), path, schemas.keySet());
        } else {
            schemas = loader.loadResource(schemaResource);
            log.infof("Loaded %d document schemas from classpath:%s: %s",
                    schemas.size(), schemaResource, schemas.keySet());
        }
    }

    public Optional<DocumentSchema> find(String documentType) {
        if (documentType == null) return Optional.empty();
        return Optional.ofNullable(schemas.get(documentType));
    }

    public Set<String> documentTypes() {
        return schemas.keySet();
    }

    public int size() {
        return schemas.size();
    }
}
