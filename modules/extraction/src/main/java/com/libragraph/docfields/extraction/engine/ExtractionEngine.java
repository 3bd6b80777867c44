package com.libragraph.docfields.extraction.engine;

import com.libragraph.docfields.extraction.api.DocumentSchema;
import com.libragraph.docfields.extraction.api.ExtractedInfo;
import com.libragraph.docfields.extraction.api.FieldResolver;
import com.libragraph.docfields.extraction.api.FieldStrategy;
import com.libragraph.docfields.extraction.registry.ResolverRegistry;
import com.libragraph.docfields.extraction.schema.SchemaRegistry;
import com.libragraph.docfields.graph.Block;
import com.libragraph.docfields.graph.BlockGraph;
import com.libragraph.docfields.graph.textract.BlockGraphReader;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Extracts the fields a document type's schema declares from a block graph.
 *
 * <p>Each field is resolved independently by the resolver registered for its
 * strategy; a field that cannot be resolved is simply left out. The document
 * as a whole fails only when its type is unknown or when no field at all could
 * be resolved.
 *
 * <p>Stateless apart from read-only collaborators, so concurrent calls are safe.
 */
@ApplicationScoped
public class ExtractionEngine {

    private static final Logger log = Logger.getLogger(ExtractionEngine.class);

    @Inject
    SchemaRegistry schemas;

    @Inject
    ResolverRegistry resolvers;

    @Inject
    BlockGraphReader reader;

    @ConfigProperty(name = "docfields.extraction.trace", defaultValue = "false")
    boolean trace;

    public ExtractionEngine() {
    }

    public ExtractionEngine(SchemaRegistry schemas, ResolverRegistry resolvers,
                            BlockGraphReader reader, boolean trace) {
        this.schemas = schemas;
        this.resolvers = resolvers;
        this.reader = reader;
        this.trace = trace;
    }

    /**
     * Extracts every field of {@code documentType}'s schema.
     *
     * @throws SchemaNotFoundException    if no schema is registered for the type
     * @throws NothingExtractedException  if no field could be resolved
     */
    public ExtractedInfo extract(String documentType, BlockGraph graph) {
        Objects.requireNonNull(graph, "graph cannot be null");
        DocumentSchema schema = schemas.find(documentType)
                .orElseThrow(() -> new SchemaNotFoundException(documentType));
        return extract(schema, graph);
    }

    /**
     * Decodes an analysis response and extracts from it.
     */
    public ExtractedInfo extract(String documentType, String analysisJson) {
        // Unknown types fail before the payload is decoded
        if (schemas.find(documentType).isEmpty()) {
            throw new SchemaNotFoundException(documentType);
        }
        return extract(documentType, reader.read(analysisJson));
    }

    /**
     * Extracts using an explicit schema, bypassing the registry.
     */
    public ExtractedInfo extract(DocumentSchema schema, BlockGraph graph) {
        Logger.Level level = trace ? Logger.Level.INFO : Logger.Level.DEBUG;
        log.logf(level, "Extracting '%s' (%d fields) from %s",
                schema.documentType(), schema.fields().size(), graph);

        Map<String, String> values = new HashMap<>();
        schema.fields().forEach((fieldName, field) ->
                resolveField(fieldName, field, graph, level).ifPresent(v -> values.put(fieldName, v)));

        if (values.isEmpty()) {
            if (trace) {
                dumpTextBlocks(graph);
            }
            throw new NothingExtractedException(schema.documentType(), graph);
        }

        log.logf(level, "Extracted %d of %d fields for '%s'",
                values.size(), schema.fields().size(), schema.documentType());
        return new ExtractedInfo(values);
    }

    private Optional<String> resolveField(String fieldName, FieldStrategy field, BlockGraph graph,
                                          Logger.Level level) {
        Optional<FieldResolver> resolver = resolvers.lookup(field.strategy());
        if (resolver.isEmpty()) {
            log.logf(level, "Field '%s': no resolver for strategy %s", fieldName, field.strategy());
            return Optional.empty();
        }

        Optional<String> value = resolver.get().resolve(graph, field.anchorKey())
                .filter(v -> !v.isBlank());
        if (value.isPresent()) {
            log.logf(level, "Field '%s': key '%s' via %s → '%s'",
                    fieldName, field.anchorKey(), field.strategy().label(), value.get());
        } else {
            log.logf(level, "Field '%s': key '%s' via %s → not found",
                    fieldName, field.anchorKey(), field.strategy().label());
        }
        return value;
    }

    private void dumpTextBlocks(BlockGraph graph) {
        log.infof("No information extracted; %d text blocks follow", graph.textBlocks().size());
        for (Block block : graph.textBlocks()) {
            log.infof("  %s: %s", block.type(), block.text());
        }
    }
}
