package com.libragraph.docfields.extraction.api;

import com.libragraph.docfields.graph.BlockGraph;

import java.util.Optional;

/**
 * One lookup algorithm mapping an anchor key to a value inside a block graph.
 * Implementations should be stateless {@code @ApplicationScoped} CDI beans.
 */
public interface FieldResolver {

    /**
     * The strategy this resolver implements. Must be unique across resolvers.
     */
    Strategy strategy();

    /**
     * Attempts to resolve one field.
     *
     * @param graph     the document's blocks; never modified
     * @param anchorKey literal text to search for
     * @return the value, or empty when nothing matches. Never throws for a miss.
     */
    Optional<String> resolve(BlockGraph graph, String anchorKey);
}
