package com.libragraph.docfields.extraction.resolvers;

import com.libragraph.docfields.extraction.api.FieldResolver;
import com.libragraph.docfields.extraction.api.Strategy;
import com.libragraph.docfields.graph.Block;
import com.libragraph.docfields.graph.BlockGraph;
import com.libragraph.docfields.types.BlockType;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

/**
 * Resolves a {@code Label: value} field printed on a single line.
 *
 * <p>Returns whatever follows the first colon, trimmed, of the first LINE that
 * contains the anchor as a substring and carries a non-blank value after a
 * colon. Containing lines without one, such as headings, are skipped.
 */
@ApplicationScoped
public class SameLineResolver implements FieldResolver {

    private static final String SEPARATOR = ":";

    @Override
    public Strategy strategy() {
        return Strategy.SAME_LINE;
    }

    @Override
    public Optional<String> resolve(BlockGraph graph, String anchorKey) {
        return graph.blocksOfType(BlockType.LINE).stream()
                .filter(Block::hasText)
                .filter(line -> line.text().contains(anchorKey))
                .map(line -> afterSeparator(line.text()))
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static Optional<String> afterSeparator(String text) {
        String[] parts = text.split(SEPARATOR, 2);
        if (parts.length != 2) {
            return Optional.empty();
        }
        String value = parts[1].trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
