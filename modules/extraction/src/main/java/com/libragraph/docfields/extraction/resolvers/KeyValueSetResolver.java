package com.libragraph.docfields.extraction.resolvers;

import com.libragraph.docfields.extraction.api.FieldResolver;
import com.libragraph.docfields.extraction.api.Strategy;
import com.libragraph.docfields.graph.Block;
import com.libragraph.docfields.graph.BlockGraph;
import com.libragraph.docfields.types.BlockType;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

/**
 * Resolves a field from a detected key/value pair.
 *
 * <p>Finds the first KEY block whose text equals the anchor exactly and returns
 * the first text-bearing block reachable through its VALUE relationships. When
 * the pair carries no usable relationship, the block directly after the key is
 * taken instead, but only if it is a LINE with text. That positional fallback
 * assumes input order approximates reading order.
 *
 * <p>Only the first matching key is considered; later duplicates are ignored.
 */
@ApplicationScoped
public class KeyValueSetResolver implements FieldResolver {

    @Override
    public Strategy strategy() {
        return Strategy.KEY_VALUE_SET;
    }

    @Override
    public Optional<String> resolve(BlockGraph graph, String anchorKey) {
        for (int i = 0; i < graph.size(); i++) {
            Block block = graph.get(i);
            if (!block.isKey() || !anchorKey.equals(block.text())) {
                continue;
            }

            Optional<String> linked = graph.valueTargets(block).stream()
                    .filter(Block::hasText)
                    .map(Block::text)
                    .findFirst();
            if (linked.isPresent()) {
                return linked;
            }

            return graph.following(i)
                    .filter(next -> next.is(BlockType.LINE))
                    .flatMap(Block::optionalText);
        }
        return Optional.empty();
    }
}
