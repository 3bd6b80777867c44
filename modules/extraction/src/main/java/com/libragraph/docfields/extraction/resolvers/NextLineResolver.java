package com.libragraph.docfields.extraction.resolvers;

import com.libragraph.docfields.extraction.api.FieldResolver;
import com.libragraph.docfields.extraction.api.Strategy;
import com.libragraph.docfields.graph.Block;
import com.libragraph.docfields.graph.BlockGraph;
import com.libragraph.docfields.types.BlockType;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

/**
 * Resolves a field printed on the line below its label.
 *
 * <p>Finds the first LINE whose text equals the anchor and returns the text of
 * the next block, provided it is also a LINE with text. The scan stops at that
 * first match even when its follower is unusable, so a later repetition of the
 * label is never tried.
 */
@ApplicationScoped
public class NextLineResolver implements FieldResolver {

    @Override
    public Strategy strategy() {
        return Strategy.NEXT_LINE;
    }

    @Override
    public Optional<String> resolve(BlockGraph graph, String anchorKey) {
        for (int i = 0; i < graph.size(); i++) {
            Block block = graph.get(i);
            if (block.is(BlockType.LINE) && anchorKey.equals(block.text())) {
                // TODO: decide with schema owners whether to keep scanning past an unusable follower
                return graph.following(i)
                        .filter(next -> next.is(BlockType.LINE))
                        .flatMap(Block::optionalText);
            }
        }
        return Optional.empty();
    }
}
