package com.libragraph.docfields.graph;

import com.libragraph.docfields.types.BlockType;
import com.libragraph.docfields.types.RelationshipType;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over the blocks of one analyzed document.
 *
 * <p>Blocks keep the order in which the analysis service returned them. That
 * order only approximates reading order, so positional lookups such as
 * {@link #following(int)} are heuristics: resolvers use them as a fallback
 * when the graph carries no explicit relationship.
 *
 * <p>Built once per document and never mutated; safe to share across threads.
 */
public final class BlockGraph {

    private static final BlockGraph EMPTY = new BlockGraph(DocumentMetadata.unknown(), List.of());

    private final DocumentMetadata metadata;
    private final List<Block> blocks;
    private final Map<String, Integer> positionsById;

    public BlockGraph(DocumentMetadata metadata, List<Block> blocks) {
        this.metadata = metadata == null ? DocumentMetadata.unknown() : metadata;
        this.blocks = blocks == null ? List.of() : blocks.stream().filter(Objects::nonNull).toList();

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < this.blocks.size(); i++) {
            String id = this.blocks.get(i).id();
            if (id != null) {
                // First occurrence wins on duplicate ids
                index.putIfAbsent(id, i);
            }
        }
        this.positionsById = Collections.unmodifiableMap(index);
    }

    public static BlockGraph empty() {
        return EMPTY;
    }

    public static BlockGraph of(Block... blocks) {
        return new BlockGraph(DocumentMetadata.unknown(), Arrays.asList(blocks));
    }

    public static BlockGraph of(List<Block> blocks) {
        return new BlockGraph(DocumentMetadata.unknown(), blocks);
    }

    public DocumentMetadata metadata() {
        return metadata;
    }

    public List<Block> blocks() {
        return blocks;
    }

    public int size() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public Block get(int position) {
        return blocks.get(position);
    }

    /**
     * Looks up a block by id. Unknown, dangling and null ids yield empty.
     */
    public Optional<Block> findById(String id) {
        if (id == null) return Optional.empty();
        Integer position = positionsById.get(id);
        return position == null ? Optional.empty() : Optional.of(blocks.get(position));
    }

    /**
     * All blocks of the given type, in input order.
     */
    public List<Block> blocksOfType(BlockType type) {
        return blocks.stream().filter(b -> b.type() == type).toList();
    }

    /**
     * The block directly after {@code position} in input order, if any.
     */
    public Optional<Block> following(int position) {
        int next = position + 1;
        return next >= 0 && next < blocks.size() ? Optional.of(blocks.get(next)) : Optional.empty();
    }

    /**
     * Blocks referenced by the VALUE relationships of {@code block}, in order.
     * Dangling ids are skipped.
     */
    public List<Block> valueTargets(Block block) {
        return block.targetIds(RelationshipType.VALUE).stream()
                .map(this::findById)
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * Every block that carries text, in input order.
     */
    public List<Block> textBlocks() {
        return blocks.stream().filter(Block::hasText).toList();
    }

    @Override
    public String toString() {
        return "BlockGraph[pages=" + metadata.pages() + ", blocks=" + blocks.size() + "]";
    }
}
