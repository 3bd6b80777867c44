package com.libragraph.docfields.graph;

import com.libragraph.docfields.types.BlockType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BlockGraphTest {

    @Test
    void findByIdReturnsIndexedBlock() {
        Block line = Block.line("l1", "Hello");
        BlockGraph graph = BlockGraph.of(Block.line("l0", "first"), line);

        assertThat(graph.findById("l1")).contains(line);
    }

    @Test
    void findByIdToleratesUnknownAndNullIds() {
        BlockGraph graph = BlockGraph.of(Block.line("l1", "Hello"));

        assertThat(graph.findById("missing")).isEmpty();
        assertThat(graph.findById(null)).isEmpty();
        assertThat(BlockGraph.empty().findById("l1")).isEmpty();
    }

    @Test
    void duplicateIdsResolveToFirstOccurrence() {
        Block first = Block.line("dup", "first");
        Block second = Block.line("dup", "second");
        BlockGraph graph = BlockGraph.of(first, second);

        assertThat(graph.findById("dup")).contains(first);
        assertThat(graph.size()).isEqualTo(2);
    }

    @Test
    void blocksOfTypePreservesInputOrder() {
        Block a = Block.line("a", "A");
        Block cell = Block.cell("c", 1, 1, "C");
        Block b = Block.line("b", "B");
        BlockGraph graph = BlockGraph.of(a, cell, b);

        assertThat(graph.blocksOfType(BlockType.LINE)).containsExactly(a, b);
        assertThat(graph.blocksOfType(BlockType.CELL)).containsExactly(cell);
        assertThat(graph.blocksOfType(BlockType.TABLE)).isEmpty();
    }

    @Test
    void followingReturnsNextBlockOrEmptyAtEnd() {
        Block a = Block.line("a", "A");
        Block b = Block.line("b", "B");
        BlockGraph graph = BlockGraph.of(a, b);

        assertThat(graph.following(0)).contains(b);
        assertThat(graph.following(1)).isEmpty();
        assertThat(graph.following(-2)).isEmpty();
    }

    @Test
    void valueTargetsSkipsDanglingIds() {
        Block key = Block.key("k", "Total", "missing", "v");
        Block value = Block.value("v", "42.00");
        BlockGraph graph = BlockGraph.of(key, value);

        assertThat(graph.valueTargets(key)).containsExactly(value);
    }

    @Test
    void textBlocksSkipsStructuralBlocks() {
        Block page = Block.builder(BlockType.PAGE).id("p").build();
        Block line = Block.line("l", "text");
        BlockGraph graph = BlockGraph.of(page, line, Block.line("e", ""));

        assertThat(graph.textBlocks()).containsExactly(line);
    }

    @Test
    void isImmutableAgainstSourceListChanges() {
        List<Block> source = new ArrayList<>();
        source.add(Block.line("a", "A"));
        BlockGraph graph = BlockGraph.of(source);

        source.add(Block.line("b", "B"));

        assertThat(graph.size()).isEqualTo(1);
        assertThatThrownBy(() -> graph.blocks().add(Block.line("c", "C")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullBlocksAreDroppedFromEitherFactory() {
        BlockGraph fromVarargs = BlockGraph.of(Block.line("a", "A"), null, Block.line("b", "B"));
        BlockGraph fromList = BlockGraph.of(Arrays.asList(null, Block.line("a", "A")));

        assertThat(fromVarargs.size()).isEqualTo(2);
        assertThat(fromVarargs.findById("b")).isPresent();
        assertThat(fromList.size()).isEqualTo(1);
    }

    @Test
    void emptyGraphHasUnknownMetadata() {
        assertThat(BlockGraph.empty().isEmpty()).isTrue();
        assertThat(BlockGraph.empty().metadata().pages()).isZero();
    }
}
