package com.libragraph.docfields.extraction.resolvers;

import com.libragraph.docfields.extraction.api.Strategy;
import com.libragraph.docfields.graph.Block;
import com.libragraph.docfields.graph.BlockGraph;
import com.libragraph.docfields.graph.Relationship;
import com.libragraph.docfields.types.BlockType;
import com.libragraph.docfields.types.EntityType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class KeyValueSetResolverTest {

    private final KeyValueSetResolver resolver = new KeyValueSetResolver();

    @Test
    void shouldServeKeyValueSetStrategy() {
        assertThat(resolver.strategy()).isEqualTo(Strategy.KEY_VALUE_SET);
    }

    @Test
    void shouldFollowValueRelationship() {
        BlockGraph graph = BlockGraph.of(
                Block.key("k1", "Total", "v1"),
                Block.value("v1", "42.00"));

        assertThat(resolver.resolve(graph, "Total")).contains("42.00");
    }

    @Test
    void shouldMatchKeyTextExactlyAndCaseSensitively() {
        BlockGraph graph = BlockGraph.of(
                Block.key("k1", "Total", "v1"),
                Block.value("v1", "42.00"));

        assertThat(resolver.resolve(graph, "total")).isEmpty();
        assertThat(resolver.resolve(graph, "Tot")).isEmpty();
    }

    @Test
    void shouldSkipValueTargetsWithoutText() {
        BlockGraph graph = BlockGraph.of(
                Block.key("k1", "Total", "v-empty", "v-text"),
                Block.value("v-empty", null),
                Block.value("v-text", "42.00"));

        assertThat(resolver.resolve(graph, "Total")).contains("42.00");
    }

    @Test
    void shouldTolerateDanglingValueIds() {
        BlockGraph graph = BlockGraph.of(
                Block.key("k1", "Total", "gone"),
                Block.value("v1", "unrelated"));

        assertThat(resolver.resolve(graph, "Total")).isEmpty();
    }

    @Test
    void shouldFallBackToFollowingLineWhenNoRelationshipYieldsText() {
        // Positional fallback: only meaningful when input order follows reading order
        BlockGraph graph = BlockGraph.of(
                Block.key("k1", "Total"),
                Block.line("l1", "42.00"));

        assertThat(resolver.resolve(graph, "Total")).contains("42.00");
    }

    @Test
    void shouldNotFallBackToNonLineFollower() {
        BlockGraph graph = BlockGraph.of(
                Block.key("k1", "Total"),
                Block.cell("c1", 1, 1, "42.00"));

        assertThat(resolver.resolve(graph, "Total")).isEmpty();
    }

    @Test
    void shouldNotFallBackToLineWithoutText() {
        BlockGraph graph = BlockGraph.of(
                Block.key("k1", "Total"),
                Block.line("l1", null));

        assertThat(resolver.resolve(graph, "Total")).isEmpty();
    }

    @Test
    void shouldUseOnlyFirstMatchingKey() {
        BlockGraph graph = BlockGraph.of(
                Block.key("k1", "Total"),
                Block.cell("c1", 1, 1, "not a line"),
                Block.key("k2", "Total", "v2"),
                Block.value("v2", "99.00"));

        assertThat(resolver.resolve(graph, "Total")).isEmpty();
    }

    @Test
    void shouldIgnoreValueRoleAndPlainLines() {
        BlockGraph graph = BlockGraph.of(
                Block.value("v0", "Total"),
                Block.line("l0", "Total"),
                Block.line("l1", "42.00"));

        assertThat(resolver.resolve(graph, "Total")).isEmpty();
    }

    @Test
    void shouldIgnoreKeysWhoseFirstEntityTypeIsNotKey() {
        Block mixed = Block.builder(BlockType.KEY_VALUE_SET)
                .id("k1")
                .text("Total")
                .entityTypes(EntityType.VALUE, EntityType.KEY)
                .relationship(Relationship.value("v1"))
                .build();
        BlockGraph graph = BlockGraph.of(mixed, Block.value("v1", "42.00"));

        assertThat(resolver.resolve(graph, "Total")).isEmpty();
    }

    @Test
    void shouldReturnEmptyForEmptyGraph() {
        assertThat(resolver.resolve(BlockGraph.empty(), "Total")).isEmpty();
    }
}
