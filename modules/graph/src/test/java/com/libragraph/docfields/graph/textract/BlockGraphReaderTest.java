package com.libragraph.docfields.graph.textract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.docfields.graph.Block;
import com.libragraph.docfields.graph.BlockGraph;
import com.libragraph.docfields.types.BlockType;
import com.libragraph.docfields.types.EntityType;
import com.libragraph.docfields.types.RelationshipType;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class BlockGraphReaderTest {

    private final BlockGraphReader reader = new BlockGraphReader(new ObjectMapper());

    private BlockGraph readSample() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/analysis-sample.json")) {
            assertThat(in).as("analysis-sample.json on test classpath").isNotNull();
            return reader.read(in);
        }
    }

    @Test
    void shouldDecodeMetadataAndAllBlocksInOrder() throws Exception {
        BlockGraph graph = readSample();

        assertThat(graph.metadata().pages()).isEqualTo(1);
        assertThat(graph.size()).isEqualTo(9);
        assertThat(graph.get(0).type()).isEqualTo(BlockType.PAGE);
        assertThat(graph.get(1).text()).isEqualTo("Invoice Number");
        assertThat(graph.get(2).text()).isEqualTo("INV-1001");
    }

    @Test
    void shouldDecodeKeyValueRelationships() throws Exception {
        BlockGraph graph = readSample();

        Block key = graph.findById("kv-key-1").orElseThrow();
        assertThat(key.isKey()).isTrue();
        assertThat(key.targetIds(RelationshipType.VALUE)).containsExactly("kv-value-1");
        assertThat(key.targetIds(RelationshipType.CHILD)).containsExactly("word-9");
        assertThat(graph.valueTargets(key)).extracting(Block::text).containsExactly("42.00");

        Block value = graph.findById("kv-value-1").orElseThrow();
        assertThat(value.entityTypes()).containsExactly(EntityType.VALUE);
    }

    @Test
    void shouldDecodeCellCoordinates() throws Exception {
        Block cell = readSample().findById("cell-1-2").orElseThrow();

        assertThat(cell.type()).isEqualTo(BlockType.CELL);
        assertThat(cell.rowIndex()).isEqualTo(1);
        assertThat(cell.columnIndex()).isEqualTo(2);
        assertThat(cell.rowSpan()).isEqualTo(1);
    }

    @Test
    void shouldCarryGeometryThrough() throws Exception {
        BlockGraph graph = readSample();

        Block page = graph.findById("page-1").orElseThrow();
        assertThat(page.geometry().boundingBox().width()).isEqualTo(1.0);
        assertThat(page.geometry().polygon()).hasSize(4);
        assertThat(page.confidence()).isEqualTo(99.9);

        Block line = graph.findById("line-1").orElseThrow();
        assertThat(line.geometry().polygon()).isEmpty();
        assertThat(graph.findById("line-2").orElseThrow().geometry()).isNull();
    }

    @Test
    void shouldMapUnknownLabelsAndIgnoreUnknownAttributes() throws Exception {
        Block layout = readSample().findById("layout-1").orElseThrow();

        assertThat(layout.type()).isEqualTo(BlockType.UNKNOWN);
        assertThat(layout.hasText()).isFalse();
    }

    @Test
    void shouldTolerateMissingOptionalAttributes() {
        BlockGraph graph = reader.read("{\"Blocks\":[{\"BlockType\":\"LINE\"},{}]}");

        assertThat(graph.size()).isEqualTo(2);
        assertThat(graph.get(0).id()).isNull();
        assertThat(graph.get(0).text()).isNull();
        assertThat(graph.get(1).type()).isEqualTo(BlockType.UNKNOWN);
        assertThat(graph.metadata().pages()).isZero();
    }

    @Test
    void shouldTreatMissingBlocksAsEmptyGraph() {
        assertThat(reader.read("{\"DocumentMetadata\":{\"Pages\":2}}").isEmpty()).isTrue();
        assertThat(reader.read("{}").isEmpty()).isTrue();
        assertThat(reader.read("null").isEmpty()).isTrue();
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> reader.read("{\"Blocks\": [ {"))
                .isInstanceOf(BlockGraphFormatException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void shouldRejectWrongShape() {
        assertThatThrownBy(() -> reader.read("{\"Blocks\": \"not-an-array\"}"))
                .isInstanceOf(BlockGraphFormatException.class);
    }

    @Test
    void shouldReportMissingFile() {
        assertThatThrownBy(() -> reader.read(Path.of("does-not-exist.json")))
                .isInstanceOf(BlockGraphFormatException.class)
                .hasMessageContaining("does-not-exist.json");
    }
}
