package com.libragraph.docfields.graph.textract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.docfields.graph.Block;
import com.libragraph.docfields.graph.BlockGraph;
import com.libragraph.docfields.graph.BoundingBox;
import com.libragraph.docfields.graph.DocumentMetadata;
import com.libragraph.docfields.graph.Geometry;
import com.libragraph.docfields.graph.Point;
import com.libragraph.docfields.graph.Relationship;
import com.libragraph.docfields.types.BlockType;
import com.libragraph.docfields.types.EntityType;
import com.libragraph.docfields.types.RelationshipType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Decodes a document-analysis response into a {@link BlockGraph}.
 *
 * <p>Tolerant by construction: missing attributes stay absent, unknown block,
 * entity and relationship labels become {@code UNKNOWN}, and a response
 * without a {@code Blocks} array yields an empty graph. Only input that is not
 * JSON of the expected shape is rejected.
 */
@ApplicationScoped
public class BlockGraphReader {

    private static final Logger log = Logger.getLogger(BlockGraphReader.class);

    @Inject
    ObjectMapper objectMapper;

    public BlockGraphReader() {
    }

    public BlockGraphReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public BlockGraph read(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return toGraph(objectMapper.readValue(json, AnalysisResponse.class));
        } catch (JsonProcessingException e) {
            throw new BlockGraphFormatException("Malformed analysis response: " + e.getOriginalMessage(), e);
        }
    }

    public BlockGraph read(InputStream in) {
        Objects.requireNonNull(in, "in cannot be null");
        try {
            return toGraph(objectMapper.readValue(in, AnalysisResponse.class));
        } catch (JsonProcessingException e) {
            throw new BlockGraphFormatException("Malformed analysis response: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new BlockGraphFormatException("Failed to read analysis response", e);
        }
    }

    public BlockGraph read(Path path) {
        Objects.requireNonNull(path, "path cannot be null");
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new BlockGraphFormatException("Failed to read analysis response from " + path, e);
        }
    }

    /**
     * Converts an already-decoded response to the domain model.
     */
    public BlockGraph toGraph(AnalysisResponse response) {
        if (response == null) {
            return BlockGraph.empty();
        }

        DocumentMetadata metadata = response.documentMetadata() == null
                || response.documentMetadata().pages() == null
                ? DocumentMetadata.unknown()
                : new DocumentMetadata(response.documentMetadata().pages());

        List<AnalysisResponse.WireBlock> wireBlocks = response.blocks() == null ? List.of() : response.blocks();
        List<Block> blocks = wireBlocks.stream()
                .filter(Objects::nonNull)
                .map(this::toBlock)
                .toList();

        BlockGraph graph = new BlockGraph(metadata, blocks);
        log.debugf("Decoded analysis response: %d pages, %d blocks", metadata.pages(), graph.size());
        return graph;
    }

    private Block toBlock(AnalysisResponse.WireBlock wire) {
        return Block.builder(BlockType.fromLabel(wire.blockType()))
                .id(wire.id())
                .text(wire.text())
                .confidence(wire.confidence())
                .geometry(toGeometry(wire.geometry()))
                .relationships(toRelationships(wire.relationships()))
                .entityTypes(wire.entityTypes() == null ? List.of()
                        : wire.entityTypes().stream().map(EntityType::fromLabel).toList())
                .rowIndex(wire.rowIndex())
                .columnIndex(wire.columnIndex())
                .rowSpan(wire.rowSpan())
                .columnSpan(wire.columnSpan())
                .selectionStatus(wire.selectionStatus())
                .page(wire.page())
                .build();
    }

    private static Geometry toGeometry(AnalysisResponse.WireGeometry wire) {
        if (wire == null) return null;
        BoundingBox box = wire.boundingBox() == null ? null : new BoundingBox(
                wire.boundingBox().width(),
                wire.boundingBox().height(),
                wire.boundingBox().left(),
                wire.boundingBox().top());
        List<Point> polygon = wire.polygon() == null ? List.of() : wire.polygon().stream()
                .filter(Objects::nonNull)
                .map(p -> new Point(p.x(), p.y()))
                .toList();
        return new Geometry(box, polygon);
    }

    private static List<Relationship> toRelationships(List<AnalysisResponse.WireRelationship> wire) {
        if (wire == null) return List.of();
        return wire.stream()
                .filter(Objects::nonNull)
                .map(r -> new Relationship(RelationshipType.fromLabel(r.type()), r.ids()))
                .toList();
    }
}
