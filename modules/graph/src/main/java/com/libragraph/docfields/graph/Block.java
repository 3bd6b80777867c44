package com.libragraph.docfields.graph;

import com.libragraph.docfields.types.BlockType;
import com.libragraph.docfields.types.EntityType;
import com.libragraph.docfields.types.RelationshipType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One recognized unit of document layout: a line, a word, one half of a
 * key/value pair, a table cell, and so on.
 *
 * <p>Everything except {@code type} is optional because the analysis service
 * only fills in what applies to the block kind. Nullable components stay null
 * rather than being defaulted, so "absent" and "zero" remain distinguishable.
 *
 * @param id              identifier, unique within one graph (null if the service omitted it)
 * @param type            block kind, {@link BlockType#UNKNOWN} for unrecognized labels
 * @param text            recognized text, or null for structural blocks
 * @param confidence      recognition confidence in percent, or null
 * @param geometry        position on the page, or null
 * @param relationships   outgoing edges in service order
 * @param entityTypes     role tags; the first one decides key vs value
 * @param rowIndex        1-based table row, cells only
 * @param columnIndex     1-based table column, cells only
 * @param rowSpan         rows covered by a cell
 * @param columnSpan      columns covered by a cell
 * @param selectionStatus SELECTED / NOT_SELECTED for selection elements
 * @param page            page number for multi-page documents
 */
public record Block(
        String id,
        BlockType type,
        String text,
        Double confidence,
        Geometry geometry,
        List<Relationship> relationships,
        List<EntityType> entityTypes,
        Integer rowIndex,
        Integer columnIndex,
        Integer rowSpan,
        Integer columnSpan,
        String selectionStatus,
        Integer page
) {
    public Block {
        type = type == null ? BlockType.UNKNOWN : type;
        relationships = relationships == null ? List.of()
                : relationships.stream().filter(Objects::nonNull).toList();
        entityTypes = entityTypes == null ? List.of()
                : entityTypes.stream().filter(Objects::nonNull).toList();
    }

    public static Builder builder(BlockType type) {
        return new Builder(type);
    }

    /**
     * A LINE block with the given text.
     */
    public static Block line(String id, String text) {
        return builder(BlockType.LINE).id(id).text(text).build();
    }

    /**
     * A KEY half of a key/value pair whose value lives in the given blocks.
     */
    public static Block key(String id, String text, String... valueIds) {
        Builder b = builder(BlockType.KEY_VALUE_SET).id(id).text(text).entityTypes(EntityType.KEY);
        if (valueIds.length > 0) {
            b.relationship(Relationship.value(valueIds));
        }
        return b.build();
    }

    /**
     * A VALUE half of a key/value pair.
     */
    public static Block value(String id, String text) {
        return builder(BlockType.KEY_VALUE_SET).id(id).text(text).entityTypes(EntityType.VALUE).build();
    }

    /**
     * A table CELL at the given 1-based grid position.
     */
    public static Block cell(String id, int row, int column, String text) {
        return builder(BlockType.CELL).id(id).text(text).rowIndex(row).columnIndex(column).build();
    }

    public boolean is(BlockType expected) {
        return type == expected;
    }

    /**
     * True when the block carries non-empty text. Empty strings count as absent.
     */
    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public Optional<String> optionalText() {
        return hasText() ? Optional.of(text) : Optional.empty();
    }

    /**
     * True for a KEY_VALUE_SET block whose first entity type is KEY.
     */
    public boolean isKey() {
        return type == BlockType.KEY_VALUE_SET
                && !entityTypes.isEmpty()
                && entityTypes.get(0) == EntityType.KEY;
    }

    public boolean hasCoordinates() {
        return rowIndex != null && columnIndex != null;
    }

    /**
     * Target ids of every relationship of the given type, in order.
     */
    public List<String> targetIds(RelationshipType relationshipType) {
        return relationships.stream()
                .filter(r -> r.type() == relationshipType)
                .flatMap(r -> r.ids().stream())
                .toList();
    }

    public static class Builder {
        private final BlockType type;
        private String id;
        private String text;
        private Double confidence;
        private Geometry geometry;
        private final List<Relationship> relationships = new ArrayList<>();
        private List<EntityType> entityTypes = List.of();
        private Integer rowIndex;
        private Integer columnIndex;
        private Integer rowSpan;
        private Integer columnSpan;
        private String selectionStatus;
        private Integer page;

        private Builder(BlockType type) {
            this.type = type;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder confidence(Double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder geometry(Geometry geometry) {
            this.geometry = geometry;
            return this;
        }

        public Builder relationship(Relationship relationship) {
            this.relationships.add(relationship);
            return this;
        }

        public Builder relationships(List<Relationship> relationships) {
            this.relationships.clear();
            if (relationships != null) {
                this.relationships.addAll(relationships);
            }
            return this;
        }

        public Builder entityTypes(EntityType... entityTypes) {
            this.entityTypes = Arrays.asList(entityTypes);
            return this;
        }

        public Builder entityTypes(List<EntityType> entityTypes) {
            this.entityTypes = entityTypes;
            return this;
        }

        public Builder rowIndex(Integer rowIndex) {
            this.rowIndex = rowIndex;
            return this;
        }

        public Builder columnIndex(Integer columnIndex) {
            this.columnIndex = columnIndex;
            return this;
        }

        public Builder rowSpan(Integer rowSpan) {
            this.rowSpan = rowSpan;
            return this;
        }

        public Builder columnSpan(Integer columnSpan) {
            this.columnSpan = columnSpan;
            return this;
        }

        public Builder selectionStatus(String selectionStatus) {
            this.selectionStatus = selectionStatus;
            return this;
        }

        public Builder page(Integer page) {
            this.page = page;
            return this;
        }

        public Block build() {
            return new Block(id, type, text, confidence, geometry, relationships, entityTypes,
                    rowIndex, columnIndex, rowSpan, columnSpan, selectionStatus, page);
        }
    }
}
