package com.libragraph.docfields.graph.textract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wire shape of a document-analysis response. Attribute names follow the
 * service's PascalCase convention; every attribute may be missing.
 * Converted to the domain model by {@link BlockGraphReader}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisResponse(
        @JsonProperty("DocumentMetadata") Metadata documentMetadata,
        @JsonProperty("Blocks") List<WireBlock> blocks
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(@JsonProperty("Pages") Integer pages) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WireBlock(
            @JsonProperty("BlockType") String blockType,
            @JsonProperty("Confidence") Double confidence,
            @JsonProperty("Text") String text,
            @JsonProperty("RowIndex") Integer rowIndex,
            @JsonProperty("ColumnIndex") Integer columnIndex,
            @JsonProperty("RowSpan") Integer rowSpan,
            @JsonProperty("ColumnSpan") Integer columnSpan,
            @JsonProperty("Geometry") WireGeometry geometry,
            @JsonProperty("Id") String id,
            @JsonProperty("Relationships") List<WireRelationship> relationships,
            @JsonProperty("EntityTypes") List<String> entityTypes,
            @JsonProperty("SelectionStatus") String selectionStatus,
            @JsonProperty("Page") Integer page
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WireGeometry(
            @JsonProperty("BoundingBox") WireBoundingBox boundingBox,
            @JsonProperty("Polygon") List<WirePoint> polygon
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WireBoundingBox(
            @JsonProperty("Width") double width,
            @JsonProperty("Height") double height,
            @JsonProperty("Left") double left,
            @JsonProperty("Top") double top
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WirePoint(@JsonProperty("X") double x, @JsonProperty("Y") double y) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WireRelationship(
            @JsonProperty("Type") String type,
            @JsonProperty("Ids") List<String> ids
    ) {
    }
}
