package com.libragraph.docfields.extraction.resolvers;

import com.libragraph.docfields.extraction.api.FieldResolver;
import com.libragraph.docfields.extraction.api.Strategy;
import com.libragraph.docfields.graph.Block;
import com.libragraph.docfields.graph.BlockGraph;
import com.libragraph.docfields.types.BlockType;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a field laid out as a label cell with its value in the next column.
 *
 * <p>Finds the first CELL that contains the anchor and has grid coordinates,
 * then returns the text of the cell at the same row, one column to the right.
 * Vertical neighbours and wider offsets are not searched.
 */
@ApplicationScoped
public class TableResolver implements FieldResolver {

    @Override
    public Strategy strategy() {
        return Strategy.TABLE;
    }

    @Override
    public Optional<String> resolve(BlockGraph graph, String anchorKey) {
        List<Block> cells = graph.blocksOfType(BlockType.CELL);

        return cells.stream()
                .filter(Block::hasText)
                .filter(cell -> cell.text().contains(anchorKey))
                .filter(Block::hasCoordinates)
                .findFirst()
                .flatMap(anchor -> rightNeighbour(cells, anchor));
    }

    private static Optional<String> rightNeighbour(List<Block> cells, Block anchor) {
        int row = anchor.rowIndex();
        int column = anchor.columnIndex() + 1;
        return cells.stream()
                .filter(Block::hasText)
                .filter(Block::hasCoordinates)
                .filter(cell -> cell.rowIndex() == row && cell.columnIndex() == column)
                .map(Block::text)
                .findFirst();
    }
}
