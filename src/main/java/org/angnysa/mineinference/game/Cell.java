package org.angnysa.mineinference.game;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Comparator;
import java.util.function.Consumer;

/**
 * Coordinates of a single cell of a {@link MineField}. Instances are
 * immutable and compared by value.
 */
@Getter
@RequiredArgsConstructor(staticName = "of")
@EqualsAndHashCode
public final class Cell implements Comparable<Cell> {

    private static final Comparator<Cell> ORDER = Comparator
            .comparingInt(Cell::getRow)
            .thenComparingInt(Cell::getColumn);

    private final int row;
    private final int column;

    /**
     * Whether the cell lies within a grid of the given dimensions.
     *
     * @param height The number of rows
     * @param width The number of columns
     * @return Whether <code>0 &lt;= row &lt; height</code> and <code>0 &lt;= column &lt; width</code>
     */
    public boolean isWithin(int height, int width) {
        return row >= 0 && row < height && column >= 0 && column < width;
    }

    /**
     * Calls {@link Consumer#accept(Object) consumer.accept()} on each cell of
     * the Moore neighborhood that lies within the grid, excluding this cell.
     *
     * @param height The number of rows of the grid
     * @param width The number of columns of the grid
     * @param consumer The callback
     */
    public void forEachNeighbor(int height, int width, Consumer<Cell> consumer) {
        for (int r = row - 1; r <= row + 1; r++) {
            if (r >= 0 && r < height) {
                for (int c = column - 1; c <= column + 1; c++) {
                    if (c >= 0 && c < width
                            && (r != row || c != column)) {
                        consumer.accept(Cell.of(r, c));
                    }
                }
            }
        }
    }

    @Override
    public int compareTo(Cell other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d)", row, column);
    }
}
