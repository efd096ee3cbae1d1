package org.angnysa.mineinference.game;

import java.util.Set;

/**
 * A rectangular grid hiding a fixed set of mines.
 */
public interface MineField {

    /**
     * @return The number of rows.
     */
    int getHeight();

    /**
     * @return The number of columns.
     */
    int getWidth();

    /**
     * @return The number of mines hidden in the field.
     */
    int getMineCount();

    /**
     * Whether the cell is mined.
     *
     * @param cell The cell to check
     * @return Whether the cell is mined.
     * @throws IllegalArgumentException If the cell is outside the field.
     */
    boolean isMine(Cell cell) throws IllegalArgumentException;

    /**
     * Count the mines surrounding a cell, ignoring neighbors outside the field.
     *
     * @param cell The cell
     * @return The number of mines among the up to 8 neighbors of the cell.
     * @throws IllegalArgumentException If the cell is outside the field.
     */
    int nearbyMineCount(Cell cell) throws IllegalArgumentException;

    /**
     * Whether the given flags match the mines exactly.
     *
     * @param flagged The cells believed to be mined
     * @return Whether <code>flagged</code> equals the set of mines.
     */
    boolean won(Set<Cell> flagged);

    /**
     * Whether the cell lies within the field.
     *
     * @param cell The cell
     * @return Whether the cell lies within the field.
     */
    default boolean contains(Cell cell) {
        return cell.isWithin(getHeight(), getWidth());
    }
}
