package org.angnysa.mineinference.game;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import java.io.PrintStream;
import java.util.Collections;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>
 *     In-memory implementation of {@link MineField} over a rectangular grid.
 * </p>
 * <p>
 *     The constructors place mines uniformly at random using the supplied
 *     {@link Random}, so a given seed always produces the same field.
 *     {@link #withMines(int, int, Set)} builds a field with mines at known
 *     locations. The field is never modified after construction.
 * </p>
 */
@Log4j2
public class GridMineField implements MineField {

    private final boolean[][] map;

    @Getter private final int height;
    @Getter private final int width;

    private final Set<Cell> mines;

    public GridMineField(int height, int width, int mines, long seed) {
        this(height, width, mines, new Random(seed));
    }

    public GridMineField(int height, int width, int mines, @NonNull Random rng) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException(String.format("Invalid dimensions %dx%d", height, width));
        } else if (mines < 0 || mines > (long) height * width) {
            throw new IllegalArgumentException(String.format("Cannot place %d mines on a %dx%d field", mines, height, width));
        }

        this.height = height;
        this.width = width;
        this.map = new boolean[height][width];

        // mine the field
        Set<Cell> placed = new HashSet<>();
        while (placed.size() < mines) {
            int r = rng.nextInt(height);
            int c = rng.nextInt(width);
            if (!map[r][c]) {
                map[r][c] = true;
                placed.add(Cell.of(r, c));
            }
        }
        this.mines = Collections.unmodifiableSet(placed);

        log.debug("Created {}x{} field with {} mines", height, width, mines);
    }

    /**
     * Builds a field with mines at known locations.
     *
     * @param height The number of rows
     * @param width The number of columns
     * @param mines The mined cells
     * @return The field
     */
    public static GridMineField withMines(int height, int width, @NonNull Set<Cell> mines) {
        return new GridMineField(height, width, mines);
    }

    private GridMineField(int height, int width, Set<Cell> mines) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException(String.format("Invalid dimensions %dx%d", height, width));
        }
        this.height = height;
        this.width = width;
        this.map = new boolean[height][width];
        for (Cell mine : mines) {
            checkBounds(mine);
            map[mine.getRow()][mine.getColumn()] = true;
        }
        this.mines = Collections.unmodifiableSet(new HashSet<>(mines));
    }

    @Override
    public int getMineCount() {
        return mines.size();
    }

    /**
     * @return An unmodifiable view of the mined cells.
     */
    public Set<Cell> getMines() {
        return mines;
    }

    @Override
    public boolean isMine(@NonNull Cell cell) {
        checkBounds(cell);
        return map[cell.getRow()][cell.getColumn()];
    }

    @Override
    public int nearbyMineCount(@NonNull Cell cell) {
        checkBounds(cell);
        AtomicInteger count = new AtomicInteger();
        cell.forEachNeighbor(height, width, n -> {
            if (map[n.getRow()][n.getColumn()]) {
                count.incrementAndGet();
            }
        });
        return count.get();
    }

    @Override
    public boolean won(@NonNull Set<Cell> flagged) {
        return mines.equals(flagged);
    }

    /**
     * Renders the field, <code>X</code> marking a mine.
     *
     * @return The text rendering, one line per row.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        String separator = "--".repeat(width) + "-";
        for (int r = 0; r < height; r++) {
            sb.append(separator).append(System.lineSeparator());
            for (int c = 0; c < width; c++) {
                sb.append(map[r][c] ? "|X" : "| ");
            }
            sb.append('|').append(System.lineSeparator());
        }
        sb.append(separator).append(System.lineSeparator());
        return sb.toString();
    }

    public void display(@NonNull PrintStream out) {
        out.print(render());
    }

    private void checkBounds(Cell cell) {
        if (!contains(cell)) {
            throw new IllegalArgumentException(String.format("Cell %s is outside the %dx%d field", cell, height, width));
        }
    }
}
