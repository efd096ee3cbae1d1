package org.angnysa.mineinference.solver;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import org.angnysa.mineinference.game.Cell;

import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * <p>
 *     Logical statement about a minefield: exactly {@link #count} of the
 *     {@link #cells} are mines.
 * </p>
 * <p>
 *     The statement is reduced in place as cells get resolved:
 *     {@link #markMine(Cell)} removes a cell and decrements the count,
 *     {@link #markSafe(Cell)} removes a cell and leaves the count unchanged.
 *     Two sentences are equal when they hold the same cells and count.
 * </p>
 * <p>
 *     Sentences are owned by a single {@link KnowledgeBase} and are not
 *     thread-safe.
 * </p>
 */
@EqualsAndHashCode
public class Sentence {

    private final Set<Cell> cells;
    @Getter private int count;

    /**
     * @param cells The cells concerned by the statement
     * @param count The number of mines among them
     * @throws IllegalArgumentException unless <code>0 &lt;= count &lt;= cells.size()</code>
     */
    public Sentence(@NonNull Set<Cell> cells, int count) {
        if (count < 0 || count > cells.size()) {
            throw new IllegalArgumentException(String.format("count == %d outside [0, %d]", count, cells.size()));
        }
        this.cells = new HashSet<>(cells);
        this.count = count;
    }

    /**
     * @return An unmodifiable view of the unresolved cells.
     */
    public Set<Cell> getCells() {
        return Collections.unmodifiableSet(cells);
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    /**
     * A sentence is contradictory when no assignment of mines can satisfy it.
     *
     * @return Whether <code>count &lt; 0</code> or <code>count &gt; size()</code>
     */
    public boolean isContradictory() {
        return count < 0 || count > cells.size();
    }

    /**
     * @return Every cell, if there are as many mines as cells, otherwise nothing.
     */
    public Set<Cell> knownMines() {
        if (count == cells.size()) {
            return Set.copyOf(cells);
        }
        return Collections.emptySet();
    }

    /**
     * @return Every cell, if there are no mines, otherwise nothing.
     */
    public Set<Cell> knownSafes() {
        if (count == 0) {
            return Set.copyOf(cells);
        }
        return Collections.emptySet();
    }

    /**
     * Accounts for a mine. No-op if the cell is not part of the sentence.
     *
     * @param cell The mined cell
     * @return Whether the sentence changed
     */
    public boolean markMine(@NonNull Cell cell) {
        if (cells.remove(cell)) {
            count--;
            return true;
        }
        return false;
    }

    /**
     * Accounts for a safe cell. No-op if the cell is not part of the sentence.
     *
     * @param cell The safe cell
     * @return Whether the sentence changed
     */
    public boolean markSafe(@NonNull Cell cell) {
        return cells.remove(cell);
    }

    public boolean isSubsetOf(@NonNull Sentence other) {
        return other.cells.containsAll(cells);
    }

    /**
     * <p>
     *     Subset resolution: if <code>subset</code> holds
     *     <code>subset.count</code> mines and this sentence holds
     *     <code>count</code> mines on a superset of its cells, the remaining
     *     cells hold the difference.
     * </p>
     *
     * @param subset A sentence whose cells are all part of this one
     * @return The remainder, or nothing if it would be empty or have a negative count.
     * @throws IllegalArgumentException if <code>subset</code> is not a subset of this sentence.
     * @throws InconsistentKnowledgeException if the remainder holds more mines than cells.
     */
    public Optional<Sentence> subtract(@NonNull Sentence subset) {
        if (!subset.isSubsetOf(this)) {
            throw new IllegalArgumentException(String.format("%s is not a subset of %s", subset, this));
        }

        Set<Cell> remainder = new HashSet<>(cells);
        remainder.removeAll(subset.cells);
        int remainderCount = count - subset.count;

        if (remainder.isEmpty() && remainderCount != 0) {
            throw new InconsistentKnowledgeException(String.format("%s and %s disagree on the same cells", this, subset));
        } else if (remainder.isEmpty() || remainderCount < 0) {
            return Optional.empty();
        } else if (remainderCount > remainder.size()) {
            throw new InconsistentKnowledgeException(String.format("%s minus %s leaves %d mines on %s", this, subset, remainderCount, remainder));
        }
        return Optional.of(new Sentence(remainder, remainderCount));
    }

    @Override
    public String toString() {
        return String.format("%s = %d", new TreeSet<>(cells), count);
    }
}
