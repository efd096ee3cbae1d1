package org.angnysa.mineinference.solver;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;
import org.angnysa.mineinference.game.Cell;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>Knowledge-based minesweeper player.</p>
 *
 * <p>
 *     The knowledge base accumulates what the revealed cells tell about their
 *     neighbors and deduces, without ever guessing, which cells are certainly
 *     safe and which are certainly mined.
 * </p>
 * <p>
 *     It follows these rules:
 *     <ol>
 *         <li>
 *             Each revealed cell showing <code>N</code> surrounding mines
 *             becomes a {@link Sentence}: exactly <code>N - K</code> mines
 *             among its unresolved neighbors, where <code>K</code> is the
 *             number of neighbors already known to be mined.
 *         </li>
 *         <li>
 *             Resolving a cell removes it from every sentence referencing it.
 *             A mine also decrements the sentence's count.
 *         </li>
 *         <li>
 *             <b>Direct resolution</b>: a sentence with a count of 0 has only
 *             safe cells, a sentence with as many mines as cells has only
 *             mined cells.
 *         </li>
 *         <li>
 *             <b>Subset resolution</b>: when the cells of sentence
 *             <code>A</code> are all part of sentence <code>B</code>, the
 *             remaining cells <code>B - A</code> hold exactly
 *             <code>B.count - A.count</code> mines. This is a new sentence.
 *         </li>
 *         <li>
 *             <b>Cleanup</b>: sentences without cells carry no information and
 *             are dropped, as are sentences that became equal to another one.
 *             A sentence holding more mines than cells cannot come from a
 *             real minefield and raises an {@link InconsistentKnowledgeException}.
 *         </li>
 *     </ol>
 * </p>
 * <p>
 *     These rules are applied in passes until one pass changes nothing. A
 *     sentence with a count of 0 is never dropped by cleanup: its cells are
 *     first marked safe by the direct resolution of the next pass, which
 *     empties it. Resolved cells only accumulate and no sentence is added
 *     twice, so the passes always end.
 * </p>
 * <p>
 *     Instances are not thread-safe. Each game owns its own knowledge base.
 * </p>
 */
@Log4j2
public class KnowledgeBase {

    @Getter private final int height;
    @Getter private final int width;

    /**
     * Cells already revealed
     */
    private final SortedSet<Cell> movesMade = new TreeSet<>();

    /**
     * Cells known to be safe, including the revealed ones
     */
    private final SortedSet<Cell> safes = new TreeSet<>();

    /**
     * Cells known to be mined
     */
    private final SortedSet<Cell> mines = new TreeSet<>();

    /**
     * Sentences known to be true. Never holds two equal sentences, nor any
     * resolved cell after a public call returns.
     */
    private final List<Sentence> knowledge = new ArrayList<>();

    public KnowledgeBase(int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException(String.format("Invalid dimensions %dx%d", height, width));
        }
        this.height = height;
        this.width = width;
    }

    /**
     * Records a revealed cell and the number of mines around it, then
     * deduces everything that can be deduced.
     *
     * @param cell The revealed cell, necessarily safe
     * @param count The number of mines surrounding it
     * @throws IllegalArgumentException If the cell is outside the field or the count cannot match the current knowledge
     * @throws InconsistentKnowledgeException If the cell is known to be mined
     */
    public void addKnowledge(@NonNull Cell cell, int count) {
        enterCall(this, "addKnowledge", cell, count);
        try {
            checkBounds(cell);
            if (mines.contains(cell)) {
                throw new InconsistentKnowledgeException(String.format("Revealed cell %s is known to be mined", cell));
            }

            Set<Cell> unresolved = new TreeSet<>();
            AtomicInteger knownMines = new AtomicInteger();
            cell.forEachNeighbor(height, width, n -> {
                if (mines.contains(n)) {
                    knownMines.incrementAndGet();
                } else if (!safes.contains(n)) {
                    unresolved.add(n);
                }
            });

            int mineCount = count - knownMines.get();
            if (count < 0 || mineCount < 0 || mineCount > unresolved.size()) {
                throw new IllegalArgumentException(String.format(
                        "Cell %s cannot show %d: %d known mines and %d unresolved neighbors",
                        cell, count, knownMines.get(), unresolved.size()));
            }

            movesMade.add(cell);
            markSafe(cell);

            if (!unresolved.isEmpty()) {
                addSentence(new Sentence(unresolved, mineCount));
            }

            infer();
        } finally {
            exitCall(this, "addKnowledge");
        }
    }

    /**
     * Marks a cell as mined, removes it from every sentence and drops the
     * sentences left empty or duplicated.
     *
     * @param cell The mined cell
     * @throws InconsistentKnowledgeException If the cell is known to be safe, or a sentence becomes contradictory
     */
    public void markMine(@NonNull Cell cell) {
        checkBounds(cell);
        enterCall(this, "markMine", cell);
        try {
            applyMine(cell);
            cleanUp();
        } finally {
            exitCall(this, "markMine");
        }
    }

    /**
     * Marks a cell as safe, removes it from every sentence and drops the
     * sentences left empty or duplicated.
     *
     * @param cell The safe cell
     * @throws InconsistentKnowledgeException If the cell is known to be mined, or a sentence becomes contradictory
     */
    public void markSafe(@NonNull Cell cell) {
        checkBounds(cell);
        enterCall(this, "markSafe", cell);
        try {
            applySafe(cell);
            cleanUp();
        } finally {
            exitCall(this, "markSafe");
        }
    }

    private void applyMine(Cell cell) {
        if (safes.contains(cell)) {
            throw new InconsistentKnowledgeException(String.format("Cell %s is known to be safe", cell));
        }

        mines.add(cell);
        for (Sentence sentence : knowledge) {
            if (sentence.markMine(cell)) {
                trace("Decremented count to %d and removed %s", sentence.getCount(), cell);
            }
        }
    }

    private void applySafe(Cell cell) {
        if (mines.contains(cell)) {
            throw new InconsistentKnowledgeException(String.format("Cell %s is known to be mined", cell));
        }

        safes.add(cell);
        for (Sentence sentence : knowledge) {
            if (sentence.markSafe(cell)) {
                trace("Removed %s from %s", cell, sentence);
            }
        }
    }

    /**
     * Applies direct resolution, subset resolution and cleanup until a whole
     * pass changes nothing.
     *
     * @return Whether anything changed.
     * @throws InconsistentKnowledgeException If a contradiction is found
     */
    public boolean infer() {
        enterCall(this, "infer");
        boolean changed = false;
        try {
            boolean worked;
            int passes = 0;
            do {
                passes++;
                // zero-count sentences are emptied here, never dropped by cleanup
                worked = resolveDirectly();
                worked |= resolveSubsets();
                worked |= cleanUp();
                changed |= worked;
            } while (worked);

            log.debug("Inference stable after {} passes: {} safes, {} mines, {} sentences",
                    passes, safes.size(), mines.size(), knowledge.size());
            return changed;
        } finally {
            exitCall(this, "infer", changed);
        }
    }

    /**
     * Marks every cell of the sentences that are certainly all safe or all mined.
     *
     * @return Whether at least one cell was marked.
     */
    private boolean resolveDirectly() {
        enterCall(this, "resolveDirectly");
        boolean worked = false;
        try {
            Set<Cell> minesToMark = new TreeSet<>();
            Set<Cell> safesToMark = new TreeSet<>();

            for (Sentence sentence : knowledge) {
                for (Cell mine : sentence.knownMines()) {
                    if (!mines.contains(mine)) {
                        minesToMark.add(mine);
                    }
                }
                for (Cell safe : sentence.knownSafes()) {
                    if (!safes.contains(safe)) {
                        safesToMark.add(safe);
                    }
                }
            }

            minesToMark.forEach(this::applyMine);
            safesToMark.forEach(this::applySafe);

            worked = !minesToMark.isEmpty() || !safesToMark.isEmpty();
            if (worked) {
                log.debug("Resolved mines {} and safes {}", minesToMark, safesToMark);
            }
            return worked;
        } finally {
            exitCall(this, "resolveDirectly", worked);
        }
    }

    /**
     * Derives <code>B - A</code> for every ordered pair of distinct sentences
     * where <code>A</code> is a subset of <code>B</code>.
     *
     * @return Whether at least one new sentence was added.
     */
    private boolean resolveSubsets() {
        enterCall(this, "resolveSubsets");
        List<Sentence> inferred = new ArrayList<>();
        try {
            for (Sentence subset : knowledge) {
                for (Sentence superset : knowledge) {
                    if (subset != superset && subset.isSubsetOf(superset)) {
                        superset.subtract(subset)
                                .filter(s -> !knowledge.contains(s) && !inferred.contains(s))
                                .ifPresent(s -> {
                                    trace("%s minus %s gives %s", superset, subset, s);
                                    inferred.add(s);
                                });
                    }
                }
            }

            knowledge.addAll(inferred);
            return !inferred.isEmpty();
        } finally {
            exitCall(this, "resolveSubsets", !inferred.isEmpty());
        }
    }

    /**
     * Drops empty and duplicate sentences.
     *
     * @return Whether at least one sentence was dropped.
     * @throws InconsistentKnowledgeException If a sentence holds more mines than cells
     */
    private boolean cleanUp() {
        enterCall(this, "cleanUp");
        List<Sentence> kept = new ArrayList<>();
        boolean worked = false;
        try {
            Iterator<Sentence> it = knowledge.iterator();
            while (it.hasNext()) {
                Sentence sentence = it.next();
                if (sentence.isContradictory()) {
                    log.error("Contradictory sentence {} in {}", sentence, knowledge);
                    throw new InconsistentKnowledgeException(String.format("Contradictory sentence %s", sentence));
                } else if (sentence.isEmpty() || kept.contains(sentence)) {
                    trace("Dropped %s", sentence);
                    it.remove();
                    worked = true;
                } else {
                    kept.add(sentence);
                }
            }
            return worked;
        } finally {
            exitCall(this, "cleanUp", worked);
        }
    }

    private void addSentence(Sentence sentence) {
        if (knowledge.contains(sentence)) {
            trace("Duplicate: %s", sentence);
        } else {
            log.debug("New sentence {}", sentence);
            knowledge.add(sentence);
        }
    }

    private void checkBounds(Cell cell) {
        if (!cell.isWithin(height, width)) {
            throw new IllegalArgumentException(String.format("Cell %s is outside the %dx%d field", cell, height, width));
        }
    }

    public boolean isMine(@NonNull Cell cell) {
        return mines.contains(cell);
    }

    public boolean isSafe(@NonNull Cell cell) {
        return safes.contains(cell);
    }

    public boolean isMoveMade(@NonNull Cell cell) {
        return movesMade.contains(cell);
    }

    /**
     * @return A read-only snapshot of the revealed cells.
     */
    public SortedSet<Cell> getMovesMade() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(movesMade));
    }

    /**
     * @return A read-only snapshot of the cells known to be safe.
     */
    public SortedSet<Cell> getSafes() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(safes));
    }

    /**
     * @return A read-only snapshot of the cells known to be mined.
     */
    public SortedSet<Cell> getMines() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(mines));
    }

    /**
     * @return Copies of the sentences currently known.
     */
    public List<Sentence> getKnowledge() {
        List<Sentence> copy = new ArrayList<>(knowledge.size());
        for (Sentence sentence : knowledge) {
            copy.add(new Sentence(sentence.getCells(), sentence.getCount()));
        }
        return Collections.unmodifiableList(copy);
    }

    @Override
    public String toString() {
        return String.format("KnowledgeBase[%dx%d, moves=%s, safes=%s, mines=%s, knowledge=%s]",
                height, width, movesMade, safes, mines, knowledge);
    }



    /**
     * The spaces to prefix the trace lines with. Grows and shrinks as
     * {@link #enterCall(Object, String, Object...)} and
     * {@link #exitCall(Object, String)} are called.
     */
    private String tracePrefix = "";
    private static final String TRACE_PREFIX_INCREMENT = "  ";

    /**
     * Logs a trace entry, formatted only when tracing is enabled.
     *
     * @param format The {@link String#format(String, Object...)} format string.
     * @param params The {@link String#format(String, Object...)} parameters.
     */
    private void trace(@NonNull String format, @NonNull Object... params) {
        if (log.isTraceEnabled()) {
            log.trace("{}TRACE {}", tracePrefix, String.format(format, params));
        }
    }

    /**
     * Traces the beginning of a method call.
     *
     * @param target The instance owning the method
     * @param method The called method name
     * @param params The method parameters
     */
    private void enterCall(@NonNull Object target, @NonNull String method, @NonNull Object... params) {
        if (log.isTraceEnabled()) {
            log.trace("{}CALL {}#{} {}", tracePrefix, target.getClass().getSimpleName(), method, Arrays.toString(params));
            tracePrefix += TRACE_PREFIX_INCREMENT;
        }
    }

    /**
     * Traces the end of a method call with return value.
     */
    private void exitCall(@NonNull Object target, @NonNull String method, Object retVal) {
        if (log.isTraceEnabled() && !tracePrefix.isEmpty()) {
            tracePrefix = tracePrefix.substring(TRACE_PREFIX_INCREMENT.length());
            log.trace("{}RET {}#{} {}", tracePrefix, target.getClass().getSimpleName(), method, retVal);
        }
    }

    /**
     * Traces the end of a method call without return value.
     */
    private void exitCall(@NonNull Object target, @NonNull String method) {
        if (log.isTraceEnabled() && !tracePrefix.isEmpty()) {
            tracePrefix = tracePrefix.substring(TRACE_PREFIX_INCREMENT.length());
            log.trace("{}RET {}#{}", tracePrefix, target.getClass().getSimpleName(), method);
        }
    }
}
