package org.angnysa.mineinference.solver;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.angnysa.mineinference.game.Cell;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Chooses the next cell to reveal from what a {@link KnowledgeBase} knows.
 * Never modifies the knowledge base.
 */
@RequiredArgsConstructor
public class MoveSelector {

    @NonNull private final KnowledgeBase knowledgeBase;
    @NonNull private final Random rng;

    /**
     * A cell known to be safe and not revealed yet. Among several, the
     * smallest by row then column.
     *
     * @return The cell, or nothing if no safe move is known.
     */
    public Optional<Cell> makeSafeMove() {
        for (Cell safe : knowledgeBase.getSafes()) {
            if (!knowledgeBase.isMoveMade(safe)) {
                return Optional.of(safe);
            }
        }
        return Optional.empty();
    }

    /**
     * A cell drawn uniformly among the cells neither revealed nor known to
     * be mined.
     *
     * @return The cell, or nothing if every cell is revealed or mined.
     */
    public Optional<Cell> makeRandomMove() {
        List<Cell> available = new ArrayList<>();
        for (int r = 0; r < knowledgeBase.getHeight(); r++) {
            for (int c = 0; c < knowledgeBase.getWidth(); c++) {
                Cell cell = Cell.of(r, c);
                if (!knowledgeBase.isMoveMade(cell) && !knowledgeBase.isMine(cell)) {
                    available.add(cell);
                }
            }
        }

        if (available.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(available.get(rng.nextInt(available.size())));
    }
}
