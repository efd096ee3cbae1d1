package org.angnysa.mineinference.solver;

import org.angnysa.mineinference.game.Cell;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MoveSelectorTest {

    @Test
    void noSafeMoveWithoutKnowledge() {
        MoveSelector selector = new MoveSelector(new KnowledgeBase(3, 3), new Random(0));

        assertEquals(Optional.empty(), selector.makeSafeMove());
    }

    @Test
    void safeMoveIsAnUnrevealedSafeCell() {
        KnowledgeBase kb = new KnowledgeBase(3, 3);
        MoveSelector selector = new MoveSelector(kb, new Random(0));
        kb.addKnowledge(Cell.of(0, 0), 0);

        Set<Cell> safes = kb.getSafes();
        Set<Cell> moves = kb.getMovesMade();
        Optional<Cell> move = selector.makeSafeMove();

        assertTrue(move.isPresent());
        assertTrue(Set.of(Cell.of(0, 1), Cell.of(1, 0), Cell.of(1, 1)).contains(move.get()));
        assertEquals(safes, kb.getSafes());
        assertEquals(moves, kb.getMovesMade());
    }

    @Test
    void safeMoveTieBreaksOnRowThenColumn() {
        KnowledgeBase kb = new KnowledgeBase(3, 3);
        kb.markSafe(Cell.of(2, 0));
        kb.markSafe(Cell.of(1, 2));
        kb.markSafe(Cell.of(1, 1));

        assertEquals(Optional.of(Cell.of(1, 1)), new MoveSelector(kb, new Random(0)).makeSafeMove());
    }

    @Test
    void randomMoveAvoidsRevealedAndMinedCells() {
        KnowledgeBase kb = new KnowledgeBase(1, 3);
        kb.markMine(Cell.of(0, 0));
        kb.addKnowledge(Cell.of(0, 1), 1);

        for (long seed = 0; seed < 10; seed++) {
            assertEquals(Optional.of(Cell.of(0, 2)), new MoveSelector(kb, new Random(seed)).makeRandomMove());
        }

        kb.addKnowledge(Cell.of(0, 2), 0);
        assertEquals(Optional.empty(), new MoveSelector(kb, new Random(0)).makeRandomMove());
        assertEquals(Optional.empty(), new MoveSelector(kb, new Random(0)).makeSafeMove());
    }

    @Test
    void randomMoveCoversEveryCandidate() {
        KnowledgeBase kb = new KnowledgeBase(2, 2);
        MoveSelector selector = new MoveSelector(kb, new Random(42));

        Set<Cell> drawn = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            selector.makeRandomMove().ifPresent(drawn::add);
        }

        assertEquals(Set.of(Cell.of(0, 0), Cell.of(0, 1), Cell.of(1, 0), Cell.of(1, 1)), drawn);
    }

    @Test
    void randomMoveIsReproducible() {
        KnowledgeBase kb = new KnowledgeBase(8, 8);

        MoveSelector first = new MoveSelector(kb, new Random(7));
        MoveSelector second = new MoveSelector(kb, new Random(7));
        for (int i = 0; i < 10; i++) {
            assertEquals(first.makeRandomMove(), second.makeRandomMove());
        }
    }
}
