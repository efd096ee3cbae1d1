package org.angnysa.mineinference.solver;

import org.angnysa.mineinference.game.Cell;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SentenceTest {

    private static final Cell A = Cell.of(0, 0);
    private static final Cell B = Cell.of(0, 1);
    private static final Cell C = Cell.of(0, 2);
    private static final Cell D = Cell.of(1, 1);

    @Test
    void markMineRemovesCellAndDecrementsCount() {
        Sentence sentence = new Sentence(Set.of(A, B, C), 2);

        assertTrue(sentence.markMine(B));

        assertEquals(Set.of(A, C), sentence.getCells());
        assertEquals(1, sentence.getCount());
    }

    @Test
    void markSafeRemovesCellAndKeepsCount() {
        Sentence sentence = new Sentence(Set.of(A, B, C), 2);

        assertTrue(sentence.markSafe(B));

        assertEquals(Set.of(A, C), sentence.getCells());
        assertEquals(2, sentence.getCount());
    }

    @Test
    void markingForeignCellIsNoOp() {
        Sentence sentence = new Sentence(Set.of(A, B), 1);

        assertFalse(sentence.markMine(D));
        assertFalse(sentence.markSafe(D));

        assertEquals(new Sentence(Set.of(A, B), 1), sentence);
    }

    @Test
    void knownMinesWhenCountMatchesSize() {
        assertEquals(Set.of(A, B), new Sentence(Set.of(A, B), 2).knownMines());
        assertTrue(new Sentence(Set.of(A, B), 1).knownMines().isEmpty());
        assertTrue(new Sentence(Set.of(A, B), 0).knownMines().isEmpty());
    }

    @Test
    void knownSafesWhenCountIsZero() {
        assertEquals(Set.of(A, B), new Sentence(Set.of(A, B), 0).knownSafes());
        assertTrue(new Sentence(Set.of(A, B), 1).knownSafes().isEmpty());
        assertTrue(new Sentence(Set.of(A, B), 2).knownSafes().isEmpty());
    }

    @Test
    void emptySentenceKnowsNothing() {
        Sentence sentence = new Sentence(Set.of(), 0);

        assertTrue(sentence.isEmpty());
        assertTrue(sentence.knownMines().isEmpty());
        assertTrue(sentence.knownSafes().isEmpty());
        assertFalse(sentence.isContradictory());
    }

    @Test
    void knownCellsAreSnapshots() {
        Sentence sentence = new Sentence(Set.of(A, B), 2);
        Set<Cell> mines = sentence.knownMines();

        sentence.markMine(A);

        assertEquals(Set.of(A, B), mines);
        assertThrows(UnsupportedOperationException.class, () -> sentence.getCells().add(C));
    }

    @Test
    void rejectsImpossibleCount() {
        assertThrows(IllegalArgumentException.class, () -> new Sentence(Set.of(A), 2));
        assertThrows(IllegalArgumentException.class, () -> new Sentence(Set.of(A), -1));
    }

    @Test
    void minedCellInZeroCountSentenceIsContradictory() {
        Sentence sentence = new Sentence(Set.of(A, B), 0);

        sentence.markMine(A);

        assertTrue(sentence.isContradictory());
    }

    @Test
    void equalityOnCellsAndCount() {
        assertEquals(new Sentence(Set.of(A, B), 1), new Sentence(Set.of(B, A), 1));
        assertEquals(new Sentence(Set.of(A, B), 1).hashCode(), new Sentence(Set.of(B, A), 1).hashCode());
        assertNotEquals(new Sentence(Set.of(A, B), 1), new Sentence(Set.of(A, B), 2));
        assertNotEquals(new Sentence(Set.of(A, B), 1), new Sentence(Set.of(A, C), 1));
    }

    @Test
    void subtractSubset() {
        Sentence subset = new Sentence(Set.of(A, B), 1);
        Sentence superset = new Sentence(Set.of(A, B, C), 2);

        assertTrue(subset.isSubsetOf(superset));
        assertFalse(superset.isSubsetOf(subset));
        assertEquals(Optional.of(new Sentence(Set.of(C), 1)), superset.subtract(subset));
    }

    @Test
    void subtractWithNegativeRemainderGivesNothing() {
        Sentence subset = new Sentence(Set.of(A, B), 2);
        Sentence superset = new Sentence(Set.of(A, B, C), 1);

        assertEquals(Optional.empty(), superset.subtract(subset));
    }

    @Test
    void subtractEqualSentenceGivesNothing() {
        Sentence sentence = new Sentence(Set.of(A, B), 1);

        assertEquals(Optional.empty(), sentence.subtract(new Sentence(Set.of(A, B), 1)));
    }

    @Test
    void subtractDisagreeingSentenceOnSameCellsFails() {
        Sentence sentence = new Sentence(Set.of(A, B), 1);

        assertThrows(InconsistentKnowledgeException.class, () -> sentence.subtract(new Sentence(Set.of(A, B), 2)));
    }

    @Test
    void subtractLeavingTooManyMinesFails() {
        Sentence subset = new Sentence(Set.of(A, B), 0);
        Sentence superset = new Sentence(Set.of(A, B, C), 2);

        assertThrows(InconsistentKnowledgeException.class, () -> superset.subtract(subset));
    }

    @Test
    void subtractNonSubsetFails() {
        Sentence sentence = new Sentence(Set.of(A, B), 1);

        assertThrows(IllegalArgumentException.class, () -> sentence.subtract(new Sentence(Set.of(C, D), 1)));
    }
}
