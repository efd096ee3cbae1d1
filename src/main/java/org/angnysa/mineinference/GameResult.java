package org.angnysa.mineinference;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.angnysa.mineinference.game.Cell;

import java.util.SortedSet;

/**
 * Outcome of one game played by an {@link AutoPlayer}.
 */
@Value
@Builder
public class GameResult {

    public enum Outcome { WON, LOST }

    @NonNull Outcome outcome;

    /**
     * Number of cells revealed, including the losing one.
     */
    int moves;

    /**
     * Number of moves chosen at random because no safe move was known.
     */
    int guesses;

    /**
     * The cell that exploded, if the game was lost.
     */
    Cell explodedAt;

    /**
     * The mines deduced by the end of the game.
     */
    @NonNull SortedSet<Cell> flagged;

    public boolean isWon() {
        return outcome == Outcome.WON;
    }
}
