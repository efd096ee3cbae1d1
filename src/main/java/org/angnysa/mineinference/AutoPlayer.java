package org.angnysa.mineinference;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;
import org.angnysa.mineinference.game.Cell;
import org.angnysa.mineinference.game.MineField;
import org.angnysa.mineinference.solver.KnowledgeBase;
import org.angnysa.mineinference.solver.MoveSelector;

import java.util.Optional;
import java.util.Random;

/**
 * <p>Plays a whole game on a {@link MineField} without human input.</p>
 *
 * <p>
 *     Each turn picks a known safe cell if there is one, otherwise a random
 *     cell that is neither revealed nor known to be mined. Revealing a mine
 *     loses the game. Otherwise the number of surrounding mines is fed to the
 *     {@link KnowledgeBase}. The game is won when the deduced mines match the
 *     field's, or when every cell without a mine has been revealed.
 * </p>
 */
@Log4j2
public class AutoPlayer {

    @Getter private final MineField mineField;
    @Getter private final KnowledgeBase knowledgeBase;
    private final MoveSelector moveSelector;

    public AutoPlayer(@NonNull MineField mineField, @NonNull Random rng) {
        this.mineField = mineField;
        this.knowledgeBase = new KnowledgeBase(mineField.getHeight(), mineField.getWidth());
        this.moveSelector = new MoveSelector(knowledgeBase, rng);
    }

    /**
     * Plays until the game is won or lost.
     *
     * @return The outcome
     */
    public GameResult play() {
        int moves = 0;
        int guesses = 0;

        while (!isWon()) {
            Optional<Cell> safe = moveSelector.makeSafeMove();
            Optional<Cell> move = safe.isPresent() ? safe : moveSelector.makeRandomMove();
            if (move.isEmpty()) {
                throw new IllegalStateException(String.format("No move left on an unfinished game: %s", knowledgeBase));
            }

            Cell cell = move.get();
            moves++;
            if (safe.isEmpty()) {
                guesses++;
                log.info("No known safe move, guessing {}", cell);
            } else {
                log.debug("Revealing safe cell {}", cell);
            }

            if (mineField.isMine(cell)) {
                log.info("Hit a mine at {} after {} moves", cell, moves);
                return GameResult.builder()
                        .outcome(GameResult.Outcome.LOST)
                        .moves(moves)
                        .guesses(guesses)
                        .explodedAt(cell)
                        .flagged(knowledgeBase.getMines())
                        .build();
            }

            knowledgeBase.addKnowledge(cell, mineField.nearbyMineCount(cell));
        }

        log.info("Won after {} moves, {} of them guessed", moves, guesses);
        return GameResult.builder()
                .outcome(GameResult.Outcome.WON)
                .moves(moves)
                .guesses(guesses)
                .flagged(knowledgeBase.getMines())
                .build();
    }

    private boolean isWon() {
        int cells = mineField.getHeight() * mineField.getWidth();
        return mineField.won(knowledgeBase.getMines())
                || knowledgeBase.getMovesMade().size() == cells - mineField.getMineCount();
    }
}
