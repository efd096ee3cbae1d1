package org.angnysa.mineinference;

import lombok.extern.log4j.Log4j2;
import org.angnysa.mineinference.game.GridMineField;

import java.util.Random;

@Log4j2
public class Main {

    public static void main(String[] args) {
        GameSettings settings;
        try {
            settings = GameSettings.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("usage: [HEIGHTxWIDTHxMINES] [--seed=N] [--games=N]");
            System.exit(2);
            return;
        }

        System.out.println("seed: " + settings.getSeed());
        Random rng = new Random(settings.getSeed());

        int won = 0;
        int guesses = 0;
        long start = System.nanoTime();
        for (int game = 1; game <= settings.getGames(); game++) {
            GridMineField mineField = new GridMineField(settings.getHeight(), settings.getWidth(), settings.getMines(), rng);
            AutoPlayer player = new AutoPlayer(mineField, rng);

            GameResult result;
            try {
                result = player.play();
            } catch (RuntimeException e) {
                log.error("Game {} failed: {}", game, player.getKnowledgeBase(), e);
                throw e;
            }

            if (settings.getGames() == 1) {
                System.out.println();
                mineField.display(System.out);
                System.out.println();
            }
            System.out.println(String.format("Game %d: %s after %d moves (%d guessed), %d mines deduced%s",
                    game,
                    result.getOutcome(),
                    result.getMoves(),
                    result.getGuesses(),
                    result.getFlagged().size(),
                    result.isWon() ? "" : " - exploded at " + result.getExplodedAt()));

            if (result.isWon()) {
                won++;
            }
            guesses += result.getGuesses();
        }

        long delta = System.nanoTime() - start;
        System.out.println(String.format("Won %d/%d games, %d guesses, %d ms",
                won, settings.getGames(), guesses, delta / 1_000_000));
    }
}
