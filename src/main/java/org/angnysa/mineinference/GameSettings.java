package org.angnysa.mineinference;

import lombok.Builder;
import lombok.Value;

import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Settings of a {@link Main} run.
 */
@Value
@Builder(toBuilder = true)
public class GameSettings {

    private static final Pattern SIZE = Pattern.compile("^(\\d+)x(\\d+)x(\\d+)$");
    private static final String SEED = "--seed=";
    private static final String GAMES = "--games=";

    @Builder.Default int height = 8;
    @Builder.Default int width = 8;
    @Builder.Default int mines = 8;
    @Builder.Default long seed = new Random().nextLong();
    @Builder.Default int games = 1;

    /**
     * Reads <code>HEIGHTxWIDTHxMINES</code>, <code>--seed=N</code> and
     * <code>--games=N</code> arguments. Missing ones keep their default.
     *
     * @param args The command line arguments
     * @return The settings
     * @throws IllegalArgumentException On an unknown or malformed argument
     */
    public static GameSettings parse(String... args) {
        GameSettingsBuilder builder = builder();
        for (String arg : args) {
            Matcher size = SIZE.matcher(arg);
            try {
                if (size.matches()) {
                    builder.height(Integer.parseInt(size.group(1)))
                            .width(Integer.parseInt(size.group(2)))
                            .mines(Integer.parseInt(size.group(3)));
                } else if (arg.startsWith(SEED)) {
                    builder.seed(Long.parseLong(arg.substring(SEED.length())));
                } else if (arg.startsWith(GAMES)) {
                    builder.games(Integer.parseInt(arg.substring(GAMES.length())));
                } else {
                    throw new IllegalArgumentException(String.format("Unknown argument '%s'", arg));
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format("Malformed argument '%s'", arg), e);
            }
        }

        GameSettings settings = builder.build();
        if (settings.getHeight() <= 0 || settings.getWidth() <= 0) {
            throw new IllegalArgumentException(String.format("Invalid dimensions %dx%d", settings.getHeight(), settings.getWidth()));
        }

        int cells;
        try {
            cells = Math.multiplyExact(settings.getHeight(), settings.getWidth());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(String.format("Field too large: %dx%d", settings.getHeight(), settings.getWidth()), e);
        }

        if (settings.getMines() > cells) {
            throw new IllegalArgumentException(String.format("Too many mines: %d", settings.getMines()));
        } else if (settings.getGames() <= 0) {
            throw new IllegalArgumentException(String.format("Invalid number of games: %d", settings.getGames()));
        }
        return settings;
    }
}
