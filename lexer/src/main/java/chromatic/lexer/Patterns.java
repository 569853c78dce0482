package chromatic.lexer;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Helpers for writing rule patterns.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Patterns {

    /** A pattern matching any of {@code words} literally, as whole words. */
    public static String words(String... words) {
        return wordsBetween("\\b", "\\b", words);
    }

    /** A pattern matching any of {@code words} literally, between {@code prefix} and {@code suffix}. */
    public static String wordsBetween(String prefix, String suffix, String... words) {
        if (words.length == 0) {
            throw new IllegalArgumentException("At least one word is required");
        }
        var alternatives = Arrays.stream(words)
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        return prefix + "(?:" + alternatives + ")" + suffix;
    }
}
