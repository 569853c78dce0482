package chromatic.lexer;

import lombok.NonNull;

/**
 * Per-call tokenizer settings.
 *
 * @param state the state to start in
 */
public record TokenizeOptions(@NonNull String state) {

    public static final TokenizeOptions DEFAULT = new TokenizeOptions(RegexLexer.ROOT);

    public static TokenizeOptions startingAt(String state) {
        return new TokenizeOptions(state);
    }
}
