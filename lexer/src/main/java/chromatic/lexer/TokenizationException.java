package chromatic.lexer;

import lombok.Getter;

/**
 * A tokenize call failed. Tokens emitted before the failure have already reached the consumer;
 * the lexer itself is unaffected and may be used again.
 */
@Getter
public class TokenizationException extends LexerException {

    /** The active state when the failure occurred, or {@code null} if the stack was empty. */
    private final String state;

    private final int position;

    TokenizationException(String state, int position, String message) {
        super(describe(state, position, message));
        this.state = state;
        this.position = position;
    }

    TokenizationException(String state, int position, String message, Throwable cause) {
        super(describe(state, position, message), cause);
        this.state = state;
        this.position = position;
    }

    TokenizationException(LexerState state, String message) {
        this(state.getState(), state.getPos(), message);
    }

    TokenizationException(LexerState state, String message, Throwable cause) {
        this(state.getState(), state.getPos(), message, cause);
    }

    private static String describe(String state, int position, String message) {
        return message + " [state \"" + state + "\", offset " + position + "]";
    }
}
