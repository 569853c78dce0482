package chromatic.lexer;

import lombok.Getter;

/**
 * A grammar could not be turned into a lexer. No lexer instance exists when this is thrown.
 */
@Getter
public class CompilationException extends LexerException {

    /** The state owning the faulty rule. */
    private final String state;

    /** The offending pattern, or {@code null} when the fault is structural. */
    private final String pattern;

    CompilationException(String state, String pattern, String message) {
        super(describe(state, pattern, message));
        this.state = state;
        this.pattern = pattern;
    }

    CompilationException(String state, String pattern, String message, Throwable cause) {
        super(describe(state, pattern, message), cause);
        this.state = state;
        this.pattern = pattern;
    }

    private static String describe(String state, String pattern, String message) {
        var where = pattern != null
            ? " [state \"" + state + "\", pattern \"" + pattern + "\"]"
            : " [state \"" + state + "\"]";
        return message + where;
    }
}
