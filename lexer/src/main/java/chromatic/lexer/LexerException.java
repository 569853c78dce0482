package chromatic.lexer;

/**
 * Base of every failure raised while building or running a lexer.
 */
public class LexerException extends RuntimeException {

    LexerException(String message) {
        super(message);
    }

    LexerException(String message, Throwable cause) {
        super(message, cause);
    }
}
