package chromatic.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

public interface Lexer {

    Config config();

    /**
     * Streams the tokens of {@code text} to {@code out}, in order.
     *
     * @param options start settings; {@code null} means {@link TokenizeOptions#DEFAULT}
     * @throws TokenizationException if the state stack underflows, the active state does not exist
     *                               (including an unknown start state), or a delegated tokenization
     *                               fails; tokens already emitted stay emitted
     */
    void tokenize(TokenizeOptions options, String text, Consumer<Token> out);

    default List<Token> tokenize(TokenizeOptions options, String text) {
        var tokens = new ArrayList<Token>();
        tokenize(options, text, tokens::add);
        return tokens;
    }

    default List<Token> tokenize(String text) {
        return tokenize(TokenizeOptions.DEFAULT, text);
    }
}
