package chromatic.lexer;

/**
 * Reports how well a lexer suits a piece of text.
 */
@FunctionalInterface
public interface Analyser {

    /**
     * @return a confidence between {@code 0.0} (unsuitable) and {@code 1.0} (certain)
     */
    float analyseText(String text);
}
