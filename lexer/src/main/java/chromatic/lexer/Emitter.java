package chromatic.lexer;

import java.util.List;
import java.util.function.Consumer;

import lombok.NonNull;

/**
 * Turns the capture groups of a match into tokens.
 *
 * <p>{@code groups.get(0)} is the whole match, followed by one entry per capturing group; a group
 * that took no part in the match is the empty string. {@code state} is the live run state of the
 * lexer that matched, already updated by the rule's {@link Mutator}.
 */
public sealed interface Emitter
        permits Token.Type, Emitter.ByGroups, Emitter.Using, Emitter.UsingSelf, Emitter.Custom {

    void emit(List<String> groups, LexerState state, Consumer<Token> out);

    /**
     * Applies the i-th emitter to the i-th capturing group. There must be exactly one emitter per
     * capturing group of the rule's pattern.
     */
    static Emitter byGroups(Emitter... emitters) {
        return new ByGroups(List.of(emitters));
    }

    static Emitter using(Lexer lexer) {
        return new Using(lexer, TokenizeOptions.DEFAULT);
    }

    static Emitter using(Lexer lexer, TokenizeOptions options) {
        return new Using(lexer, options);
    }

    /** Tokenizes the whole match again with the matching lexer, starting at {@code state}. */
    static Emitter usingSelf(String state) {
        return new UsingSelf(state);
    }

    static Emitter of(Func func) {
        return new Custom(func);
    }

    @FunctionalInterface
    interface Func {
        void emit(List<String> groups, LexerState state, Consumer<Token> out);
    }

    record ByGroups(@NonNull List<Emitter> emitters) implements Emitter {

        public ByGroups {
            emitters = List.copyOf(emitters);
        }

        @Override
        public void emit(List<String> groups, LexerState state, Consumer<Token> out) {
            if (groups.size() - 1 != emitters.size()) {
                throw new TokenizationException(state,
                    "Rule has " + (groups.size() - 1) + " groups but " + emitters.size() + " emitters");
            }
            for (int i = 0; i < emitters.size(); i++) {
                emitters.get(i).emit(List.of(groups.get(i + 1)), state, out);
            }
        }
    }

    record Using(@NonNull Lexer lexer, @NonNull TokenizeOptions options) implements Emitter {

        @Override
        public void emit(List<String> groups, LexerState state, Consumer<Token> out) {
            delegate(lexer, options, groups.get(0), state, out);
        }
    }

    record UsingSelf(@NonNull String state) implements Emitter {

        @Override
        public void emit(List<String> groups, LexerState run, Consumer<Token> out) {
            delegate(run.getLexer(), TokenizeOptions.startingAt(state), groups.get(0), run, out);
        }
    }

    record Custom(@NonNull Func func) implements Emitter {

        @Override
        public void emit(List<String> groups, LexerState state, Consumer<Token> out) {
            func.emit(groups, state, out);
        }
    }

    private static void delegate(
            Lexer lexer,
            TokenizeOptions options,
            String text,
            LexerState outer,
            Consumer<Token> out) {
        try {
            lexer.tokenize(options, text, out);
        } catch (LexerException ex) {
            throw new TokenizationException(outer,
                "Delegated tokenization with " + describe(lexer) + " failed: " + ex.getMessage(), ex);
        }
    }

    private static String describe(Lexer lexer) {
        var name = lexer.config().name();
        return name.isEmpty() ? "anonymous lexer" : "lexer \"" + name + "\"";
    }
}
