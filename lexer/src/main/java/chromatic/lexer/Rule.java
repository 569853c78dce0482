package chromatic.lexer;

import lombok.NonNull;

/**
 * One pattern of a state, with what to emit and how to move the state stack when it matches.
 *
 * <p>An include rule carries no pattern of its own; it stands for the rules of another state,
 * spliced in at its position when the lexer is built.
 *
 * @param emitter  may be {@code null} to consume the match silently
 * @param mutator  may be {@code null} to leave the stack alone
 * @param include  name of the state to splice in, or {@code null} for an ordinary rule
 */
public record Rule(
    @NonNull String pattern,
    Emitter emitter,
    Mutator mutator,
    String include) {

    public Rule {
        if (include != null && (!pattern.isEmpty() || emitter != null || mutator != null)) {
            throw new IllegalArgumentException("Include rule for \"" + include + "\" cannot carry a pattern, emitter or mutator");
        }
    }

    public static Rule of(String pattern, Emitter emitter) {
        return new Rule(pattern, emitter, null, null);
    }

    public static Rule of(String pattern, Emitter emitter, Mutator mutator) {
        return new Rule(pattern, emitter, mutator, null);
    }

    public static Rule include(@NonNull String state) {
        return new Rule("", null, null, state);
    }

    /**
     * A rule that always matches without consuming input, used to leave a state once nothing
     * else in it applies.
     */
    public static Rule defaultRule(@NonNull Mutator mutator) {
        return new Rule("", null, mutator, null);
    }

    public boolean isInclude() {
        return include != null;
    }
}
