package chromatic.lexer;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;

/**
 * The mutable state of a single tokenize call. A fresh instance is created per call and handed
 * to every {@link Mutator} and {@link Emitter} that runs during it.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public final class LexerState {

    private final Lexer lexer;

    private final String text;

    /** Scan offset, in chars. */
    private int pos;

    /** The state the current rule matched in. */
    private String state;

    /** Index of the current rule within its (include-expanded) state. */
    private int rule;

    private List<String> groups = List.of();

    @Getter(AccessLevel.NONE)
    private final List<String> stack = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Map<Pattern, Matcher> matchers = new IdentityHashMap<>();

    LexerState(@NonNull Lexer lexer, @NonNull String text, @NonNull String start) {
        this.lexer = lexer;
        this.text = text;
        this.state = start;
        stack.add(start);
    }

    // bottom first
    public List<String> getStack() {
        return List.copyOf(stack);
    }

    public int depth() {
        return stack.size();
    }

    public boolean isStackEmpty() {
        return stack.isEmpty();
    }

    /** The top of the stack, or {@code null} if it is empty. */
    public String peek() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    public void push(@NonNull String state) {
        stack.add(state);
    }

    /**
     * Emptying the stack ends the tokenize call.
     *
     * @throws TokenizationException if the stack holds fewer than {@code depth} entries
     */
    public void pop(int depth) {
        if (depth > stack.size()) {
            throw new TokenizationException(this,
                "State stack underflow: cannot pop " + depth + " of " + stack.size() + " " + stack);
        }
        stack.subList(stack.size() - depth, stack.size()).clear();
    }

    public void setStack(@NonNull List<String> states) {
        stack.clear();
        stack.addAll(states);
    }

    Matcher matcher(Pattern pattern) {
        return matchers.computeIfAbsent(pattern, p -> p.matcher(text)
            .useTransparentBounds(true)
            .useAnchoringBounds(false));
    }
}
