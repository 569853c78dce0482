package chromatic.lexer;

import java.util.List;

import lombok.NonNull;

/**
 * Changes the state stack after a rule matches and before its emitter runs.
 *
 * @see LexerState
 */
public sealed interface Mutator
        permits Mutator.Push, Mutator.Pop, Mutator.Replace, Mutator.Set, Mutator.Combined, Mutator.Custom {

    void mutate(LexerState state);

    /**
     * Pushes the given states in order, the last one ending on top. With no states, pushes the
     * state the rule matched in again.
     */
    static Mutator push(String... states) {
        return new Push(List.of(states));
    }

    static Mutator pop() {
        return new Pop(1);
    }

    static Mutator pop(int depth) {
        return new Pop(depth);
    }

    static Mutator replace(String state) {
        return new Replace(state);
    }

    /** Replaces the whole stack; the last state ends on top. */
    static Mutator set(String... states) {
        return new Set(List.of(states));
    }

    static Mutator combined(Mutator... mutators) {
        return new Combined(List.of(mutators));
    }

    static Mutator of(Func func) {
        return new Custom(func);
    }

    @FunctionalInterface
    interface Func {
        void mutate(LexerState state);
    }

    record Push(@NonNull List<String> states) implements Mutator {

        public Push {
            states = List.copyOf(states);
        }

        @Override
        public void mutate(LexerState state) {
            if (states.isEmpty()) {
                state.push(state.getState());
                return;
            }
            for (var name : states) {
                state.push(name);
            }
        }
    }

    record Pop(int depth) implements Mutator {

        public Pop {
            if (depth < 1) {
                throw new IllegalArgumentException("Pop depth must be positive: " + depth);
            }
        }

        @Override
        public void mutate(LexerState state) {
            state.pop(depth);
        }
    }

    record Replace(@NonNull String state) implements Mutator {

        @Override
        public void mutate(LexerState run) {
            run.pop(1);
            run.push(state);
        }
    }

    record Set(@NonNull List<String> states) implements Mutator {

        public Set {
            states = List.copyOf(states);
        }

        @Override
        public void mutate(LexerState state) {
            state.setStack(states);
        }
    }

    record Combined(@NonNull List<Mutator> mutators) implements Mutator {

        public Combined {
            mutators = List.copyOf(mutators);
        }

        @Override
        public void mutate(LexerState state) {
            for (var mutator : mutators) {
                mutator.mutate(state);
            }
        }
    }

    record Custom(@NonNull Func func) implements Mutator {

        @Override
        public void mutate(LexerState state) {
            func.mutate(state);
        }
    }
}
