package chromatic.lexer;

import static chromatic.lexer.Token.Type.ERROR;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * A lexer driven by a map of named states, each an ordered list of {@link Rule}s.
 *
 * <p>Tokenizing keeps a stack of state names, seeded with the start state. At each offset the
 * rules of the state on top are tried in order and the first one that matches wins: its mutator
 * updates the stack, then its emitter turns the match into tokens. Input no rule matches comes
 * out one code point at a time as {@link Token.Type#ERROR} tokens. The call ends when the input is
 * consumed or the stack is empty.
 *
 * <p>Instances are immutable and may tokenize from several threads at once.
 */
@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RegexLexer implements Lexer, Analyser {

    public static final String ROOT = "root";

    /** Consecutive zero-width matches tolerated at one offset before the run is abandoned. */
    static final int MAX_ZERO_WIDTH_STEPS = 100;

    private record CompiledRule(Rule rule, String state, Pattern regex) {}

    private final Config config;
    private final Map<String, List<CompiledRule>> rules;
    private final Analyser analyser;

    /**
     * Compiles {@code rules} into a lexer.
     *
     * @param config lexer settings; {@code null} means {@link Config#DEFAULT}
     * @param rules  rules per state; must contain {@value #ROOT}
     * @throws CompilationException if the grammar is invalid
     */
    public static RegexLexer create(Config config, @NonNull Map<String, List<Rule>> rules) {
        if (config == null) {
            config = Config.DEFAULT;
        }
        if (!rules.containsKey(ROOT)) {
            throw new CompilationException(ROOT, null, "No \"root\" state");
        }

        var declared = new LinkedHashMap<String, List<CompiledRule>>();
        for (var entry : rules.entrySet()) {
            var state = entry.getKey();
            var compiled = new ArrayList<CompiledRule>();
            for (var rule : entry.getValue()) {
                compiled.add(compile(state, rule, config, rules));
            }
            declared.put(state, compiled);
        }

        var expanded = new LinkedHashMap<String, List<CompiledRule>>();
        var ruleCount = 0;
        for (var state : declared.keySet()) {
            var flat = List.copyOf(expand(state, declared, new ArrayDeque<>()));
            expanded.put(state, flat);
            ruleCount += flat.size();
        }

        log.debug("Compiled lexer \"{}\": {} states, {} rules", config.name(), expanded.size(), ruleCount);
        return new RegexLexer(config, Map.copyOf(expanded), null);
    }

    private static CompiledRule compile(String state, Rule rule, Config config, Map<String, List<Rule>> rules) {
        if (rule.isInclude()) {
            if (!rules.containsKey(rule.include())) {
                throw new CompilationException(state, null, "Unknown included state \"" + rule.include() + "\"");
            }
            return new CompiledRule(rule, state, null);
        }

        var regex = PatternCompiler.compile(state, rule.pattern(), config);
        if (rule.emitter() instanceof Emitter.ByGroups byGroups) {
            var groups = PatternCompiler.groupCount(regex);
            if (groups != byGroups.emitters().size()) {
                throw new CompilationException(state, rule.pattern(),
                    "Pattern has " + groups + " groups but " + byGroups.emitters().size() + " emitters");
            }
        }
        checkEmitter(state, rule, rule.emitter(), rules);
        checkTargets(state, rule, rule.mutator(), rules);
        return new CompiledRule(rule, state, regex);
    }

    private static void checkEmitter(String state, Rule rule, Emitter emitter, Map<String, List<Rule>> rules) {
        if (emitter instanceof Emitter.UsingSelf usingSelf) {
            checkTarget(state, rule, usingSelf.state(), rules);
        } else if (emitter instanceof Emitter.ByGroups byGroups) {
            byGroups.emitters().forEach(inner -> checkEmitter(state, rule, inner, rules));
        }
    }

    private static void checkTargets(String state, Rule rule, Mutator mutator, Map<String, List<Rule>> rules) {
        if (mutator instanceof Mutator.Push push) {
            push.states().forEach(target -> checkTarget(state, rule, target, rules));
        } else if (mutator instanceof Mutator.Replace replace) {
            checkTarget(state, rule, replace.state(), rules);
        } else if (mutator instanceof Mutator.Set set) {
            set.states().forEach(target -> checkTarget(state, rule, target, rules));
        } else if (mutator instanceof Mutator.Combined combined) {
            combined.mutators().forEach(inner -> checkTargets(state, rule, inner, rules));
        }
    }

    private static void checkTarget(String state, Rule rule, String target, Map<String, List<Rule>> rules) {
        if (!rules.containsKey(target)) {
            throw new CompilationException(state, rule.pattern(), "Unknown target state \"" + target + "\"");
        }
    }

    private static List<CompiledRule> expand(
            String state,
            Map<String, List<CompiledRule>> declared,
            Deque<String> including) {
        if (including.contains(state)) {
            throw new CompilationException(state, null, "Include cycle: " + including + " -> " + state);
        }
        including.push(state);
        var flat = new ArrayList<CompiledRule>();
        for (var compiled : declared.get(state)) {
            if (compiled.rule().isInclude()) {
                flat.addAll(expand(compiled.rule().include(), declared, including));
            } else {
                flat.add(compiled);
            }
        }
        including.pop();
        return flat;
    }

    /**
     * A copy of this lexer that scores text with {@code analyser}.
     */
    public RegexLexer withAnalyser(Analyser analyser) {
        return new RegexLexer(config, rules, analyser);
    }

    @Override
    public Config config() {
        return config;
    }

    /**
     * Scores {@code text} with the analyser given to {@link #withAnalyser}, clamped to
     * {@code [0, 1]}. Without an analyser every text scores {@code 0}.
     */
    @Override
    public float analyseText(String text) {
        if (analyser == null) {
            return 0.0f;
        }
        var score = analyser.analyseText(text);
        if (Float.isNaN(score)) {
            return 0.0f;
        }
        return Math.max(0.0f, Math.min(1.0f, score));
    }

    @Override
    public void tokenize(TokenizeOptions options, @NonNull String text, @NonNull Consumer<Token> out) {
        if (options == null) {
            options = TokenizeOptions.DEFAULT;
        }
        var state = new LexerState(this, text, options.state());
        var zeroWidthSteps = 0;

        while (state.getPos() < text.length() && !state.isStackEmpty()) {
            var pos = state.getPos();
            state.setState(state.peek());
            var candidates = rules.get(state.getState());
            if (candidates == null) {
                throw new TokenizationException(state, "Unknown state");
            }

            var matched = matchRules(state, candidates);
            if (matched == null) {
                var end = text.offsetByCodePoints(pos, 1);
                log.trace("No rule matches in state \"{}\" at offset {}", state.getState(), pos);
                out.accept(new Token(ERROR, text.substring(pos, end)));
                state.setPos(end);
                zeroWidthSteps = 0;
                continue;
            }

            var matcher = state.matcher(matched.regex());
            state.setGroups(groups(matcher));
            state.setPos(matcher.end());
            if (matcher.end() == pos) {
                if (++zeroWidthSteps > MAX_ZERO_WIDTH_STEPS) {
                    throw new TokenizationException(state,
                        "No progress after " + MAX_ZERO_WIDTH_STEPS + " zero-width matches");
                }
            } else {
                zeroWidthSteps = 0;
            }

            var rule = matched.rule();
            if (rule.mutator() != null) {
                rule.mutator().mutate(state);
            }
            if (rule.emitter() != null) {
                rule.emitter().emit(state.getGroups(), state, out);
            }
        }
    }

    /**
     * The first rule matching at the scan offset, or {@code null}. Zero-width matches only count
     * for rules that move the state stack, since nothing else could make progress from them.
     */
    private static CompiledRule matchRules(LexerState state, List<CompiledRule> candidates) {
        var pos = state.getPos();
        for (int i = 0; i < candidates.size(); i++) {
            var candidate = candidates.get(i);
            var matcher = state.matcher(candidate.regex());
            matcher.region(pos, state.getText().length());
            if (!matcher.lookingAt()) {
                continue;
            }
            if (matcher.end() == pos && candidate.rule().mutator() == null) {
                log.trace("Skipping zero-width match of {} in state \"{}\"", candidate.rule().pattern(), candidate.state());
                continue;
            }
            state.setRule(i);
            return candidate;
        }
        return null;
    }

    private static List<String> groups(Matcher matcher) {
        var groups = new ArrayList<String>(matcher.groupCount() + 1);
        for (int i = 0; i <= matcher.groupCount(); i++) {
            var group = matcher.group(i);
            groups.add(group != null ? group : "");
        }
        return List.copyOf(groups);
    }

    @Override
    public String toString() {
        return "(RegexLexer \"" + config.name() + "\" " + rules.keySet() + ")";
    }
}
