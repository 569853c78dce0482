package chromatic.lexer;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Compiles rule patterns with the flags of their lexer.
 *
 * <p>The compiled pattern is wrapped in a non-capturing group, so alternations in the rule stay
 * anchored as a whole and group numbering is the rule author's. Anchoring itself happens at match
 * time: {@link RegexLexer} runs {@link java.util.regex.Matcher#lookingAt()} over a region that
 * starts at the scan offset.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class PatternCompiler {

    static int flags(Config config) {
        var flags = 0;
        if (!config.notMultiline()) {
            flags |= Pattern.MULTILINE;
        }
        if (config.caseInsensitive()) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        if (config.dotAll()) {
            flags |= Pattern.DOTALL;
        }
        return flags;
    }

    /**
     * @throws CompilationException if {@code pattern} is not a valid regular expression
     */
    static Pattern compile(String state, String pattern, Config config) {
        try {
            return Pattern.compile("(?:" + pattern + ")", flags(config));
        } catch (PatternSyntaxException ex) {
            throw new CompilationException(state, pattern, "Invalid pattern: " + ex.getDescription(), ex);
        }
    }

    static int groupCount(Pattern pattern) {
        return pattern.matcher("").groupCount();
    }
}
