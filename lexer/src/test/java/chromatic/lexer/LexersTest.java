package chromatic.lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import org.junit.jupiter.api.Test;

public class LexersTest {

    private static RegexLexer scoring(String name, float score) {
        return RegexLexer.create(Config.builder().name(name).build(), Map.of("root", List.of()))
            .withAnalyser(text -> score);
    }

    /** A lexer that cannot analyse text. */
    private static Lexer plain(String name) {
        var config = Config.builder().name(name).build();
        return new Lexer() {
            @Override
            public Config config() {
                return config;
            }

            @Override
            public void tokenize(TokenizeOptions options, String text, Consumer<Token> out) {
            }
        };
    }

    @Test
    void earliestHighestScoreWins() {
        var low = scoring("low", 0.2f);
        var first = scoring("first", 0.9f);
        var second = scoring("second", 0.9f);

        assertSame(first, Lexers.pick(List.of(low, first, second), "text").orElseThrow());
    }

    @Test
    void lexersWithoutAnalyserAreIgnored() {
        var plain = plain("plain");
        var weak = scoring("weak", 0.1f);

        assertSame(weak, Lexers.pick(List.of(plain, weak), "text").orElseThrow());
    }

    @Test
    void noAnalysersMeansNoDecision() {
        assertEquals(Optional.empty(), Lexers.pick(List.of(plain("a"), plain("b")), "text"));
        assertEquals(Optional.empty(), Lexers.pick(List.of(), "text"));
    }

    @Test
    void zeroScoreStillCounts() {
        var silent = RegexLexer.create(Config.builder().name("silent").build(), Map.of("root", List.of()));

        assertTrue(Lexers.pick(List.of(silent), "text").isPresent());
    }

    @Test
    void analyserSeesTheSample() {
        var shebang = scoring("plain", 0.0f);
        var python = RegexLexer.create(Config.builder().name("python").build(), Map.of("root", List.of()))
            .withAnalyser(text -> text.startsWith("#!/usr/bin/env python") ? 1.0f : 0.0f);

        assertSame(python, Lexers.pick(List.of(shebang, python), "#!/usr/bin/env python\n").orElseThrow());
        assertSame(shebang, Lexers.pick(List.of(shebang, python), "print 1").orElseThrow());
    }

    @Test
    void scoresAreClamped() {
        assertEquals(1.0f, scoring("high", 7.5f).analyseText(""));
        assertEquals(0.0f, scoring("negative", -2.0f).analyseText(""));
        assertEquals(0.0f, scoring("nan", Float.NaN).analyseText(""));
    }
}
