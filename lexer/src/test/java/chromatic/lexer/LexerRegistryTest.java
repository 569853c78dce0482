package chromatic.lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class LexerRegistryTest {

    LexerRegistry registry;
    RegexLexer c;
    RegexLexer cpp;
    RegexLexer python;

    private static RegexLexer lexer(Config config) {
        return RegexLexer.create(config, Map.of("root", List.of()));
    }

    @BeforeEach
    void setUp() {
        c = lexer(Config.builder()
            .name("C")
            .filename("*.c")
            .aliasFilename("*.h")
            .mimeType("text/x-csrc")
            .build());
        cpp = lexer(Config.builder()
            .name("C++")
            .alias("cpp")
            .filename("*.cpp")
            .filename("*.h")
            .build());
        python = lexer(Config.builder()
            .name("Python")
            .alias("py")
            .alias("python3")
            .filename("*.py")
            .mimeType("text/x-python")
            .build())
            .withAnalyser(text -> text.contains("def ") ? 0.8f : 0.0f);
        registry = new LexerRegistry().register(c).register(cpp).register(python);
    }

    @Test
    void getByNameOrAliasIgnoringCase() {
        assertSame(python, registry.get("python").orElseThrow());
        assertSame(python, registry.get("PY").orElseThrow());
        assertSame(cpp, registry.get("cpp").orElseThrow());
        assertEquals(Optional.empty(), registry.get("ruby"));
    }

    @Test
    void matchUsesTheBaseName() {
        assertSame(python, registry.match("src/app/main.py").orElseThrow());
        assertSame(c, registry.match("C:\\src\\main.c").orElseThrow());
        assertEquals(Optional.empty(), registry.match("README"));
        assertEquals(Optional.empty(), registry.match("dir/"));
    }

    @Test
    void primaryGlobsBeatSecondaryOnes() {
        assertSame(cpp, registry.match("stdio.h").orElseThrow());
    }

    @Test
    void matchMimeType() {
        assertSame(c, registry.matchMimeType("TEXT/X-CSRC").orElseThrow());
        assertEquals(Optional.empty(), registry.matchMimeType("text/plain"));
    }

    @Test
    void analysePicksAmongRegisteredLexers() {
        assertSame(python, registry.analyse("def main():\n    pass\n").orElseThrow());
        assertSame(c, registry.analyse("int main() {}").orElseThrow());
    }

    @Test
    void duplicateNamesAreRejected() {
        var clash = lexer(Config.builder().name("other").alias("c++").build());

        assertThrows(IllegalArgumentException.class, () -> registry.register(clash));
        assertEquals(3, registry.lexers().size());
    }

    @Test
    void malformedGlobIsRejectedAtRegistration() {
        var broken = lexer(Config.builder().name("broken").filename("*.{py").build());

        assertThrows(IllegalArgumentException.class, () -> registry.register(broken));
        assertEquals(Optional.empty(), registry.get("broken"));
        assertSame(python, registry.match("a.py").orElseThrow());
    }

    @Test
    void unmatchableFileNameMatchesNothing() {
        assertEquals(Optional.empty(), registry.match("a\0.py"));
    }

    @Test
    void unnamedLexersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(lexer(Config.DEFAULT)));
    }

    @Test
    void lexersKeepRegistrationOrder() {
        assertEquals(List.of(c, cpp, python), registry.lexers());
    }
}
