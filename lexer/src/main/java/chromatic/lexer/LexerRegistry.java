package chromatic.lexer;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * A set of lexers addressable by the identity fields of their {@link Config}.
 */
@Slf4j
public final class LexerRegistry {

    private record Globs(Lexer lexer, List<PathMatcher> primary, List<PathMatcher> secondary) {}

    private final List<Lexer> lexers = new ArrayList<>();
    private final List<Globs> globs = new ArrayList<>();
    private final Map<String, Lexer> byName = new HashMap<>();

    /**
     * @throws IllegalArgumentException if the lexer has no name, its name or an alias is taken, or
     *                                  one of its file name globs is malformed
     */
    public LexerRegistry register(@NonNull Lexer lexer) {
        var config = lexer.config();
        if (config.name().isBlank()) {
            throw new IllegalArgumentException("Cannot register an unnamed lexer");
        }
        var keys = new ArrayList<String>();
        keys.add(key(config.name()));
        config.aliases().forEach(alias -> keys.add(key(alias)));
        for (var key : keys) {
            if (byName.containsKey(key)) {
                throw new IllegalArgumentException("Lexer name or alias already registered: " + key);
            }
        }
        var compiled = new Globs(lexer, compile(config.filenames()), compile(config.aliasFilenames()));
        keys.forEach(key -> byName.put(key, lexer));
        lexers.add(lexer);
        globs.add(compiled);
        log.debug("Registered lexer \"{}\" (aliases {})", config.name(), config.aliases());
        return this;
    }

    /** Registered lexers, in registration order. */
    public List<Lexer> lexers() {
        return Collections.unmodifiableList(lexers);
    }

    /** Looks a lexer up by name or alias, ignoring case. */
    public Optional<Lexer> get(@NonNull String name) {
        return Optional.ofNullable(byName.get(key(name)));
    }

    /**
     * Finds the first lexer whose file name globs match the last segment of {@code filename},
     * trying primary globs of every lexer before any secondary ones.
     */
    public Optional<Lexer> match(@NonNull String filename) {
        var name = baseName(filename);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        Path path;
        try {
            path = Path.of(name);
        } catch (InvalidPathException ex) {
            log.debug("Not a matchable file name: {}", ex.getMessage());
            return Optional.empty();
        }
        return matchGlobs(path, Globs::primary)
            .or(() -> matchGlobs(path, Globs::secondary));
    }

    public Optional<Lexer> matchMimeType(@NonNull String mimeType) {
        return lexers.stream()
            .filter(lexer -> lexer.config().mimeTypes().stream().anyMatch(mimeType::equalsIgnoreCase))
            .findFirst();
    }

    /** Picks the registered lexer most confident about {@code text}; see {@link Lexers#pick}. */
    public Optional<Lexer> analyse(@NonNull String text) {
        return Lexers.pick(lexers, text);
    }

    private Optional<Lexer> matchGlobs(Path path, Function<Globs, List<PathMatcher>> matchers) {
        return globs.stream()
            .filter(entry -> matchers.apply(entry).stream().anyMatch(matcher -> matcher.matches(path)))
            .map(Globs::lexer)
            .findFirst();
    }

    private static List<PathMatcher> compile(List<String> patterns) {
        return patterns.stream()
            .map(LexerRegistry::compileGlob)
            .collect(Collectors.toUnmodifiableList());
    }

    private static PathMatcher compileGlob(String glob) {
        try {
            return FileSystems.getDefault().getPathMatcher("glob:" + glob);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException("Malformed file name glob \"" + glob + "\": " + ex.getDescription(), ex);
        }
    }

    private static String baseName(String filename) {
        var slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        return filename.substring(slash + 1);
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
