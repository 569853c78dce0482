package chromatic.lexer;

import java.util.Collection;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Lexers {

    /**
     * Picks the lexer most confident about {@code text}.
     *
     * <p>Only lexers implementing {@link Analyser} take part. Ties go to the earliest candidate.
     *
     * @return the best candidate, or empty if none of them can analyse text
     */
    public static Optional<Lexer> pick(@NonNull Collection<? extends Lexer> lexers, @NonNull String text) {
        Lexer picked = null;
        var highest = -1.0f;
        for (var lexer : lexers) {
            if (lexer instanceof Analyser analyser) {
                var score = analyser.analyseText(text);
                if (score > highest) {
                    highest = score;
                    picked = lexer;
                }
            }
        }
        if (picked != null) {
            log.debug("Picked lexer \"{}\" with score {}", picked.config().name(), highest);
        }
        return Optional.ofNullable(picked);
    }
}
