package chromatic.lexer;

import java.util.List;

import lombok.Builder;
import lombok.Singular;

/**
 * Immutable lexer settings.
 *
 * <p>The identity fields (name, aliases, file globs, MIME types) are only consulted by
 * {@link LexerRegistry}; matching uses the three regex flags.
 *
 * @param caseInsensitive patterns match regardless of case
 * @param dotAll          {@code .} also matches line terminators
 * @param notMultiline    {@code ^} and {@code $} match only at the start and end of the input
 */
@Builder(toBuilder = true)
public record Config(
    String name,
    @Singular("alias") List<String> aliases,
    @Singular("filename") List<String> filenames,
    @Singular("aliasFilename") List<String> aliasFilenames,
    @Singular("mimeType") List<String> mimeTypes,
    boolean caseInsensitive,
    boolean dotAll,
    boolean notMultiline) {

    public static final Config DEFAULT = Config.builder().build();

    public Config {
        name = name != null ? name : "";
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        filenames = filenames != null ? List.copyOf(filenames) : List.of();
        aliasFilenames = aliasFilenames != null ? List.copyOf(aliasFilenames) : List.of();
        mimeTypes = mimeTypes != null ? List.copyOf(mimeTypes) : List.of();
    }
}
