package chromatic.lexer;

import java.util.List;
import java.util.function.Consumer;

import lombok.NonNull;

/**
 * A typed slice of the input text.
 */
public record Token(
    @NonNull Type type,
    @NonNull String value) {

    @Override
    public String toString() {
        return "(Token " + type + " \"" + value + "\")";
    }

    /**
     * Token taxonomy. Each type knows its parent, so {@code STRING_DOUBLE.isA(LITERAL)} holds.
     * A type is also an {@link Emitter} that emits the whole match as a single token.
     */
    public enum Type implements Emitter {
        // reserved for input no rule matched
        ERROR(null),
        OTHER(null),

        TEXT(null),
        WHITESPACE(TEXT),

        KEYWORD(null),
        KEYWORD_CONSTANT(KEYWORD),
        KEYWORD_DECLARATION(KEYWORD),
        KEYWORD_NAMESPACE(KEYWORD),
        KEYWORD_PSEUDO(KEYWORD),
        KEYWORD_RESERVED(KEYWORD),
        KEYWORD_TYPE(KEYWORD),

        NAME(null),
        NAME_ATTRIBUTE(NAME),
        NAME_BUILTIN(NAME),
        NAME_CLASS(NAME),
        NAME_CONSTANT(NAME),
        NAME_DECORATOR(NAME),
        NAME_FUNCTION(NAME),
        NAME_LABEL(NAME),
        NAME_NAMESPACE(NAME),
        NAME_PROPERTY(NAME),
        NAME_TAG(NAME),
        NAME_VARIABLE(NAME),

        LITERAL(null),
        LITERAL_DATE(LITERAL),

        STRING(LITERAL),
        STRING_BACKTICK(STRING),
        STRING_CHAR(STRING),
        STRING_DOC(STRING),
        STRING_DOUBLE(STRING),
        STRING_ESCAPE(STRING),
        STRING_HEREDOC(STRING),
        STRING_INTERPOL(STRING),
        STRING_REGEX(STRING),
        STRING_SINGLE(STRING),
        STRING_SYMBOL(STRING),

        NUMBER(LITERAL),
        NUMBER_BIN(NUMBER),
        NUMBER_FLOAT(NUMBER),
        NUMBER_HEX(NUMBER),
        NUMBER_INTEGER(NUMBER),
        NUMBER_OCT(NUMBER),

        OPERATOR(null),
        OPERATOR_WORD(OPERATOR),

        PUNCTUATION(null),

        COMMENT(null),
        COMMENT_HASHBANG(COMMENT),
        COMMENT_MULTILINE(COMMENT),
        COMMENT_PREPROC(COMMENT),
        COMMENT_SINGLE(COMMENT),
        COMMENT_SPECIAL(COMMENT),

        GENERIC(null),
        GENERIC_DELETED(GENERIC),
        GENERIC_EMPH(GENERIC),
        GENERIC_ERROR(GENERIC),
        GENERIC_HEADING(GENERIC),
        GENERIC_INSERTED(GENERIC),
        GENERIC_OUTPUT(GENERIC),
        GENERIC_PROMPT(GENERIC),
        GENERIC_STRONG(GENERIC),
        GENERIC_SUBHEADING(GENERIC),
        GENERIC_TRACEBACK(GENERIC);

        private final Type parent;

        Type(Type parent) {
            this.parent = parent;
        }

        /** The direct parent, or {@code null} for a top-level category. */
        public Type parent() {
            return parent;
        }

        public Type category() {
            var type = this;
            while (type.parent != null) {
                type = type.parent;
            }
            return type;
        }

        public boolean isA(@NonNull Type ancestor) {
            for (var type = this; type != null; type = type.parent) {
                if (type == ancestor) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public void emit(List<String> groups, LexerState state, Consumer<Token> out) {
            out.accept(new Token(this, groups.get(0)));
        }
    }
}
