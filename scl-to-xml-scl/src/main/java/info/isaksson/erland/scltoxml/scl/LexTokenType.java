package info.isaksson.erland.scltoxml.scl;

/** Flat token classes produced by {@link SclLexer}. */
public enum LexTokenType {
    WHITESPACE,
    OPERATOR,
    KEYWORD,
    IDENTIFIER,
    /** {@code #name} */
    LOCAL_NAME,
    /** {@code "name"} */
    GLOBAL_NAME,
    /** Numbers and TRUE/FALSE. */
    LITERAL,
    /** {@code T#5s}, {@code DINT#7}, {@code TOD#12:00:00} */
    TYPED_LITERAL,
    /** {@code 'text'} */
    STRING_LITERAL,
    LINE_COMMENT,
    BLOCK_COMMENT,
    UNKNOWN,
    /** Joins two source lines of one statement; never produced by the lexer itself. */
    LINE_BREAK
}
