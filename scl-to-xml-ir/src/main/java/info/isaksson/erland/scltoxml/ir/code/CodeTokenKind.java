package info.isaksson.erland.scltoxml.ir.code;

/** Variants of {@link CodeToken}. */
public enum CodeTokenKind {
    WHITESPACE,
    OPERATOR,
    KEYWORD,
    /** Bare name that is neither a local ({@code #x}) nor a global ({@code "x"}) reference. */
    IDENTIFIER,
    ACCESS,
    LITERAL_CONSTANT,
    TYPED_CONSTANT,
    CALL,
    /** {@code // ...} to end of line; text holds what follows the slashes. */
    LINE_COMMENT,
    /** Raw text kept verbatim, e.g. a single-line {@code (* ... *)} comment. */
    TEXT
}
