package info.isaksson.erland.scltoxml.scl;

import java.util.Objects;

/** One lexeme with its exact source text. */
public final class LexToken {
    public final LexTokenType type;
    public final String text;

    public LexToken(LexTokenType type, String text) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    public boolean isOperator(String op) {
        return type == LexTokenType.OPERATOR && text.equals(op);
    }

    /** Name without the {@code #} prefix or the surrounding double quotes. */
    public String bareName() {
        return switch (type) {
            case LOCAL_NAME -> text.substring(1);
            case GLOBAL_NAME -> text.length() >= 2 ? text.substring(1, text.length() - 1) : text;
            default -> text;
        };
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LexToken)) return false;
        LexToken that = (LexToken) o;
        return type == that.type && text.equals(that.text);
    }

    @Override public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override public String toString() {
        return type + "(" + text + ")";
    }
}
