package info.isaksson.erland.scltoxml.ir.code;

import java.util.Locale;
import java.util.Set;

/** Reserved words of the statement language that are kept as plain tokens. */
public final class SclKeywords {

    private static final Set<String> KEYWORDS = Set.of(
            "IF", "THEN", "ELSIF", "ELSEIF", "ELSE", "END_IF",
            "CASE", "OF", "END_CASE",
            "FOR", "TO", "BY", "DO", "END_FOR",
            "WHILE", "END_WHILE",
            "REPEAT", "UNTIL", "END_REPEAT",
            "EXIT", "CONTINUE", "RETURN", "GOTO",
            "REGION", "END_REGION",
            "AND", "OR", "XOR", "NOT", "MOD"
    );

    private static final Set<String> BOOLEAN_LITERALS = Set.of("TRUE", "FALSE");

    private SclKeywords() {}

    public static boolean isKeyword(String word) {
        return word != null && KEYWORDS.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isBooleanLiteral(String word) {
        return word != null && BOOLEAN_LITERALS.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isIdentifier(String word) {
        if (word == null || word.isEmpty()) return false;
        char first = word.charAt(0);
        if (!(Character.isLetter(first) || first == '_')) return false;
        for (int i = 1; i < word.length(); i++) {
            char c = word.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_')) return false;
        }
        return true;
    }

    /** Classifies the text of a plain {@code Token} element read back from XML. */
    public static CodeToken classify(String text) {
        if (isKeyword(text)) return CodeToken.keyword(text);
        if (isIdentifier(text)) return CodeToken.identifier(text);
        return CodeToken.operator(text);
    }
}
