package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.code.SclKeywords;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits one line of statement text into lexemes.
 *
 * <p>The scan is a single left-to-right pass. The concatenated token texts always equal the input
 * line: whitespace runs are kept as tokens and any character that fits no rule becomes an
 * {@link LexTokenType#UNKNOWN} token. The lexer never fails.</p>
 */
public final class SclLexer {

    /** Longest first, so that {@code :=} wins over {@code :}. */
    private static final String[] OPERATORS = {
            ":=", "=>", "<>", ">=", "<=", "**", "..",
            "=", "<", ">", "+", "-", "*", "/", "&", ";", "(", ")", "[", "]", ",", ".", ":"
    };

    /** Typed-literal prefixes whose values contain dashes (dates). */
    private static final Set<String> DATE_PREFIXES = Set.of(
            "D", "DATE", "DT", "DATE_AND_TIME", "LDT", "LD", "DTL");

    private SclLexer() {}

    public static List<LexToken> tokenize(String line) {
        List<LexToken> out = new ArrayList<>();
        if (line == null || line.isEmpty()) return out;

        final int n = line.length();
        int i = 0;
        while (i < n) {
            char c = line.charAt(i);

            if (Character.isWhitespace(c)) {
                int j = i;
                while (j < n && Character.isWhitespace(line.charAt(j))) j++;
                out.add(new LexToken(LexTokenType.WHITESPACE, line.substring(i, j)));
                i = j;
                continue;
            }

            if (line.startsWith("//", i)) {
                out.add(new LexToken(LexTokenType.LINE_COMMENT, line.substring(i)));
                break;
            }

            if (line.startsWith("(*", i) || line.startsWith("/*", i)) {
                String close = line.charAt(i) == '(' ? "*)" : "*/";
                int end = line.indexOf(close, i + 2);
                if (end >= 0) {
                    out.add(new LexToken(LexTokenType.BLOCK_COMMENT, line.substring(i, end + 2)));
                    i = end + 2;
                    continue;
                }
            }

            if (c == '"') {
                int end = line.indexOf('"', i + 1);
                if (end < 0) {
                    out.add(new LexToken(LexTokenType.UNKNOWN, line.substring(i)));
                    break;
                }
                out.add(new LexToken(LexTokenType.GLOBAL_NAME, line.substring(i, end + 1)));
                i = end + 1;
                continue;
            }

            if (c == '\'') {
                int end = scanString(line, i);
                if (end < 0) {
                    out.add(new LexToken(LexTokenType.UNKNOWN, line.substring(i)));
                    break;
                }
                out.add(new LexToken(LexTokenType.STRING_LITERAL, line.substring(i, end + 1)));
                i = end + 1;
                continue;
            }

            if (c == '#' && i + 1 < n && isIdentStart(line.charAt(i + 1))) {
                int j = scanWord(line, i + 1);
                out.add(new LexToken(LexTokenType.LOCAL_NAME, line.substring(i, j)));
                i = j;
                continue;
            }

            if (Character.isDigit(c)) {
                int j = scanNumber(line, i);
                out.add(new LexToken(LexTokenType.LITERAL, line.substring(i, j)));
                i = j;
                continue;
            }

            if (isIdentStart(c)) {
                int j = scanWord(line, i);
                String word = line.substring(i, j);
                if (j + 1 < n && line.charAt(j) == '#' && isTypedValueStart(line.charAt(j + 1))) {
                    int end = scanTypedValue(line, j + 1, DATE_PREFIXES.contains(word.toUpperCase(Locale.ROOT)));
                    out.add(new LexToken(LexTokenType.TYPED_LITERAL, line.substring(i, end)));
                    i = end;
                } else if (SclKeywords.isBooleanLiteral(word)) {
                    out.add(new LexToken(LexTokenType.LITERAL, word));
                    i = j;
                } else if (SclKeywords.isKeyword(word)) {
                    out.add(new LexToken(LexTokenType.KEYWORD, word));
                    i = j;
                } else {
                    out.add(new LexToken(LexTokenType.IDENTIFIER, word));
                    i = j;
                }
                continue;
            }

            String op = matchOperator(line, i);
            if (op != null) {
                out.add(new LexToken(LexTokenType.OPERATOR, op));
                i += op.length();
                continue;
            }

            int cp = line.codePointAt(i);
            int len = Character.charCount(cp);
            out.add(new LexToken(LexTokenType.UNKNOWN, line.substring(i, i + len)));
            i += len;
        }
        return out;
    }

    private static String matchOperator(String line, int at) {
        for (String op : OPERATORS) {
            if (line.startsWith(op, at)) return op;
        }
        return null;
    }

    /** Index of the closing quote; {@code $'} is an escaped quote. */
    private static int scanString(String line, int open) {
        for (int k = open + 1; k < line.length(); k++) {
            char ch = line.charAt(k);
            if (ch == '$') {
                k++;
            } else if (ch == '\'') {
                return k;
            }
        }
        return -1;
    }

    private static int scanWord(String line, int from) {
        int j = from;
        while (j < line.length() && isIdentPart(line.charAt(j))) j++;
        return j;
    }

    private static int scanNumber(String line, int from) {
        final int n = line.length();
        int j = from;
        while (j < n && (Character.isDigit(line.charAt(j)) || line.charAt(j) == '_')) j++;

        // Based integers: 16#FF, 2#1010_0000
        if (j + 1 < n && line.charAt(j) == '#' && Character.isLetterOrDigit(line.charAt(j + 1))) {
            j++;
            while (j < n && (Character.isLetterOrDigit(line.charAt(j)) || line.charAt(j) == '_')) j++;
            return j;
        }

        // Fraction, but never the first dot of a range operator.
        if (j + 1 < n && line.charAt(j) == '.' && Character.isDigit(line.charAt(j + 1))) {
            j++;
            while (j < n && Character.isDigit(line.charAt(j))) j++;
        }

        if (j < n && (line.charAt(j) == 'e' || line.charAt(j) == 'E')) {
            int k = j + 1;
            if (k < n && (line.charAt(k) == '+' || line.charAt(k) == '-')) k++;
            if (k < n && Character.isDigit(line.charAt(k))) {
                while (k < n && Character.isDigit(line.charAt(k))) k++;
                j = k;
            }
        }
        return j;
    }

    private static boolean isTypedValueStart(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '+' || c == '_';
    }

    private static int scanTypedValue(String line, int from, boolean allowDashes) {
        final int n = line.length();
        int j = from;

        // Based values: W#16#FF, DW#16#FFFF_0000
        int radix = j;
        while (radix < n && Character.isDigit(line.charAt(radix))) radix++;
        if (radix > j && radix + 1 < n && line.charAt(radix) == '#' && Character.isLetterOrDigit(line.charAt(radix + 1))) {
            int k = radix + 1;
            while (k < n && (Character.isLetterOrDigit(line.charAt(k)) || line.charAt(k) == '_')) k++;
            return k;
        }

        if (j < n && (line.charAt(j) == '-' || line.charAt(j) == '+')) j++;
        while (j < n) {
            char ch = line.charAt(j);
            if (Character.isLetterOrDigit(ch) || ch == '_' || ch == '.' || ch == ':') {
                // "1..5" after a typed value is a range, not a fraction.
                if (ch == '.' && j + 1 < n && line.charAt(j + 1) == '.') break;
                j++;
            } else if (ch == '-' && allowDashes) {
                j++;
            } else {
                break;
            }
        }
        return j;
    }

    static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
