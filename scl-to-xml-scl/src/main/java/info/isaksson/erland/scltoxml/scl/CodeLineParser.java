package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.code.AccessScope;
import info.isaksson.erland.scltoxml.ir.code.CallParameter;
import info.isaksson.erland.scltoxml.ir.code.CodeToken;
import info.isaksson.erland.scltoxml.ir.code.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups the flat lexemes of one code line into a token tree: dotted and indexed access paths,
 * calls with their parameters, constants and plain tokens.
 *
 * <p>A line that leaves a parenthesis open is joined with the following lines until it closes, so a
 * call written over several lines is still one call. The joins become line-break tokens; rendering
 * the tree always gives back the original lines.</p>
 */
public final class CodeLineParser {

    private final ScopeRules scopes;

    public CodeLineParser(ScopeRules scopes) {
        this.scopes = scopes == null ? ScopeRules.defaults() : scopes;
    }

    public List<CodeToken> parseLine(String line) {
        List<LexToken> lex = SclLexer.tokenize(line);
        return parseRange(lex, 0, lex.size());
    }

    /**
     * Parses code lines; a statement spanning several lines yields one entry holding
     * {@link CodeToken#lineBreak()} tokens where the lines were joined.
     */
    public List<List<CodeToken>> parseLines(List<String> lines) {
        List<List<CodeToken>> out = new ArrayList<>(lines.size());
        List<LexToken> pending = new ArrayList<>();
        int depth = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (!pending.isEmpty()) {
                pending.add(new LexToken(LexTokenType.LINE_BREAK, CodeToken.LINE_BREAK));
            }
            List<LexToken> lex = SclLexer.tokenize(lines.get(i));
            pending.addAll(lex);
            depth += parenthesisBalance(lex);
            if (depth <= 0 || i == lines.size() - 1) {
                out.add(parseRange(pending, 0, pending.size()));
                pending = new ArrayList<>();
                depth = 0;
            }
        }
        return out;
    }

    private static int parenthesisBalance(List<LexToken> lex) {
        int balance = 0;
        for (LexToken t : lex) {
            if (t.isOperator("(")) {
                balance++;
            } else if (t.isOperator(")")) {
                balance--;
            }
        }
        return balance;
    }

    private List<CodeToken> parseRange(List<LexToken> lex, int from, int to) {
        List<CodeToken> out = new ArrayList<>();
        int i = from;
        while (i < to) {
            LexToken t = lex.get(i);
            switch (t.type) {
                case WHITESPACE -> {
                    out.add(CodeToken.whitespace(t.text.length()));
                    i++;
                }
                case LOCAL_NAME, GLOBAL_NAME -> i = parseReference(lex, i, to, out);
                case IDENTIFIER -> {
                    int close = i + 1 < to && lex.get(i + 1).isOperator("(") ? matching(lex, i + 1, to, "(", ")") : -1;
                    if (close > 0) {
                        out.add(CodeToken.instructionCall(t.text, parseParameters(lex, i + 2, close)));
                        i = close + 1;
                    } else {
                        out.add(CodeToken.identifier(t.text));
                        i++;
                    }
                }
                case KEYWORD -> {
                    out.add(CodeToken.keyword(t.text));
                    i++;
                }
                case LITERAL, STRING_LITERAL -> {
                    out.add(CodeToken.literal(t.text));
                    i++;
                }
                case TYPED_LITERAL -> {
                    out.add(CodeToken.typedLiteral(t.text));
                    i++;
                }
                case LINE_COMMENT -> {
                    out.add(CodeToken.lineComment(t.text.substring(2)));
                    i++;
                }
                case BLOCK_COMMENT -> {
                    out.add(CodeToken.text(t.text));
                    i++;
                }
                case LINE_BREAK -> {
                    out.add(CodeToken.lineBreak());
                    i++;
                }
                default -> {
                    out.add(CodeToken.operator(t.text));
                    i++;
                }
            }
        }
        return out;
    }

    /** Parses {@code #a.b[i].c} or {@code "DB".x}, optionally followed by a call; returns the next index. */
    private int parseReference(List<LexToken> lex, int start, int to, List<CodeToken> out) {
        LexToken head = lex.get(start);
        boolean local = head.type == LexTokenType.LOCAL_NAME;

        List<String> names = new ArrayList<>();
        List<List<CodeToken>> indices = new ArrayList<>();
        names.add(head.bareName());
        indices.add(null);

        int j = start + 1;
        while (j < to) {
            LexToken t = lex.get(j);
            if (t.isOperator("[")) {
                int close = matching(lex, j, to, "[", "]");
                if (close < 0 || indices.get(indices.size() - 1) != null) break;
                indices.set(indices.size() - 1, parseRange(lex, j + 1, close));
                j = close + 1;
            } else if (t.isOperator(".") && j + 1 < to && lex.get(j + 1).type == LexTokenType.IDENTIFIER) {
                names.add(lex.get(j + 1).text);
                indices.add(null);
                j += 2;
            } else {
                break;
            }
        }

        List<Component> path = new ArrayList<>(names.size());
        for (int k = 0; k < names.size(); k++) {
            path.add(new Component(names.get(k), indices.get(k)));
        }

        boolean callFollows = j < to && lex.get(j).isOperator("(");
        int close = callFollows ? matching(lex, j, to, "(", ")") : -1;

        AccessScope scope;
        if (close > 0) {
            scope = local ? AccessScope.LOCAL_VARIABLE : AccessScope.GLOBAL_VARIABLE;
        } else if (path.size() == 1 && !path.get(0).isIndexed()) {
            scope = local ? scopes.localScope(path.get(0).name) : scopes.globalScope(path.get(0).name);
        } else {
            scope = local ? AccessScope.LOCAL_VARIABLE : AccessScope.GLOBAL_VARIABLE;
        }

        CodeToken access = CodeToken.access(scope, path);
        if (close > 0) {
            out.add(CodeToken.call(access, parseParameters(lex, j + 1, close)));
            return close + 1;
        }
        out.add(access);
        return j;
    }

    /** Splits {@code (from, to)} at top-level commas into parameters. */
    private List<CallParameter> parseParameters(List<LexToken> lex, int from, int to) {
        List<CallParameter> params = new ArrayList<>();
        if (from >= to) return params;

        int depth = 0;
        int segStart = from;
        for (int k = from; k <= to; k++) {
            if (k == to) {
                params.add(parameter(lex, segStart, k));
                break;
            }
            LexToken t = lex.get(k);
            if (t.isOperator("(") || t.isOperator("[")) {
                depth++;
            } else if (t.isOperator(")") || t.isOperator("]")) {
                depth--;
            } else if (depth == 0 && t.isOperator(",")) {
                params.add(parameter(lex, segStart, k));
                segStart = k + 1;
            }
        }
        return params;
    }

    private CallParameter parameter(List<LexToken> lex, int from, int to) {
        List<CodeToken> leading = new ArrayList<>();
        int k = from;
        while (k < to && (lex.get(k).type == LexTokenType.WHITESPACE || lex.get(k).type == LexTokenType.LINE_BREAK)) {
            LexToken t = lex.get(k);
            leading.add(t.type == LexTokenType.LINE_BREAK ? CodeToken.lineBreak() : CodeToken.whitespace(t.text.length()));
            k++;
        }
        if (k < to && lex.get(k).type == LexTokenType.IDENTIFIER) {
            int op = k + 1;
            if (op < to && lex.get(op).type == LexTokenType.WHITESPACE) op++;
            if (op < to && (lex.get(op).isOperator(":=") || lex.get(op).isOperator("=>"))) {
                return new CallParameter(leading, lex.get(k).text, parseRange(lex, k + 1, to));
            }
        }
        return new CallParameter(leading, null, parseRange(lex, k, to));
    }

    /** Index of the bracket closing the one at {@code open}, or -1 when unbalanced before {@code to}. */
    private static int matching(List<LexToken> lex, int open, int to, String openOp, String closeOp) {
        int depth = 0;
        for (int k = open; k < to; k++) {
            LexToken t = lex.get(k);
            if (t.isOperator(openOp)) {
                depth++;
            } else if (t.isOperator(closeOp)) {
                depth--;
                if (depth == 0) return k;
            }
        }
        return -1;
    }
}
