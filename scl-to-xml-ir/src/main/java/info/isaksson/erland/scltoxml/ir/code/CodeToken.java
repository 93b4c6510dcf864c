package info.isaksson.erland.scltoxml.ir.code;

import java.util.List;
import java.util.Objects;

/**
 * Node of a tokenized code line.
 *
 * <p>A tagged variant: {@link #kind} selects which of the other fields are meaningful.</p>
 * <ul>
 *   <li>{@code WHITESPACE}: {@link #count}</li>
 *   <li>{@code OPERATOR}, {@code KEYWORD}, {@code IDENTIFIER}, {@code LITERAL_CONSTANT},
 *       {@code TYPED_CONSTANT}, {@code LINE_COMMENT}, {@code TEXT}: {@link #text}</li>
 *   <li>{@code ACCESS}: {@link #scope} and {@link #path}</li>
 *   <li>{@code CALL}: {@link #callKind}, {@link #callee} (an ACCESS token for instance and global
 *       calls) or {@link #text} (the instruction name), and {@link #parameters}</li>
 * </ul>
 * Nodes own their children outright; trees are immutable.
 */
public final class CodeToken {

    /** Text of a line break inside one statement, such as a call written over several lines. */
    public static final String LINE_BREAK = "\n";

    public final CodeTokenKind kind;
    public final String text;
    public final int count;
    public final AccessScope scope;
    public final List<Component> path;
    public final CallKind callKind;
    public final CodeToken callee;
    public final List<CallParameter> parameters;

    private CodeToken(CodeTokenKind kind, String text, int count, AccessScope scope, List<Component> path,
                      CallKind callKind, CodeToken callee, List<CallParameter> parameters) {
        this.kind = kind;
        this.text = text;
        this.count = count;
        this.scope = scope;
        this.path = path == null ? List.of() : List.copyOf(path);
        this.callKind = callKind;
        this.callee = callee;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static CodeToken whitespace(int count) {
        if (count < 1) throw new IllegalArgumentException("whitespace count must be positive: " + count);
        return new CodeToken(CodeTokenKind.WHITESPACE, null, count, null, null, null, null, null);
    }

    public static CodeToken operator(String text) {
        return textual(CodeTokenKind.OPERATOR, text);
    }

    public static CodeToken keyword(String text) {
        return textual(CodeTokenKind.KEYWORD, text);
    }

    public static CodeToken identifier(String text) {
        return textual(CodeTokenKind.IDENTIFIER, text);
    }

    public static CodeToken literal(String text) {
        return textual(CodeTokenKind.LITERAL_CONSTANT, text);
    }

    public static CodeToken typedLiteral(String text) {
        return textual(CodeTokenKind.TYPED_CONSTANT, text);
    }

    public static CodeToken lineComment(String body) {
        return textual(CodeTokenKind.LINE_COMMENT, body == null ? "" : body);
    }

    public static CodeToken text(String raw) {
        return textual(CodeTokenKind.TEXT, raw);
    }

    public static CodeToken lineBreak() {
        return text(LINE_BREAK);
    }

    public boolean isLineBreak() {
        return kind == CodeTokenKind.TEXT && LINE_BREAK.equals(text);
    }

    public static CodeToken access(AccessScope scope, List<Component> path) {
        if (scope == null) throw new IllegalArgumentException("scope must not be null");
        if (path == null || path.isEmpty()) throw new IllegalArgumentException("path must not be empty");
        return new CodeToken(CodeTokenKind.ACCESS, null, 0, scope, path, null, null, null);
    }

    /** Convenience for a plain dotted path without indices. */
    public static CodeToken access(AccessScope scope, String... names) {
        Component[] comps = new Component[names.length];
        for (int i = 0; i < names.length; i++) comps[i] = Component.named(names[i]);
        return access(scope, List.of(comps));
    }

    public static CodeToken call(CodeToken callee, List<CallParameter> parameters) {
        if (callee == null || callee.kind != CodeTokenKind.ACCESS) {
            throw new IllegalArgumentException("callee must be an access token");
        }
        CallKind kind = callee.scope.isLocal() ? CallKind.INSTANCE : CallKind.GLOBAL;
        return new CodeToken(CodeTokenKind.CALL, null, 0, null, null, kind, callee, parameters);
    }

    public static CodeToken instructionCall(String instruction, List<CallParameter> parameters) {
        if (instruction == null || instruction.isEmpty()) {
            throw new IllegalArgumentException("instruction must not be empty");
        }
        return new CodeToken(CodeTokenKind.CALL, instruction, 0, null, null, CallKind.INSTRUCTION, null, parameters);
    }

    private static CodeToken textual(CodeTokenKind kind, String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        return new CodeToken(kind, text, 0, null, null, null, null, null);
    }

    /** Name of the called block or instruction, without prefix or quotes. */
    public String calleeName() {
        if (kind != CodeTokenKind.CALL) return null;
        return callKind == CallKind.INSTRUCTION ? text : callee.path.get(0).name;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodeToken)) return false;
        CodeToken that = (CodeToken) o;
        return kind == that.kind &&
                count == that.count &&
                Objects.equals(text, that.text) &&
                scope == that.scope &&
                Objects.equals(path, that.path) &&
                callKind == that.callKind &&
                Objects.equals(callee, that.callee) &&
                Objects.equals(parameters, that.parameters);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, text, count, scope, path, callKind, callee, parameters);
    }

    @Override public String toString() {
        return kind + "(" + CodeTokenRenderer.render(List.of(this)) + ")";
    }
}
