package info.isaksson.erland.scltoxml.ir.code;

import java.util.List;

/** Flattens token trees back to source text. */
public final class CodeTokenRenderer {

    private CodeTokenRenderer() {}

    public static String render(List<CodeToken> tokens) {
        StringBuilder sb = new StringBuilder();
        appendAll(sb, tokens);
        return sb.toString();
    }

    public static String render(CallParameter parameter) {
        StringBuilder sb = new StringBuilder();
        appendParameter(sb, parameter);
        return sb.toString();
    }

    private static void appendAll(StringBuilder sb, List<CodeToken> tokens) {
        if (tokens == null) return;
        for (CodeToken t : tokens) {
            append(sb, t);
        }
    }

    private static void append(StringBuilder sb, CodeToken t) {
        switch (t.kind) {
            case WHITESPACE -> sb.append(" ".repeat(t.count));
            case ACCESS -> appendAccess(sb, t);
            case CALL -> appendCall(sb, t);
            case LINE_COMMENT -> sb.append("//").append(t.text);
            default -> sb.append(t.text);
        }
    }

    private static void appendAccess(StringBuilder sb, CodeToken t) {
        for (int i = 0; i < t.path.size(); i++) {
            Component c = t.path.get(i);
            if (i == 0) {
                if (t.scope.isLocal()) {
                    sb.append('#').append(c.name);
                } else {
                    sb.append('"').append(c.name).append('"');
                }
            } else {
                sb.append('.').append(c.name);
            }
            if (c.isIndexed()) {
                sb.append('[');
                appendAll(sb, c.index);
                sb.append(']');
            }
        }
    }

    private static void appendCall(StringBuilder sb, CodeToken t) {
        if (t.callKind == CallKind.INSTRUCTION) {
            sb.append(t.text);
        } else {
            appendAccess(sb, t.callee);
        }
        sb.append('(');
        for (int i = 0; i < t.parameters.size(); i++) {
            if (i > 0) sb.append(',');
            appendParameter(sb, t.parameters.get(i));
        }
        sb.append(')');
    }

    private static void appendParameter(StringBuilder sb, CallParameter p) {
        appendAll(sb, p.leading);
        if (p.name != null) sb.append(p.name);
        appendAll(sb, p.value);
    }
}
