package info.isaksson.erland.scltoxml.extract;

import info.isaksson.erland.scltoxml.ir.code.CallKind;
import info.isaksson.erland.scltoxml.ir.code.CodeToken;
import info.isaksson.erland.scltoxml.ir.code.CodeTokenKind;
import info.isaksson.erland.scltoxml.ir.code.CodeTokenRenderer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a long call line into one parameter per line:
 * <pre>
 *     #timer(
 *         IN := #start,
 *         PT := T#2s,
 *         Q =&gt; #done);
 * </pre>
 * Only whitespace changes. A line qualifies when it is longer than the configured width, contains
 * {@code (}, {@code :=} and {@code ,}, and its first top-level call has more than two parameters.
 */
final class CallReflow {

    private static final String PARAMETER_INDENT = "    ";

    private final ExtractorOptions options;

    CallReflow(ExtractorOptions options) {
        this.options = options;
    }

    List<String> apply(List<CodeToken> line) {
        String rendered = CodeTokenRenderer.render(line);
        if (!qualifies(rendered)) return List.of(rendered);

        int at = firstCall(line);
        if (at < 0 || line.get(at).parameters.size() <= 2) return List.of(rendered);
        CodeToken call = line.get(at);

        String indent = rendered.substring(0, rendered.length() - rendered.stripLeading().length());
        String head = CodeTokenRenderer.render(line.subList(0, at)) + callee(call) + "(";
        String tail = ")" + CodeTokenRenderer.render(line.subList(at + 1, line.size()));

        List<String> out = new ArrayList<>();
        out.add(head.stripTrailing());
        for (int i = 0; i < call.parameters.size(); i++) {
            String param = CodeTokenRenderer.render(call.parameters.get(i)).strip();
            boolean last = i == call.parameters.size() - 1;
            out.add(indent + PARAMETER_INDENT + param + (last ? tail : ","));
        }
        return out;
    }

    private boolean qualifies(String rendered) {
        return options.reflowLongCalls
                && rendered.length() > options.reflowWidth
                && !rendered.contains(StructuredTextReader.LINE_BREAK)
                && rendered.contains("(")
                && rendered.contains(":=")
                && rendered.contains(",");
    }

    private static int firstCall(List<CodeToken> line) {
        for (int i = 0; i < line.size(); i++) {
            if (line.get(i).kind == CodeTokenKind.CALL) return i;
        }
        return -1;
    }

    private static String callee(CodeToken call) {
        if (call.callKind == CallKind.INSTRUCTION) return call.text;
        return CodeTokenRenderer.render(List.of(call.callee));
    }
}
