package info.isaksson.erland.scltoxml.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects warnings during one conversion.
 *
 * <p>Warnings are deterministic: final output is sorted by (code, message, contextString).</p>
 */
public final class ConversionWarnings {

    private final List<ConversionWarning> warnings = new ArrayList<>();

    public void incomplete(String code, String message, String k1, String v1) {
        warn(FailureKind.INCOMPLETE_CONSTRUCT, code, message, context(k1, v1));
    }

    public void unsupported(String code, String message, String k1, String v1) {
        warn(FailureKind.UNSUPPORTED_CONSTRUCT, code, message, context(k1, v1));
    }

    public void unsupported(String code, String message, String k1, String v1, String k2, String v2) {
        Map<String, String> ctx = context(k1, v1);
        ctx.put(k2, v2);
        warn(FailureKind.UNSUPPORTED_CONSTRUCT, code, message, ctx);
    }

    public void warn(FailureKind kind, String code, String message, Map<String, String> context) {
        if (kind != null && kind.isFatal()) {
            throw new IllegalArgumentException("fatal kind cannot be recorded as warning: " + kind);
        }
        warnings.add(new ConversionWarning(kind, code, message, context == null ? Collections.emptyMap() : context));
    }

    public void addAll(List<ConversionWarning> other) {
        if (other != null) warnings.addAll(other);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public int size() {
        return warnings.size();
    }

    public List<ConversionWarning> toDeterministicList() {
        List<ConversionWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparing((ConversionWarning w) -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(w -> contextString(w.context)));
        return Collections.unmodifiableList(out);
    }

    private static Map<String, String> context(String k1, String v1) {
        Map<String, String> ctx = new LinkedHashMap<>();
        if (k1 != null) ctx.put(k1, String.valueOf(v1));
        return ctx;
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        List<String> keys = new ArrayList<>(ctx.keySet());
        keys.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        for (String k : keys) {
            sb.append(k).append('=').append(ctx.get(k)).append(';');
        }
        return sb.toString();
    }
}
