package info.isaksson.erland.scltoxml.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A non-fatal deterministic warning produced while converting. */
public final class ConversionWarning {

    /** Failure kind of the degraded node. Never fatal. */
    public final FailureKind kind;

    /** Stable warning code, e.g. {@code ACCESS_WITHOUT_SCOPE}. */
    public final String code;

    public final String message;

    /** Optional structured context (element, member, line). */
    public final Map<String, String> context;

    public ConversionWarning(FailureKind kind, String code, String message, Map<String, String> context) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionWarning)) return false;
        ConversionWarning that = (ConversionWarning) o;
        return kind == that.kind && code.equals(that.code) && message.equals(that.message) && context.equals(that.context);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, code, message, context);
    }

    @Override public String toString() {
        return context.isEmpty() ? code + ": " + message : code + ": " + message + " " + context;
    }
}
