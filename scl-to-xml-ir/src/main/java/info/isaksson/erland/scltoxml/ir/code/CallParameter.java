package info.isaksson.erland.scltoxml.ir.code;

import java.util.List;
import java.util.Objects;

/**
 * One argument of a call.
 *
 * <p>{@code leading} is the whitespace between the preceding {@code (} or {@code ,} and the
 * parameter. For a named parameter, {@code value} starts right after the name and includes the
 * assignment operator ({@code :=} or {@code =>}); for a positional one, {@code name} is
 * {@code null} and {@code value} holds the whole argument.</p>
 */
public final class CallParameter {
    public final List<CodeToken> leading;
    public final String name;
    public final List<CodeToken> value;

    public CallParameter(List<CodeToken> leading, String name, List<CodeToken> value) {
        this.leading = leading == null ? List.of() : List.copyOf(leading);
        this.name = name;
        this.value = value == null ? List.of() : List.copyOf(value);
    }

    public boolean isNamed() {
        return name != null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallParameter)) return false;
        CallParameter that = (CallParameter) o;
        return leading.equals(that.leading) && Objects.equals(name, that.name) && value.equals(that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(leading, name, value);
    }

    @Override public String toString() {
        return CodeTokenRenderer.render(this);
    }
}
