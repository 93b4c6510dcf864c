package info.isaksson.erland.scltoxml.ir.code;

import java.util.List;
import java.util.Objects;

/**
 * One step of an access path: a name, optionally followed by an index expression in brackets.
 *
 * <p>{@link #index} is {@code null} when the component is not indexed. The index is itself a token
 * sequence, so {@code #a[#i + 1, 2]} keeps its whitespace and separators.</p>
 */
public final class Component {
    public final String name;
    public final List<CodeToken> index;

    public Component(String name, List<CodeToken> index) {
        if (name == null) throw new IllegalArgumentException("name must not be null");
        this.name = name;
        this.index = index == null ? null : List.copyOf(index);
    }

    public static Component named(String name) {
        return new Component(name, null);
    }

    public boolean isIndexed() {
        return index != null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Component)) return false;
        Component that = (Component) o;
        return name.equals(that.name) && Objects.equals(index, that.index);
    }

    @Override public int hashCode() {
        return Objects.hash(name, index);
    }

    @Override public String toString() {
        return index == null ? name : name + index;
    }
}
