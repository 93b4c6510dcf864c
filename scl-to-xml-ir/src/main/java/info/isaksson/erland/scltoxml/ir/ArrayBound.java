package info.isaksson.erland.scltoxml.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** One array dimension, {@code [lower..upper]}. */
@JsonPropertyOrder({"lower", "upper"})
public final class ArrayBound {
    public final int lower;
    public final int upper;

    @JsonCreator
    public ArrayBound(@JsonProperty("lower") int lower, @JsonProperty("upper") int upper) {
        this.lower = lower;
        this.upper = upper;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayBound)) return false;
        ArrayBound that = (ArrayBound) o;
        return lower == that.lower && upper == that.upper;
    }

    @Override public int hashCode() {
        return Objects.hash(lower, upper);
    }

    @Override public String toString() {
        return lower + ".." + upper;
    }
}
