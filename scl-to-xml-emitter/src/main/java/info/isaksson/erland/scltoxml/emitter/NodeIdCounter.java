package info.isaksson.erland.scltoxml.emitter;

import java.util.Locale;

/**
 * Hands out identity values for one generated document.
 *
 * <p>Structured-code nodes take decimal {@code UId}s from a counter that starts at the configured
 * offset; wrapper objects take hexadecimal {@code ID}s from a separate counter starting at zero.
 * Each generator pass owns its counters.</p>
 */
public final class NodeIdCounter {
    private final int start;
    private final int radix;
    private int next;

    private NodeIdCounter(int start, int radix) {
        if (start < 0) throw new IllegalArgumentException("start must not be negative: " + start);
        this.start = start;
        this.radix = radix;
        this.next = start;
    }

    public static NodeIdCounter decimal(int start) {
        return new NodeIdCounter(start, 10);
    }

    public static NodeIdCounter hex(int start) {
        return new NodeIdCounter(start, 16);
    }

    public String next() {
        return Integer.toString(next++, radix).toUpperCase(Locale.ROOT);
    }

    /** Number of values handed out so far. */
    public int issued() {
        return next - start;
    }
}
