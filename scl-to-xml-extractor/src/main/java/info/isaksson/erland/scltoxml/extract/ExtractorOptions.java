package info.isaksson.erland.scltoxml.extract;

/** Options for reading interchange XML back into a document. */
public final class ExtractorOptions {
    public static final int DEFAULT_REFLOW_WIDTH = 120;

    /** When true, long call lines are split one parameter per line. */
    public final boolean reflowLongCalls;

    /** Lines longer than this are candidates for reflow. */
    public final int reflowWidth;

    public ExtractorOptions(boolean reflowLongCalls, int reflowWidth) {
        this.reflowLongCalls = reflowLongCalls;
        this.reflowWidth = reflowWidth < 1 ? DEFAULT_REFLOW_WIDTH : reflowWidth;
    }

    public static ExtractorOptions defaults() {
        return new ExtractorOptions(true, DEFAULT_REFLOW_WIDTH);
    }

    public ExtractorOptions withReflow(boolean enabled) {
        return new ExtractorOptions(enabled, reflowWidth);
    }

    @Override
    public String toString() {
        return "ExtractorOptions{reflowLongCalls=" + reflowLongCalls + ", reflowWidth=" + reflowWidth + '}';
    }
}
