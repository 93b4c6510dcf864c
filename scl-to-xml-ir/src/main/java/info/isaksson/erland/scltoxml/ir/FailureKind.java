package info.isaksson.erland.scltoxml.ir;

/**
 * Failure taxonomy shared by all converters.
 *
 * <p>{@link #MALFORMED_INPUT} and {@link #IO_FAILURE} abort a conversion. The other two are
 * recovered per node and reported as warnings.</p>
 */
public enum FailureKind {
    /** Input does not match any recognized pattern for a required construct. */
    MALFORMED_INPUT,
    /** A recognized construct lacks an expected child. */
    INCOMPLETE_CONSTRUCT,
    /** A recognized but unhandled scope, block kind or token shape. */
    UNSUPPORTED_CONSTRUCT,
    /** A document could not be read or written. */
    IO_FAILURE;

    public boolean isFatal() {
        return this == MALFORMED_INPUT || this == IO_FAILURE;
    }
}
