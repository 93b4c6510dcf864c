package info.isaksson.erland.scltoxml.ir;

/** A conversion that could not produce an artifact. */
public class ConversionException extends Exception {
    private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    public ConversionException(FailureKind kind, String message) {
        super(message);
        this.kind = kind == null ? FailureKind.MALFORMED_INPUT : kind;
    }

    public ConversionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? FailureKind.MALFORMED_INPUT : kind;
    }

    public static ConversionException malformed(String message) {
        return new ConversionException(FailureKind.MALFORMED_INPUT, message);
    }

    public static ConversionException io(String message, Throwable cause) {
        return new ConversionException(FailureKind.IO_FAILURE, message, cause);
    }

    public FailureKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
