package dev.py2flow;

/**
 * Base type for every error raised by the conversion engine.
 *
 * <p>Recoverable conditions (recognition gaps, unresolved lineage, validation
 * issues) are returned as typed results instead; only failures that stop the
 * current call are thrown.</p>
 */
public class Py2FlowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    public Py2FlowException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public Py2FlowException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /** Stable machine-readable code, e.g. {@code CYCLE_DETECTED}. */
    public String getErrorCode() {
        return errorCode;
    }
}
