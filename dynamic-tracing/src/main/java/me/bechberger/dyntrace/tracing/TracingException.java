package me.bechberger.dyntrace.tracing;

/**
 * Thrown when a tracing program cannot be transformed or turned into code.
 * Processing of the whole program is aborted, no partial result is returned.
 */
public class TracingException extends RuntimeException {

    public enum ErrorKind {
        /** the capture requirements of a logical probe cannot be expanded */
        INVALID_SPEC,
        /** a variable has no recognized source or references something undefined */
        INVALID_VARIABLE
    }

    private final ErrorKind kind;

    public TracingException(ErrorKind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    static TracingException invalidSpec(String message) {
        return new TracingException(ErrorKind.INVALID_SPEC, message);
    }

    static TracingException invalidVariable(String message) {
        return new TracingException(ErrorKind.INVALID_VARIABLE, message);
    }
}
