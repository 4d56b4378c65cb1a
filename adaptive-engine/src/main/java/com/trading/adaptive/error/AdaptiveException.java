package com.trading.adaptive.error;

/**
 * Base type for failures raised at an adaptive component boundary.
 * The orchestrator decides the fallback; components only report what went wrong.
 */
public class AdaptiveException extends RuntimeException {
    private final ErrorKind kind;

    public AdaptiveException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AdaptiveException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
