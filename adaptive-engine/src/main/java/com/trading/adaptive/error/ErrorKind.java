package com.trading.adaptive.error;

/**
 * Failure categories surfaced by adaptive components.
 */
public enum ErrorKind {
    /** Malformed outcome or signal. */
    VALIDATION,
    /** State file or outcome log unreadable or unwritable. */
    STORAGE,
    /** Too few samples; always resolved to a conservative default, never thrown to trading callers. */
    INSUFFICIENT_DATA
}
