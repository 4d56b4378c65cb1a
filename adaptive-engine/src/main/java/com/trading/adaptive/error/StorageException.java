package com.trading.adaptive.error;

/**
 * Raised when the outcome log or a component state file cannot be read or written.
 */
public class StorageException extends AdaptiveException {

    public StorageException(String message) {
        super(ErrorKind.STORAGE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
