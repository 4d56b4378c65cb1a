package com.trading.adaptive.error;

public class ValidationException extends AdaptiveException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
