package com.measurelog.common.exception;

/**
 * Input is not JSON. Recoverable: the parser selection falls back to the text grammar.
 */
public class NotJsonException extends MeasureLogException {

    public NotJsonException(String message) {
        super(message);
    }

    public NotJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
