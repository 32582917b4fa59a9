package com.measurelog.common.exception;

/**
 * An insert batch failed. Batches committed before it stay committed, later ones are not attempted.
 */
public class DatabaseWriteException extends MeasureLogException {

    public DatabaseWriteException(String message) {
        super(message);
    }

    public DatabaseWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
