package com.measurelog.common.exception;

/**
 * Base class for every failure raised by the ingestion and embedding pipeline.
 * Handled centrally by {@link GlobalExceptionHandler} when it reaches a controller.
 */
public class MeasureLogException extends RuntimeException {

    public MeasureLogException(String message) {
        super(message);
    }

    public MeasureLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
