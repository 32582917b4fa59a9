package com.measurelog.common.exception;

/**
 * The embedding model call failed for one row. The row is marked failed, the batch continues.
 */
public class ModelCallException extends MeasureLogException {

    public ModelCallException(String message) {
        super(message);
    }

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
