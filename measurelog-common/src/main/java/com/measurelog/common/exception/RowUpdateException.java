package com.measurelog.common.exception;

/**
 * Writing an embedding or status back to a row failed. Isolated to that row.
 */
public class RowUpdateException extends MeasureLogException {

    public RowUpdateException(String message) {
        super(message);
    }

    public RowUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
