package com.measurelog.common.exception;

/**
 * Neither parser produced a single valid section. Nothing is written for the file.
 */
public class NoValidMeasurementsException extends MeasureLogException {

    public NoValidMeasurementsException(String message) {
        super(message);
    }
}
