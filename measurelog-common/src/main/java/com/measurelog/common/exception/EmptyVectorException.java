package com.measurelog.common.exception;

/**
 * Raised when a vector of length zero is asked to be padded to a fixed dimension.
 */
public class EmptyVectorException extends MeasureLogException {

    public EmptyVectorException(int targetDimensions) {
        super("Cannot normalize an empty vector to " + targetDimensions + " dimensions");
    }
}
