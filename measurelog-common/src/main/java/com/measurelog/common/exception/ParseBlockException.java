package com.measurelog.common.exception;

/**
 * One text block could not be turned into a section. The block is skipped, its siblings are still parsed.
 */
public class ParseBlockException extends MeasureLogException {

    public ParseBlockException(String message) {
        super(message);
    }

    public ParseBlockException(String message, Throwable cause) {
        super(message, cause);
    }
}
