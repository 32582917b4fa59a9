package com.measurelog.common.exception;

/**
 * The log file could not be fetched from object storage. Fatal for the ingestion call.
 */
public class StorageDownloadException extends MeasureLogException {

    public StorageDownloadException(String message) {
        super(message);
    }

    public StorageDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
