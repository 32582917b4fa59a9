package com.measurelog.common.message;

/**
 * Object-storage upload notification, as forwarded by the trigger dispatcher.
 */
public record StorageUploadEvent(
        String bucket,
        String objectId,
        String owner,
        String name
) {
}
