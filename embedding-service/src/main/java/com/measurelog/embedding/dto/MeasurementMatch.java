package com.measurelog.embedding.dto;

/**
 * A stored measurement returned by similarity search, with its inner-product similarity
 * to the query (higher is more similar).
 */
public record MeasurementMatch(
        Long id,
        Long logId,
        String name,
        String sensorName,
        String description,
        String units,
        double minValue,
        double maxValue,
        double avgValue,
        String source,
        String tstId,
        String uutType,
        String status,
        String serialNumber,
        String category,
        String subCategory,
        double similarity
) {
}
