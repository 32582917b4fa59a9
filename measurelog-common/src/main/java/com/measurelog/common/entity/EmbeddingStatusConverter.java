package com.measurelog.common.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class EmbeddingStatusConverter implements AttributeConverter<EmbeddingStatus, String> {

    @Override
    public String convertToDatabaseColumn(EmbeddingStatus status) {
        return status == null ? null : status.getValue();
    }

    @Override
    public EmbeddingStatus convertToEntityAttribute(String value) {
        return value == null ? null : EmbeddingStatus.fromValue(value);
    }
}
