package com.measurelog.ingestion.parser;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * The string metadata fields of a {@link MeasurementSection}, with the label synonyms the
 * text grammar recognises and the value used when the input does not supply one.
 *
 * Declaration order is the lookup order for label matching: {@code SUB_CATEGORY} must be
 * tried before {@code CATEGORY}, since every sub_category label also contains "category".
 */
public enum SectionField {

    UNITS(List.of("units"), clock -> "Watts"),
    DESCRIPTION(List.of("description"), clock -> ""),
    SOURCE(List.of("source"), clock -> ""),
    TST_ID(List.of("tst_id", "tst id"), clock -> Instant.now(clock).toString()),
    UUT_TYPE(List.of("uut_type", "uut type"), clock -> "unknown"),
    STATUS(List.of("status"), clock -> "unknown"),
    SERIAL_NUMBER(List.of("serial number", "serial_number"), clock -> "unknown"),
    SUB_CATEGORY(List.of("sub_category", "sub category"), clock -> "OTHER"),
    CATEGORY(List.of("category"), clock -> "power"),
    SENSOR_NAME(List.of("sensor name", "sensor_name"), clock -> "");

    private final List<String> labelSynonyms;
    private final Function<Clock, String> defaultValue;

    SectionField(List<String> labelSynonyms, Function<Clock, String> defaultValue) {
        this.labelSynonyms = labelSynonyms;
        this.defaultValue = defaultValue;
    }

    public List<String> getLabelSynonyms() {
        return labelSynonyms;
    }

    public String defaultValue(Clock clock) {
        return defaultValue.apply(clock);
    }

    /**
     * Field named by a quoted label, matched case-insensitively by substring.
     *
     * @return the field, or {@code null} when the label names nothing we keep
     */
    public static SectionField fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.toLowerCase();
        for (SectionField field : values()) {
            for (String synonym : field.labelSynonyms) {
                if (normalized.contains(synonym)) {
                    return field;
                }
            }
        }
        return null;
    }
}
