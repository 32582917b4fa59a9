package com.measurelog.ingestion.parser;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One sensor's readings plus descriptive metadata: the single shape both parsers produce.
 */
public record MeasurementSection(
        List<Double> sensorReadings,
        int totalMeasurements,
        double min,
        double max,
        double avg,
        String units,
        String description,
        String source,
        String tstId,
        String uutType,
        String status,
        String serialNumber,
        String category,
        String subCategory,
        String sensorName
) {

    public MeasurementSection {
        sensorReadings = List.copyOf(sensorReadings);
    }

    /**
     * Only sections with readings and a sensor name reach persistence.
     */
    public boolean isValid() {
        return !sensorReadings.isEmpty() && sensorName != null && !sensorName.isBlank();
    }

    public double[] readingsArray() {
        return sensorReadings.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public static Builder builder(Clock clock) {
        return new Builder(clock);
    }

    /**
     * Applies the documented defaults and derives the statistics the input left out.
     */
    public static final class Builder {

        private final Clock clock;
        private final List<Double> readings = new ArrayList<>();
        private final Map<SectionField, String> fields = new EnumMap<>(SectionField.class);
        private Integer totalMeasurements;
        private Double min;
        private Double max;
        private Double avg;

        private Builder(Clock clock) {
            this.clock = clock;
        }

        public Builder readings(List<Double> values) {
            readings.addAll(values);
            return this;
        }

        public Builder totalMeasurements(Integer total) {
            this.totalMeasurements = total;
            return this;
        }

        public Builder min(Double min) {
            this.min = min;
            return this;
        }

        public Builder max(Double max) {
            this.max = max;
            return this;
        }

        public Builder avg(Double avg) {
            this.avg = avg;
            return this;
        }

        /**
         * Later values for the same field replace earlier ones; null and empty mean absent.
         */
        public Builder field(SectionField field, String value) {
            if (value != null && !value.isEmpty()) {
                fields.put(field, value);
            }
            return this;
        }

        public Builder fields(Map<SectionField, String> values) {
            values.forEach(this::field);
            return this;
        }

        public String get(SectionField field) {
            return fields.get(field);
        }

        public MeasurementSection build() {
            double derivedMin = readings.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
            double derivedMax = readings.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            double derivedAvg = readings.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

            return new MeasurementSection(
                    readings,
                    totalMeasurements != null && totalMeasurements > 0 ? totalMeasurements : readings.size(),
                    min != null ? min : derivedMin,
                    max != null ? max : derivedMax,
                    avg != null ? avg : derivedAvg,
                    valueOf(SectionField.UNITS),
                    valueOf(SectionField.DESCRIPTION),
                    valueOf(SectionField.SOURCE),
                    valueOf(SectionField.TST_ID),
                    valueOf(SectionField.UUT_TYPE),
                    valueOf(SectionField.STATUS),
                    valueOf(SectionField.SERIAL_NUMBER),
                    valueOf(SectionField.CATEGORY),
                    valueOf(SectionField.SUB_CATEGORY),
                    valueOf(SectionField.SENSOR_NAME));
        }

        private String valueOf(SectionField field) {
            String value = fields.get(field);
            return value != null ? value : field.defaultValue(clock);
        }
    }
}
