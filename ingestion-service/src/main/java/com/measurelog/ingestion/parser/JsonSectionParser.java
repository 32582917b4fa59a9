package com.measurelog.ingestion.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.measurelog.common.exception.NotJsonException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads measurement sections from JSON: one object or an array of objects shaped as
 *
 * <pre>
 * {
 *   "description": "...",
 *   "measurements": { "values": [..], "total measurements": n, "min": .., "max": .., "avg": .., "units": ".." },
 *   "metadata": { "source", "tst_id", "uut_type", "status", "serial number",
 *                 "category", "sub_category", "sensor name" }
 * }
 * </pre>
 *
 * Entries missing any of the three top-level members are skipped. Unlike the text
 * grammar, the sensor name is never inferred from the description.
 */
@Slf4j
@Component
public class JsonSectionParser {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final Clock clock;

    public JsonSectionParser() {
        this(Clock.systemUTC());
    }

    JsonSectionParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws NotJsonException when the content is not a JSON object or array
     */
    public List<MeasurementSection> parse(String content) {
        JsonNode root = readRoot(content);

        List<JsonNode> entries = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(entries::add);
        } else {
            entries.add(root);
        }

        List<MeasurementSection> sections = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            MeasurementSection section = toSection(entries.get(i), i);
            if (section == null) {
                continue;
            }
            if (!section.isValid()) {
                log.debug("   Entry {}: dropped, no readings or sensor name", i);
                continue;
            }
            sections.add(section);
        }

        log.info("JSON parser: {} entries → {} valid sections", entries.size(), sections.size());
        return sections;
    }

    private JsonNode readRoot(String content) {
        if (content == null || content.isBlank()) {
            throw new NotJsonException("Content is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new NotJsonException("Content is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !(root.isObject() || root.isArray())) {
            throw new NotJsonException("JSON content is neither an object nor an array");
        }
        return root;
    }

    private MeasurementSection toSection(JsonNode entry, int index) {
        JsonNode measurements = entry.get("measurements");
        JsonNode metadata = entry.get("metadata");
        String description = text(entry, "description");

        if (measurements == null || !measurements.isObject()
                || metadata == null || !metadata.isObject()
                || description == null || description.isEmpty()) {
            log.warn("   Entry {}: missing measurements, metadata or description, skipped", index);
            return null;
        }

        return MeasurementSection.builder(clock)
                .readings(readings(measurements.get("values")))
                .totalMeasurements(integer(measurements, "total measurements"))
                .min(number(measurements, "min"))
                .max(number(measurements, "max"))
                .avg(number(measurements, "avg"))
                .field(SectionField.UNITS, text(measurements, "units"))
                .field(SectionField.DESCRIPTION, description)
                .field(SectionField.SOURCE, text(metadata, "source"))
                .field(SectionField.TST_ID, text(metadata, "tst_id"))
                .field(SectionField.UUT_TYPE, text(metadata, "uut_type"))
                .field(SectionField.STATUS, text(metadata, "status"))
                .field(SectionField.SERIAL_NUMBER, text(metadata, "serial number"))
                .field(SectionField.CATEGORY, text(metadata, "category"))
                .field(SectionField.SUB_CATEGORY, text(metadata, "sub_category"))
                .field(SectionField.SENSOR_NAME, text(metadata, "sensor name"))
                .build();
    }

    private static List<Double> readings(JsonNode values) {
        List<Double> readings = new ArrayList<>();
        if (values == null || !values.isArray()) {
            return readings;
        }
        for (JsonNode value : values) {
            Double reading = asDouble(value);
            if (reading != null) {
                readings.add(reading);
            }
        }
        return readings;
    }

    private static Double number(JsonNode node, String field) {
        return asDouble(node.get(field));
    }

    private static Integer integer(JsonNode node, String field) {
        Double value = number(node, field);
        return value != null ? value.intValue() : null;
    }

    // Numbers, or strings holding a number ("12.5")
    private static Double asDouble(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
