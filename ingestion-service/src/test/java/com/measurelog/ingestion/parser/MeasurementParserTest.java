package com.measurelog.ingestion.parser;

import com.measurelog.common.exception.NoValidMeasurementsException;
import com.measurelog.common.exception.NotJsonException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MeasurementParserTest {

    @Mock
    private JsonSectionParser jsonParser;

    @Mock
    private TextBlockParser textParser;

    @InjectMocks
    private MeasurementParser measurementParser;

    private static MeasurementSection section(String sensor) {
        return MeasurementSection.builder(Clock.systemUTC())
                .readings(List.of(0.5))
                .field(SectionField.SENSOR_NAME, sensor)
                .build();
    }

    @Test
    @DisplayName("Should use the JSON result when the content is JSON")
    void parse_shouldPreferJson() {
        when(jsonParser.parse("[]x")).thenReturn(List.of(section("A")));

        MeasurementParser.ParseResult result = measurementParser.parse("[]x");

        assertEquals(MeasurementParser.SourceFormat.JSON, result.format());
        assertEquals(1, result.sections().size());
        verifyNoInteractions(textParser);
    }

    @Test
    @DisplayName("Should fall back to text blocks when the content is not JSON")
    void parse_shouldFallBackToText() {
        when(jsonParser.parse("text")).thenThrow(new NotJsonException("nope"));
        when(textParser.parse("text")).thenReturn(List.of(section("B")));

        MeasurementParser.ParseResult result = measurementParser.parse("text");

        assertEquals(MeasurementParser.SourceFormat.TEXT, result.format());
        assertEquals("B", result.sections().get(0).sensorName());
    }

    @Test
    @DisplayName("Should not fall back when valid JSON yields no sections")
    void parse_shouldFailOnEmptyJson() {
        when(jsonParser.parse("[]")).thenReturn(List.of());

        NoValidMeasurementsException ex = assertThrows(NoValidMeasurementsException.class,
                () -> measurementParser.parse("[]"));
        assertTrue(ex.getMessage().contains("JSON"));
        verifyNoInteractions(textParser);
    }
}
