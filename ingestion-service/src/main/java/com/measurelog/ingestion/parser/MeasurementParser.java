package com.measurelog.ingestion.parser;

import com.measurelog.common.exception.NoValidMeasurementsException;
import com.measurelog.common.exception.NotJsonException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the grammar for a file: JSON first, free text when the content is not JSON.
 */
@Slf4j
@Service
public class MeasurementParser {

    @Autowired
    private JsonSectionParser jsonParser;

    @Autowired
    private TextBlockParser textParser;

    public enum SourceFormat { JSON, TEXT }

    public record ParseResult(SourceFormat format, List<MeasurementSection> sections) {
    }

    /**
     * @throws NoValidMeasurementsException when the selected grammar yields no valid section
     */
    public ParseResult parse(String content) {
        ParseResult result;
        try {
            result = new ParseResult(SourceFormat.JSON, jsonParser.parse(content));
        } catch (NotJsonException e) {
            log.info("   Not JSON ({}), falling back to text blocks", e.getMessage());
            result = new ParseResult(SourceFormat.TEXT, textParser.parse(content));
        }

        if (result.sections().isEmpty()) {
            throw new NoValidMeasurementsException(
                    "No valid measurements found in file (parsed as " + result.format() + ")");
        }
        return result;
    }
}
