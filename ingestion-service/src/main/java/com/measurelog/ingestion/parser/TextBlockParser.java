package com.measurelog.ingestion.parser;

import com.measurelog.common.exception.ParseBlockException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers measurement sections from free-form log text.
 *
 * A block starts at every {@code measurements} keyword outside a quoted string. Inside a
 * block, readings sit between {@code values} and {@code total}; each whitespace token loses
 * its leading digit run (an ordinal prefix) and the rest is read as a number. Quoted
 * label/value pairs carry the metadata, see {@link QuotedLabelScanner}.
 *
 * One bad block never stops the others: it is logged and skipped.
 */
@Slf4j
@Component
public class TextBlockParser {

    static final String SECTION_KEYWORD = "measurements";

    private static final Pattern VALUES_SPAN = Pattern.compile("values([\\d\\s.]+)total");
    private static final Pattern ORDINAL_PREFIX = Pattern.compile("^\\d+");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final Pattern SENSOR_IN_DESCRIPTION = Pattern.compile("measurements for (.+)");

    private final Clock clock;

    public TextBlockParser() {
        this(Clock.systemUTC());
    }

    TextBlockParser(Clock clock) {
        this.clock = clock;
    }

    public List<MeasurementSection> parse(String content) {
        List<String> blocks = splitIntoBlocks(content);
        List<MeasurementSection> sections = new ArrayList<>();

        for (int i = 0; i < blocks.size(); i++) {
            try {
                Optional<MeasurementSection> section = parseBlock(blocks.get(i));
                if (section.isEmpty()) {
                    continue;
                }
                if (!section.get().isValid()) {
                    log.debug("   Block {}: dropped, no sensor name", i + 1);
                    continue;
                }
                sections.add(section.get());
            } catch (ParseBlockException e) {
                log.warn("   Block {}: skipped ({})", i + 1, e.getMessage());
            }
        }

        log.info("Text parser: {} blocks → {} valid sections", blocks.size(), sections.size());
        return sections;
    }

    /**
     * Splits before every section keyword that is not inside double quotes, so a
     * description like "measurements for Rail_12V" stays within its block. Quotes never
     * span lines: an unbalanced quote only shields the rest of its own line.
     */
    List<String> splitIntoBlocks(String content) {
        List<String> blocks = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return blocks;
        }

        boolean inQuotes = false;
        int blockStart = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\n') {
                inQuotes = false;
            } else if (c == '"') {
                inQuotes = !inQuotes;
            } else if (!inQuotes && i > blockStart && content.startsWith(SECTION_KEYWORD, i)) {
                addIfNotBlank(blocks, content.substring(blockStart, i));
                blockStart = i;
            }
        }
        addIfNotBlank(blocks, content.substring(blockStart));
        return blocks;
    }

    /**
     * @return empty when the block has no values…total span (headers, free text)
     * @throws ParseBlockException when the span exists but yields no readings
     */
    Optional<MeasurementSection> parseBlock(String block) {
        Matcher span = VALUES_SPAN.matcher(block);
        if (!span.find()) {
            return Optional.empty();
        }

        List<Double> readings = extractReadings(span.group(1));
        if (readings.isEmpty()) {
            throw new ParseBlockException("no parseable readings between 'values' and 'total'");
        }

        Map<SectionField, String> metadata = QuotedLabelScanner.scan(QuotedLabelScanner.quotedTokens(block));
        MeasurementSection.Builder builder = MeasurementSection.builder(clock)
                .readings(readings)
                .fields(metadata);

        String description = builder.get(SectionField.DESCRIPTION);
        if (builder.get(SectionField.SENSOR_NAME) == null && description != null) {
            Matcher sensor = SENSOR_IN_DESCRIPTION.matcher(description);
            if (sensor.find()) {
                builder.field(SectionField.SENSOR_NAME, sensor.group(1));
            }
        }

        return Optional.of(builder.build());
    }

    static List<Double> extractReadings(String span) {
        List<Double> readings = new ArrayList<>();
        for (String token : span.trim().split("\\s+")) {
            String remainder = ORDINAL_PREFIX.matcher(token).replaceFirst("");
            Matcher number = LEADING_NUMBER.matcher(remainder);
            if (number.find()) {
                readings.add(Double.parseDouble(number.group()));
            }
        }
        return readings;
    }

    private static void addIfNotBlank(List<String> blocks, String block) {
        if (!block.isBlank()) {
            blocks.add(block);
        }
    }
}
