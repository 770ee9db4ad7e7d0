/*
 * Copyright 2022-2025 Crown Copyright
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package logpoller.emit.parser;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Reads the time of a parsed record from one of its fields. The field is removed from the record. Times are either
 * read as seconds since the epoch, or with a date-time pattern.
 */
public class RecordTimeReader {

    private final String timeKey;
    private final DateTimeFormatter formatter;

    private RecordTimeReader(String timeKey, DateTimeFormatter formatter) {
        this.timeKey = timeKey;
        this.formatter = formatter;
    }

    /**
     * Creates a reader for times held as seconds since the epoch, which may have a fractional part.
     *
     * @param  timeKey the field holding the time
     * @return         the reader
     */
    public static RecordTimeReader epochSeconds(String timeKey) {
        return new RecordTimeReader(timeKey, null);
    }

    /**
     * Creates a reader for times in a date-time pattern. Times without a zone or offset are read as UTC.
     *
     * @param  timeKey the field holding the time
     * @param  pattern the pattern, as accepted by {@link DateTimeFormatter#ofPattern(String)}
     * @return         the reader
     */
    public static RecordTimeReader pattern(String timeKey, String pattern) {
        return new RecordTimeReader(timeKey, DateTimeFormatter.ofPattern(pattern).withZone(ZoneOffset.UTC));
    }

    /**
     * Creates a reader for a pattern if one is set, or for epoch seconds otherwise.
     *
     * @param  timeKey the field holding the time
     * @param  pattern the pattern, or null
     * @return         the reader
     */
    public static RecordTimeReader patternOrEpochSeconds(String timeKey, String pattern) {
        if (pattern == null) {
            return epochSeconds(timeKey);
        } else {
            return pattern(timeKey, pattern);
        }
    }

    /**
     * Builds a parsed record from its fields, taking the time out of the time field if it is set.
     *
     * @param  fields                the fields, which will be modified
     * @return                       the record
     * @throws MessageParseException if the time field could not be read
     */
    public ParsedMessage toParsedMessage(Map<String, Object> fields) {
        Object value = fields.remove(timeKey);
        if (value == null) {
            return ParsedMessage.withFields(fields);
        }
        return ParsedMessage.withTimeAndFields(readTime(value), fields);
    }

    private Instant readTime(Object value) {
        String text = value.toString();
        try {
            if (formatter == null) {
                return readEpochSeconds(text);
            } else {
                return formatter.parse(text, Instant::from);
            }
        } catch (NumberFormatException | DateTimeException | ArithmeticException e) {
            throw new MessageParseException("Could not read time from field " + timeKey + ": " + text, e);
        }
    }

    private static Instant readEpochSeconds(String text) {
        long nanos = new BigDecimal(text.strip())
                .movePointRight(9)
                .setScale(0, RoundingMode.FLOOR)
                .longValueExact();
        return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
    }
}
