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

import logpoller.core.properties.PollerPropertyValues;

import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static logpoller.properties.LogsPollerProperty.FORMAT;
import static logpoller.properties.LogsPollerProperty.FORMAT_MESSAGE_KEY;
import static logpoller.properties.LogsPollerProperty.FORMAT_TIME_FORMAT;
import static logpoller.properties.LogsPollerProperty.FORMAT_TIME_KEY;

/**
 * Creates message parsers from the configured format.
 */
public class MessageFormat {

    public static final String JSON = "json";
    public static final String LTSV = "ltsv";
    public static final String NONE = "none";

    private MessageFormat() {
    }

    /**
     * Creates the parser set in the poller configuration.
     *
     * @param  properties the poller configuration
     * @return            the parser, or an empty optional if no format is set
     */
    public static Optional<MessageParser> parserFromProperties(PollerPropertyValues properties) {
        return properties.getOptional(FORMAT)
                .map(format -> parser(format,
                        RecordTimeReader.patternOrEpochSeconds(properties.get(FORMAT_TIME_KEY), properties.get(FORMAT_TIME_FORMAT)),
                        properties.get(FORMAT_MESSAGE_KEY)));
    }

    /**
     * Creates a parser for a format.
     *
     * @param  format     the format name, or a regular expression between slashes
     * @param  timeReader the reader for the time field of a parsed record
     * @param  messageKey the field to hold the whole message, for the format that does not parse messages
     * @return            the parser
     */
    public static MessageParser parser(String format, RecordTimeReader timeReader, String messageKey) {
        switch (format) {
            case JSON:
                return JsonMessageParser.readingTime(timeReader);
            case LTSV:
                return new LtsvMessageParser(timeReader);
            case NONE:
                return new NoneMessageParser(messageKey);
            default:
                if (isRegex(format)) {
                    return new RegexMessageParser(Pattern.compile(regexBody(format)), timeReader);
                }
                throw new IllegalArgumentException("Unrecognised message format: " + format);
        }
    }

    /**
     * Checks whether a value is a valid message format, or unset.
     *
     * @param  value the value
     * @return       true if the value is a format name, a valid regular expression between slashes, or null
     */
    public static boolean isValidFormatOrNull(String value) {
        if (value == null) {
            return true;
        }
        if (JSON.equals(value) || LTSV.equals(value) || NONE.equals(value)) {
            return true;
        }
        if (!isRegex(value)) {
            return false;
        }
        try {
            Pattern.compile(regexBody(value));
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    /**
     * Checks whether a value is a valid date-time pattern, or unset.
     *
     * @param  value the value
     * @return       true if the value can be used with {@link DateTimeFormatter#ofPattern(String)}, or is null
     */
    public static boolean isValidTimeFormatOrNull(String value) {
        if (value == null) {
            return true;
        }
        try {
            DateTimeFormatter.ofPattern(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isRegex(String format) {
        return format.length() > 2 && format.startsWith("/") && format.endsWith("/");
    }

    private static String regexBody(String format) {
        return format.substring(1, format.length() - 1);
    }
}
