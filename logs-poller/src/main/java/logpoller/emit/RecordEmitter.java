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
package logpoller.emit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.cloudwatchlogs.model.OutputLogEvent;

import logpoller.core.properties.PollerPropertyValues;
import logpoller.emit.parser.JsonMessageParser;
import logpoller.emit.parser.MessageFormat;
import logpoller.emit.parser.MessageParseException;
import logpoller.emit.parser.MessageParser;
import logpoller.emit.parser.ParsedMessage;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static logpoller.properties.LogsPollerProperty.TAG;

/**
 * Converts log events into records and passes them downstream. Each record is tagged with the name of the log stream
 * it came from.
 * <p>
 * If a parser is configured, it decides the records made from each message, and the time of each record if it reads
 * one. Otherwise each message is read as a JSON object, and the time is taken from the log event. An event that
 * cannot be parsed or passed downstream is logged and skipped, so that it never holds up the rest of its log stream.
 */
public class RecordEmitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecordEmitter.class);

    public static final String STREAM_KEY = "_stream";

    private final String tag;
    private final MessageParser parser;
    private final RecordRouter router;

    private RecordEmitter(String tag, MessageParser parser, RecordRouter router) {
        this.tag = tag;
        this.parser = parser;
        this.router = router;
    }

    /**
     * Creates an emitter which uses a configured parser.
     *
     * @param  tag    the tag for every record
     * @param  parser the parser
     * @param  router the downstream pipeline
     * @return        the emitter
     */
    public static RecordEmitter withParser(String tag, MessageParser parser, RecordRouter router) {
        return new RecordEmitter(tag, parser, router);
    }

    /**
     * Creates an emitter which reads every message as a JSON object.
     *
     * @param  tag    the tag for every record
     * @param  router the downstream pipeline
     * @return        the emitter
     */
    public static RecordEmitter withJsonMessages(String tag, RecordRouter router) {
        return new RecordEmitter(tag, JsonMessageParser.fieldsOnly(), router);
    }

    /**
     * Creates an emitter from the poller configuration.
     *
     * @param  properties the poller configuration
     * @param  router     the downstream pipeline
     * @return            the emitter
     */
    public static RecordEmitter fromProperties(PollerPropertyValues properties, RecordRouter router) {
        String tag = properties.get(TAG);
        return MessageFormat.parserFromProperties(properties)
                .map(parser -> withParser(tag, parser, router))
                .orElseGet(() -> withJsonMessages(tag, router));
    }

    /**
     * Converts a log event into records and passes them downstream.
     *
     * @param  event         the log event
     * @param  logStreamName the log stream the event was read from, or null to leave it out of the records
     * @return               the number of records passed downstream
     */
    public int emit(OutputLogEvent event, String logStreamName) {
        if (event.message() == null || event.timestamp() == null) {
            LOGGER.warn("Skipping event from log stream {} with no message or timestamp: {}", logStreamName, event);
            return 0;
        }
        List<ParsedMessage> messages;
        try {
            messages = parser.parse(event.message());
        } catch (MessageParseException e) {
            LOGGER.warn("Skipping event from log stream {} at timestamp {}: {}",
                    logStreamName, event.timestamp(), e.getMessage());
            return 0;
        }
        if (messages.isEmpty()) {
            LOGGER.debug("No records parsed from event in log stream {} at timestamp {}", logStreamName, event.timestamp());
        }
        long eventTimeSeconds = Math.floorDiv(event.timestamp(), 1000L);
        int emitted = 0;
        for (ParsedMessage message : messages) {
            Map<String, Object> fields = message.getFields();
            if (logStreamName != null) {
                fields.put(STREAM_KEY, logStreamName);
            }
            long timeSeconds = message.getTime()
                    .map(Instant::getEpochSecond)
                    .orElse(eventTimeSeconds);
            try {
                router.emit(tag, timeSeconds, fields);
                emitted++;
            } catch (RuntimeException e) {
                LOGGER.warn("Skipping record from log stream {} at timestamp {} which could not be passed downstream",
                        logStreamName, event.timestamp(), e);
            }
        }
        return emitted;
    }
}
