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

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import logpoller.core.util.GsonConfig;

import java.io.IOException;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses log messages holding a JSON object. Each message produces one record with a field for each property of the
 * object. Messages are read strictly, so unquoted names, single quotes, non-finite numbers and trailing content are
 * all rejected.
 */
public class JsonMessageParser implements MessageParser {
    private static final TypeAdapter<LinkedHashMap<String, Object>> FIELDS_ADAPTER = GsonConfig.standardBuilder().create()
            .getAdapter(new TypeToken<LinkedHashMap<String, Object>>() {
            });

    private final RecordTimeReader timeReader;

    private JsonMessageParser(RecordTimeReader timeReader) {
        this.timeReader = timeReader;
    }

    /**
     * Creates a parser which reads the time of each record from a field of the JSON object.
     *
     * @param  timeReader the reader for the time field
     * @return            the parser
     */
    public static JsonMessageParser readingTime(RecordTimeReader timeReader) {
        return new JsonMessageParser(timeReader);
    }

    /**
     * Creates a parser which leaves every property of the JSON object in the record, with the time taken from the
     * log event.
     *
     * @return the parser
     */
    public static JsonMessageParser fieldsOnly() {
        return new JsonMessageParser(null);
    }

    @Override
    public List<ParsedMessage> parse(String message) {
        Map<String, Object> fields = readObject(message);
        if (timeReader == null) {
            return List.of(ParsedMessage.withFields(fields));
        } else {
            return List.of(timeReader.toParsedMessage(fields));
        }
    }

    private Map<String, Object> readObject(String message) {
        String trimmed = message.strip();
        if (!trimmed.startsWith("{")) {
            throw new MessageParseException("Expected a JSON object, found: " + message);
        }
        try (JsonReader reader = new JsonReader(new StringReader(trimmed))) {
            reader.setLenient(false);
            Map<String, Object> fields = FIELDS_ADAPTER.read(reader);
            if (fields == null) {
                throw new MessageParseException("Expected a JSON object, found: " + message);
            }
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new MessageParseException("Unexpected content after JSON object: " + message);
            }
            return fields;
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new MessageParseException("Could not parse JSON message: " + message, e);
        }
    }
}
