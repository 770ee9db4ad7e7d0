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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A record parsed from a log message.
 */
public class ParsedMessage {

    private final Instant time;
    private final Map<String, Object> fields;

    private ParsedMessage(Instant time, Map<String, Object> fields) {
        this.time = time;
        this.fields = new LinkedHashMap<>(fields);
    }

    /**
     * Creates a record that takes its time from the log event.
     *
     * @param  fields the fields
     * @return        the record
     */
    public static ParsedMessage withFields(Map<String, Object> fields) {
        return new ParsedMessage(null, fields);
    }

    /**
     * Creates a record with a time read from the message.
     *
     * @param  time   the time, or null to take it from the log event
     * @param  fields the fields
     * @return        the record
     */
    public static ParsedMessage withTimeAndFields(Instant time, Map<String, Object> fields) {
        return new ParsedMessage(time, fields);
    }

    public Optional<Instant> getTime() {
        return Optional.ofNullable(time);
    }

    /**
     * Retrieves the fields of the record. The returned map is a copy in field order, which may be modified.
     *
     * @return the fields
     */
    public Map<String, Object> getFields() {
        return new LinkedHashMap<>(fields);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ParsedMessage)) {
            return false;
        }
        ParsedMessage other = (ParsedMessage) obj;
        return Objects.equals(time, other.time) && Objects.equals(fields, other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, fields);
    }

    @Override
    public String toString() {
        return "ParsedMessage{time=" + time + ", fields=" + fields + "}";
    }
}
