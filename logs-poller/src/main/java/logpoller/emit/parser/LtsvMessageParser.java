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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses log messages in labelled tab-separated values, e.g. {@code host:127.0.0.1<TAB>status:200}. Each message
 * produces one record.
 */
public class LtsvMessageParser implements MessageParser {

    private final RecordTimeReader timeReader;

    public LtsvMessageParser(RecordTimeReader timeReader) {
        this.timeReader = timeReader;
    }

    @Override
    public List<ParsedMessage> parse(String message) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (String pair : message.strip().split("\t")) {
            if (pair.isEmpty()) {
                continue;
            }
            int separator = pair.indexOf(':');
            if (separator < 1) {
                throw new MessageParseException("Expected a label before a colon in LTSV field: " + pair);
            }
            fields.put(pair.substring(0, separator), pair.substring(separator + 1));
        }
        return List.of(timeReader.toParsedMessage(fields));
    }
}
