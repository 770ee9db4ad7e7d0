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
 * Passes each log message through unparsed, as a single field.
 */
public class NoneMessageParser implements MessageParser {

    private final String messageKey;

    public NoneMessageParser(String messageKey) {
        this.messageKey = messageKey;
    }

    @Override
    public List<ParsedMessage> parse(String message) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(messageKey, message);
        return List.of(ParsedMessage.withFields(fields));
    }
}
