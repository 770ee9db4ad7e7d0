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

import java.util.List;

/**
 * Parses the body of a log event into records.
 */
@FunctionalInterface
public interface MessageParser {

    /**
     * Parses a log message. A message may produce no records, for example if it does not match the expected format.
     *
     * @param  message                 the message body of a log event
     * @return                         the parsed records
     * @throws MessageParseException if the message is malformed
     */
    List<ParsedMessage> parse(String message);
}
