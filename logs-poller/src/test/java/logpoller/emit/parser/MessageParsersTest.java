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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MessageParsersTest {

    private final RecordTimeReader epochSeconds = RecordTimeReader.epochSeconds("time");

    @Nested
    class Json {

        @Test
        void shouldReadTimeFromTimeField() {
            MessageParser parser = JsonMessageParser.readingTime(epochSeconds);

            assertThat(parser.parse("{\"time\":1714564800,\"level\":\"INFO\"}")).containsExactly(
                    ParsedMessage.withTimeAndFields(Instant.parse("2024-05-01T12:00:00Z"), Map.of("level", "INFO")));
        }

        @Test
        void shouldReadFractionalEpochSeconds() {
            MessageParser parser = JsonMessageParser.readingTime(epochSeconds);

            assertThat(parser.parse("{\"time\":1714564800.25}")).containsExactly(
                    ParsedMessage.withTimeAndFields(Instant.parse("2024-05-01T12:00:00.250Z"), Map.of()));
        }

        @Test
        void shouldLeaveTimeUnsetWhenFieldIsMissing() {
            MessageParser parser = JsonMessageParser.readingTime(epochSeconds);

            assertThat(parser.parse("{\"level\":\"INFO\"}")).containsExactly(
                    ParsedMessage.withFields(Map.of("level", "INFO")));
        }

        @Test
        void shouldKeepNestedObjects() {
            MessageParser parser = JsonMessageParser.fieldsOnly();

            assertThat(parser.parse("{\"request\":{\"status\":200}}")).containsExactly(
                    ParsedMessage.withFields(Map.of("request", Map.of("status", 200L))));
        }

        @Test
        void shouldFailWhenMessageIsAnArray() {
            MessageParser parser = JsonMessageParser.fieldsOnly();

            assertThatThrownBy(() -> parser.parse("[1,2]"))
                    .isInstanceOf(MessageParseException.class);
        }

        @Test
        void shouldFailWhenNameIsNotQuoted() {
            MessageParser parser = JsonMessageParser.fieldsOnly();

            assertThatThrownBy(() -> parser.parse("{hello: world}"))
                    .isInstanceOf(MessageParseException.class);
        }

        @Test
        void shouldFailWhenStringsUseSingleQuotes() {
            MessageParser parser = JsonMessageParser.fieldsOnly();

            assertThatThrownBy(() -> parser.parse("{'a':'b'}"))
                    .isInstanceOf(MessageParseException.class);
        }

        @Test
        void shouldFailWhenNumberIsNaN() {
            MessageParser parser = JsonMessageParser.fieldsOnly();

            assertThatThrownBy(() -> parser.parse("{\"a\":NaN}"))
                    .isInstanceOf(MessageParseException.class);
        }

        @Test
        void shouldFailWhenNumberIsTooLargeForADouble() {
            MessageParser parser = JsonMessageParser.fieldsOnly();

            assertThatThrownBy(() -> parser.parse("{\"big\":1e400}"))
                    .isInstanceOf(MessageParseException.class);
        }

        @Test
        void shouldFailWhenContentFollowsObject() {
            MessageParser parser = JsonMessageParser.fieldsOnly();

            assertThatThrownBy(() -> parser.parse("{\"a\":1} trailing"))
                    .isInstanceOf(MessageParseException.class);
        }

        @Test
        void shouldFailWhenTimeIsNotANumber() {
            MessageParser parser = JsonMessageParser.readingTime(epochSeconds);

            assertThatThrownBy(() -> parser.parse("{\"time\":\"yesterday\"}"))
                    .isInstanceOf(MessageParseException.class)
                    .hasMessageContaining("yesterday");
        }
    }

    @Nested
    class Ltsv {

        @Test
        void shouldReadLabelledFields() {
            MessageParser parser = new LtsvMessageParser(epochSeconds);

            assertThat(parser.parse("host:127.0.0.1\tpath:/index.html?a=b:c\ttime:1714564800\n")).containsExactly(
                    ParsedMessage.withTimeAndFields(Instant.parse("2024-05-01T12:00:00Z"),
                            Map.of("host", "127.0.0.1", "path", "/index.html?a=b:c")));
        }

        @Test
        void shouldFailWhenFieldHasNoLabel() {
            MessageParser parser = new LtsvMessageParser(epochSeconds);

            assertThatThrownBy(() -> parser.parse("host:a\tnolabel"))
                    .isInstanceOf(MessageParseException.class);
        }
    }

    @Nested
    class None {

        @Test
        void shouldPutWholeMessageInOneField() {
            MessageParser parser = new NoneMessageParser("message");

            assertThat(parser.parse("{\"not\":\"parsed\"}")).containsExactly(
                    ParsedMessage.withFields(Map.of("message", "{\"not\":\"parsed\"}")));
        }
    }

    @Nested
    class Regex {

        @Test
        void shouldReadNamedGroups() {
            MessageParser parser = new RegexMessageParser(
                    Pattern.compile("^(?<level>[A-Z]+) (?<message>.*)$"), epochSeconds);

            assertThat(parser.parse("WARN disk nearly full")).containsExactly(
                    ParsedMessage.withFields(Map.of("level", "WARN", "message", "disk nearly full")));
        }

        @Test
        void shouldReadTimeGroupWithPattern() {
            MessageParser parser = new RegexMessageParser(
                    Pattern.compile("^\\[(?<time>[^\\]]+)\\] (?<message>.*)$"),
                    RecordTimeReader.pattern("time", "yyyy-MM-dd HH:mm:ss"));

            assertThat(parser.parse("[2024-05-01 12:00:00] started")).containsExactly(
                    ParsedMessage.withTimeAndFields(Instant.parse("2024-05-01T12:00:00Z"), Map.of("message", "started")));
        }

        @Test
        void shouldProduceNoRecordWhenMessageDoesNotMatch() {
            MessageParser parser = new RegexMessageParser(Pattern.compile("^(?<level>[A-Z]+) "), epochSeconds);

            assertThat(parser.parse("lowercase message")).isEmpty();
        }

        @Test
        void shouldSkipGroupsThatDidNotParticipate() {
            MessageParser parser = new RegexMessageParser(
                    Pattern.compile("^(?<first>a)?(?<second>b)$"), epochSeconds);

            assertThat(parser.parse("b")).containsExactly(ParsedMessage.withFields(Map.of("second", "b")));
        }

        @Test
        void shouldIgnoreEscapedBracketsWhenFindingGroupNames() {
            RegexMessageParser parser = new RegexMessageParser(
                    Pattern.compile("\\(?<literal>(?<real>x)"), epochSeconds);

            assertThat(parser.getGroupNames()).containsExactly("real");
        }
    }

    @Nested
    class TimeWithZone {

        @Test
        void shouldUseOffsetInTime() {
            RecordTimeReader reader = RecordTimeReader.pattern("time", "yyyy-MM-dd'T'HH:mm:ssXXX");

            assertThat(reader.toParsedMessage(new HashMap<>(Map.of("time", "2024-05-01T13:00:00+01:00"))))
                    .isEqualTo(ParsedMessage.withTimeAndFields(Instant.parse("2024-05-01T12:00:00Z"), Map.of()));
        }

        @Test
        void shouldFailWhenTimeDoesNotMatchPattern() {
            RecordTimeReader reader = RecordTimeReader.pattern("time", "yyyy-MM-dd HH:mm:ss");

            assertThatThrownBy(() -> reader.toParsedMessage(new HashMap<>(Map.of("time", "01/05/2024"))))
                    .isInstanceOf(MessageParseException.class);
        }
    }
}
