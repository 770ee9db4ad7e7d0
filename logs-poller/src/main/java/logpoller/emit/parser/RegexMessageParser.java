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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses log messages with a regular expression. Each named group becomes a field of the record. A message that does
 * not match produces no records.
 */
public class RegexMessageParser implements MessageParser {
    private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final Pattern pattern;
    private final List<String> groupNames;
    private final RecordTimeReader timeReader;

    public RegexMessageParser(Pattern pattern, RecordTimeReader timeReader) {
        this.pattern = pattern;
        this.groupNames = findGroupNames(pattern);
        this.timeReader = timeReader;
    }

    @Override
    public List<ParsedMessage> parse(String message) {
        Matcher matcher = pattern.matcher(message);
        if (!matcher.find()) {
            return List.of();
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (String name : groupNames) {
            String value = matcher.group(name);
            if (value != null) {
                fields.put(name, value);
            }
        }
        return List.of(timeReader.toParsedMessage(fields));
    }

    public List<String> getGroupNames() {
        return groupNames;
    }

    private static List<String> findGroupNames(Pattern pattern) {
        Matcher matcher = NAMED_GROUP.matcher(pattern.pattern());
        List<String> names = new ArrayList<>();
        while (matcher.find()) {
            // An escaped bracket is a literal, not a group
            if (!isEscaped(pattern.pattern(), matcher.start())) {
                names.add(matcher.group(1));
            }
        }
        return List.copyOf(names);
    }

    private static boolean isEscaped(String regex, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && regex.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }
}
