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
package logpoller.fetch;

import software.amazon.awssdk.services.cloudwatchlogs.model.OutputLogEvent;

import java.util.List;
import java.util.Objects;

/**
 * A single page of events read from a log stream.
 *
 * @param events           the events, in the order CloudWatch returned them
 * @param nextForwardToken the cursor to read the next page from
 */
public record LogEventsPage(List<OutputLogEvent> events, String nextForwardToken) {

    public LogEventsPage {
        events = List.copyOf(events);
        Objects.requireNonNull(nextForwardToken, "nextForwardToken must not be null");
    }
}
