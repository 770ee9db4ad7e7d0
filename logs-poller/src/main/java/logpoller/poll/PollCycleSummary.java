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
package logpoller.poll;

import java.util.List;

/**
 * A summary of one poll of all log streams.
 *
 * @param polledStreams  the log streams that were read and had their cursors saved
 * @param failedStreams  the log streams that failed
 * @param eventsRead     the total number of events read
 * @param stopped        true if a stop was requested before every log stream was polled
 * @param discoveryError true if the log streams could not be found, so no log streams were polled
 */
public record PollCycleSummary(List<String> polledStreams, List<String> failedStreams, int eventsRead,
        boolean stopped, boolean discoveryError) {

    public PollCycleSummary {
        polledStreams = List.copyOf(polledStreams);
        failedStreams = List.copyOf(failedStreams);
    }

    static PollCycleSummary discoveryFailed() {
        return new PollCycleSummary(List.of(), List.of(), 0, false, true);
    }
}
