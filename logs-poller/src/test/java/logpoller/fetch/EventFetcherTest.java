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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.cloudwatchlogs.model.GetLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.InvalidParameterException;
import software.amazon.awssdk.services.cloudwatchlogs.model.OutputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceNotFoundException;

import logpoller.testutil.FakeCloudWatchLogs;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static logpoller.testutil.FakeCloudWatchLogs.event;
import static logpoller.testutil.FakeCloudWatchLogs.tokenAt;

public class EventFetcherTest {

    private final FakeCloudWatchLogs cloudWatch = new FakeCloudWatchLogs("test-group");
    private final Instant time = Instant.parse("2024-05-01T12:00:00Z");

    @Nested
    class FirstRead {

        @Test
        void shouldReadFromStartOfLogStreamWithNoHorizon() {
            // Given
            cloudWatch.addEvents("test-stream", event(time, "a"), event(time.plusSeconds(1), "b"));

            // When
            LogEventsPage page = fetcher(null).fetch("test-stream", Optional.empty(), StartTimeHorizon.none());

            // Then
            assertThat(page.events()).extracting(OutputLogEvent::message).containsExactly("a", "b");
            assertThat(page.nextForwardToken()).isEqualTo(tokenAt(2));
            assertThat(onlyRequest()).satisfies(request -> {
                assertThat(request.nextToken()).isNull();
                assertThat(request.startTime()).isNull();
                assertThat(request.startFromHead()).isTrue();
                assertThat(request.logGroupName()).isEqualTo("test-group");
                assertThat(request.logStreamName()).isEqualTo("test-stream");
            });
        }

        @Test
        void shouldReadFromHorizonWhenNoCursorIsSaved() {
            // Given
            cloudWatch.addEvents("test-stream", event(time.minusSeconds(1), "old"), event(time, "new"));

            // When
            LogEventsPage page = fetcher(null).fetch("test-stream", Optional.empty(), StartTimeHorizon.at(time));

            // Then
            assertThat(page.events()).extracting(OutputLogEvent::message).containsExactly("new");
            assertThat(onlyRequest().startTime()).isEqualTo(time.toEpochMilli());
        }

        @Test
        void shouldReturnTokenForEmptyLogStream() {
            // Given
            cloudWatch.createLogStream("test-stream");

            // When
            LogEventsPage page = fetcher(null).fetch("test-stream", Optional.empty(), StartTimeHorizon.none());

            // Then
            assertThat(page.events()).isEmpty();
            assertThat(page.nextForwardToken()).isEqualTo(tokenAt(0));
        }
    }

    @Nested
    class ResumeFromCursor {

        @Test
        void shouldSendCursorAndNoStartTimeEvenWithHorizon() {
            // Given
            cloudWatch.addEvents("test-stream", event(time, "a"), event(time.plusSeconds(1), "b"));

            // When
            LogEventsPage page = fetcher(null).fetch("test-stream", Optional.of(tokenAt(1)),
                    StartTimeHorizon.at(time.plusSeconds(60)));

            // Then
            assertThat(page.events()).extracting(OutputLogEvent::message).containsExactly("b");
            assertThat(onlyRequest()).satisfies(request -> {
                assertThat(request.nextToken()).isEqualTo(tokenAt(1));
                assertThat(request.startTime()).isNull();
                assertThat(request.startFromHead()).isTrue();
            });
        }

        @Test
        void shouldReturnSameTokenWhenNoNewEvents() {
            // Given
            cloudWatch.addEvents("test-stream", event(time, "a"));

            // When
            LogEventsPage page = fetcher(null).fetch("test-stream", Optional.of(tokenAt(1)), StartTimeHorizon.none());

            // Then
            assertThat(page.events()).isEmpty();
            assertThat(page.nextForwardToken()).isEqualTo(tokenAt(1));
        }

        @Test
        void shouldReadOnlyOnePagePerCall() {
            // Given
            cloudWatch.addEvents("test-stream", event(time, "a"), event(time.plusSeconds(1), "b"),
                    event(time.plusSeconds(2), "c"));

            // When
            LogEventsPage page = fetcher(2).fetch("test-stream", Optional.empty(), StartTimeHorizon.none());

            // Then
            assertThat(page.events()).extracting(OutputLogEvent::message).containsExactly("a", "b");
            assertThat(page.nextForwardToken()).isEqualTo(tokenAt(2));
            assertThat(onlyRequest().limit()).isEqualTo(2);
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldPassOnFailureForMissingLogStream() {
            assertThatThrownBy(() -> fetcher(null).fetch("missing-stream", Optional.empty(), StartTimeHorizon.none()))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        void shouldPassOnFailureForRejectedCursor() {
            // Given
            cloudWatch.createLogStream("test-stream");

            // When / Then
            assertThatThrownBy(() -> fetcher(null).fetch("test-stream", Optional.of("corrupt"), StartTimeHorizon.none()))
                    .isInstanceOf(InvalidParameterException.class);
            assertThat(cloudWatch.getLogEventsRequests()).hasSize(1);
        }
    }

    private EventFetcher fetcher(Integer limit) {
        return new EventFetcher(cloudWatch, "test-group", limit);
    }

    private GetLogEventsRequest onlyRequest() {
        assertThat(cloudWatch.getLogEventsRequests()).hasSize(1);
        return cloudWatch.getLogEventsRequests().get(0);
    }
}
