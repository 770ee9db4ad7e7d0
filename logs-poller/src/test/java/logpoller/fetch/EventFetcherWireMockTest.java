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

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatchlogs.model.OutputLogEvent;

import java.time.Instant;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static logpoller.testutil.WiremockTestHelper.logsRequest;
import static logpoller.testutil.WiremockTestHelper.logsRequested;
import static logpoller.testutil.WiremockTestHelper.wiremockLogsClient;

@WireMockTest
public class EventFetcherWireMockTest {

    @Test
    void shouldResumeFromCursor(WireMockRuntimeInfo runtimeInfo) {
        // Given
        stubFor(logsRequest("GetLogEvents").willReturn(aResponse().withStatus(200)
                .withBody("{\"events\": [" +
                        "{\"timestamp\": 1714564800123, \"message\": \"{\\\"hello\\\":\\\"world\\\"}\", \"ingestionTime\": 1714564800200}" +
                        "], \"nextForwardToken\": \"f/00000002\", \"nextBackwardToken\": \"b/00000001\"}")));

        // When
        LogEventsPage page = fetcher(runtimeInfo, 100).fetch("test-stream", Optional.of("f/00000001"),
                StartTimeHorizon.at(Instant.parse("2024-05-01T00:00:00Z")));

        // Then
        assertThat(page.events())
                .extracting(OutputLogEvent::timestamp, OutputLogEvent::message)
                .containsExactly(tuple(1714564800123L, "{\"hello\":\"world\"}"));
        assertThat(page.nextForwardToken()).isEqualTo("f/00000002");
        verify(1, logsRequested("GetLogEvents")
                .withRequestBody(equalToJson("{" +
                        "\"logGroupName\": \"test-group\"," +
                        "\"logStreamName\": \"test-stream\"," +
                        "\"nextToken\": \"f/00000001\"," +
                        "\"limit\": 100," +
                        "\"startFromHead\": true}")));
    }

    @Test
    void shouldSendStartTimeWhenNoCursor(WireMockRuntimeInfo runtimeInfo) {
        // Given
        stubFor(logsRequest("GetLogEvents").willReturn(aResponse().withStatus(200)
                .withBody("{\"events\": [], \"nextForwardToken\": \"f/00000000\", \"nextBackwardToken\": \"b/00000000\"}")));

        // When
        LogEventsPage page = fetcher(runtimeInfo, null).fetch("test-stream", Optional.empty(),
                StartTimeHorizon.at(Instant.parse("2024-05-01T00:00:00Z")));

        // Then
        assertThat(page.events()).isEmpty();
        assertThat(page.nextForwardToken()).isEqualTo("f/00000000");
        verify(1, logsRequested("GetLogEvents")
                .withRequestBody(equalToJson("{" +
                        "\"logGroupName\": \"test-group\"," +
                        "\"logStreamName\": \"test-stream\"," +
                        "\"startTime\": 1714521600000," +
                        "\"startFromHead\": true}")));
    }

    @Test
    void shouldPassOnRejectedRequest(WireMockRuntimeInfo runtimeInfo) {
        // Given
        stubFor(logsRequest("GetLogEvents").willReturn(aResponse().withStatus(400)
                .withBody("{\"__type\": \"InvalidParameterException\", \"message\": \"The specified nextToken is invalid.\"}")));

        // When / Then
        assertThatThrownBy(() -> fetcher(runtimeInfo, null).fetch("test-stream", Optional.of("bad"), StartTimeHorizon.none()))
                .isInstanceOf(SdkException.class)
                .hasMessageContaining("nextToken is invalid");
    }

    private EventFetcher fetcher(WireMockRuntimeInfo runtimeInfo, Integer limit) {
        return new EventFetcher(wiremockLogsClient(runtimeInfo), "test-group", limit);
    }
}
