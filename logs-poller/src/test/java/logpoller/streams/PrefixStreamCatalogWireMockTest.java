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
package logpoller.streams;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import org.junit.jupiter.api.Test;

import logpoller.fetch.StartTimeHorizon;

import java.time.Instant;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.notContaining;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static logpoller.testutil.WiremockTestHelper.logsRequest;
import static logpoller.testutil.WiremockTestHelper.logsRequested;
import static logpoller.testutil.WiremockTestHelper.wiremockLogsClient;

@WireMockTest
public class PrefixStreamCatalogWireMockTest {

    @Test
    void shouldFollowNextTokenAndFilterByHorizon(WireMockRuntimeInfo runtimeInfo) {
        // Given
        stubFor(logsRequest("DescribeLogStreams")
                .withRequestBody(notContaining("nextToken"))
                .willReturn(aResponse().withStatus(200)
                        .withBody("{\"logStreams\": [" +
                                "{\"logStreamName\": \"app-1\", \"lastEventTimestamp\": 1714521599999}," +
                                "{\"logStreamName\": \"app-2\", \"lastEventTimestamp\": 1714521600000}" +
                                "], \"nextToken\": \"page-2\"}")));
        stubFor(logsRequest("DescribeLogStreams")
                .withRequestBody(matchingJsonPath("$.nextToken", equalTo("page-2")))
                .willReturn(aResponse().withStatus(200)
                        .withBody("{\"logStreams\": [" +
                                "{\"logStreamName\": \"app-3\"}," +
                                "{\"logStreamName\": \"app-4\", \"lastEventTimestamp\": 1714600000000}" +
                                "]}")));
        PrefixStreamCatalog catalog = new PrefixStreamCatalog(wiremockLogsClient(runtimeInfo), "test-group", "app-",
                StartTimeHorizon.at(Instant.parse("2024-05-01T00:00:00Z")));

        // When / Then
        assertThat(catalog.resolveLogStreamNames()).containsExactly("app-2", "app-4");
        verify(1, logsRequested("DescribeLogStreams")
                .withRequestBody(equalToJson("{\"logGroupName\": \"test-group\", \"logStreamNamePrefix\": \"app-\"}")));
        verify(1, logsRequested("DescribeLogStreams")
                .withRequestBody(equalToJson("{\"logGroupName\": \"test-group\", \"logStreamNamePrefix\": \"app-\", " +
                        "\"nextToken\": \"page-2\"}")));
    }
}
