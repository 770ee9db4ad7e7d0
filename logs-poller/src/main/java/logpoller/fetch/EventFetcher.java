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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.GetLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.GetLogEventsResponse;

import logpoller.core.properties.PollerPropertyValues;

import java.time.Instant;
import java.util.Optional;

import static logpoller.properties.LogsPollerProperty.FETCH_LIMIT;
import static logpoller.properties.LogsPollerProperty.LOG_GROUP_NAME;

/**
 * Reads one page of events forward from a log stream. Resumes from a cursor if there is one, and otherwise reads
 * from the start time horizon, or from the start of the log stream if there is no horizon. Requests always read from
 * the head, as CloudWatch requires this when resuming from a forward token.
 * <p>
 * Only one request is made per call. Any failure from CloudWatch is thrown to the caller.
 */
public class EventFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventFetcher.class);

    private final CloudWatchLogsClient cloudWatch;
    private final String logGroupName;
    private final Integer limit;

    public EventFetcher(CloudWatchLogsClient cloudWatch, String logGroupName, Integer limit) {
        this.cloudWatch = cloudWatch;
        this.logGroupName = logGroupName;
        this.limit = limit;
    }

    /**
     * Creates a fetcher for the log group set in the poller configuration.
     *
     * @param  properties the poller configuration
     * @param  cloudWatch the CloudWatch Logs client
     * @return            the fetcher
     */
    public static EventFetcher fromProperties(PollerPropertyValues properties, CloudWatchLogsClient cloudWatch) {
        return new EventFetcher(cloudWatch, properties.get(LOG_GROUP_NAME), properties.getIntOrNull(FETCH_LIMIT));
    }

    /**
     * Reads the next page of events from a log stream.
     *
     * @param  logStreamName the log stream name
     * @param  cursor        the cursor to resume from, if the log stream has been read from before
     * @param  horizon       the time to start from if there is no cursor
     * @return               the events and the cursor to read the following page from
     */
    public LogEventsPage fetch(String logStreamName, Optional<String> cursor, StartTimeHorizon horizon) {
        GetLogEventsRequest request = buildRequest(logStreamName, cursor, horizon);
        GetLogEventsResponse response = cloudWatch.getLogEvents(request);
        if (response.nextForwardToken() == null) {
            throw new IllegalStateException("No next forward token returned for log stream " + logStreamName);
        }
        LOGGER.trace("Read {} events from log stream {}, next token {}",
                response.events().size(), logStreamName, response.nextForwardToken());
        return new LogEventsPage(response.events(), response.nextForwardToken());
    }

    private GetLogEventsRequest buildRequest(String logStreamName, Optional<String> cursor, StartTimeHorizon horizon) {
        GetLogEventsRequest.Builder builder = GetLogEventsRequest.builder()
                .logGroupName(logGroupName)
                .logStreamName(logStreamName)
                .startFromHead(true)
                .limit(limit);
        if (cursor.isPresent()) {
            LOGGER.trace("Reading log stream {} from cursor {}", logStreamName, cursor.get());
            builder.nextToken(cursor.get());
        } else {
            Optional<Instant> startTime = horizon.getStartTime();
            LOGGER.trace("Reading log stream {} from start time {}", logStreamName, startTime);
            builder.startTime(startTime.map(Instant::toEpochMilli).orElse(null));
        }
        return builder.build();
    }
}
