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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.LogStream;

import logpoller.fetch.StartTimeHorizon;

import java.util.List;

import static java.util.stream.Collectors.toUnmodifiableList;

/**
 * Discovers log streams by a name prefix. If there is a start time horizon, log streams whose last event is before
 * the horizon are ignored, as they cannot hold any events to read.
 */
public class PrefixStreamCatalog implements StreamCatalog {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrefixStreamCatalog.class);

    private final CloudWatchLogsClient cloudWatch;
    private final String logGroupName;
    private final String logStreamNamePrefix;
    private final StartTimeHorizon horizon;

    public PrefixStreamCatalog(CloudWatchLogsClient cloudWatch, String logGroupName, String logStreamNamePrefix, StartTimeHorizon horizon) {
        this.cloudWatch = cloudWatch;
        this.logGroupName = logGroupName;
        this.logStreamNamePrefix = logStreamNamePrefix;
        this.horizon = horizon;
    }

    @Override
    public List<String> resolveLogStreamNames() {
        List<LogStream> logStreams = describeLogStreams();
        LOGGER.debug("Found {} log streams in log group {} with prefix {}",
                logStreams.size(), logGroupName, logStreamNamePrefix);
        return logStreams.stream()
                .map(LogStream::logStreamName)
                .collect(toUnmodifiableList());
    }

    /**
     * Retrieves descriptions of all log streams to read from, paging through results from CloudWatch.
     *
     * @return the log streams
     */
    public List<LogStream> describeLogStreams() {
        return DescribeLogStreamsPages.stream(cloudWatch, logGroupName, logStreamNamePrefix)
                .filter(logStream -> horizon.mayHaveEventsAfter(logStream.lastEventTimestamp()))
                .collect(toUnmodifiableList());
    }
}
