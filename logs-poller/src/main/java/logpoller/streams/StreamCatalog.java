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

import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;

import logpoller.core.properties.PollerPropertyValues;
import logpoller.fetch.StartTimeHorizon;

import java.util.List;

import static logpoller.properties.LogsPollerProperty.LOG_GROUP_NAME;
import static logpoller.properties.LogsPollerProperty.LOG_STREAM_NAME;
import static logpoller.properties.LogsPollerProperty.USE_LOG_STREAM_NAME_PREFIX;

/**
 * Finds the log streams to read from in a poll.
 */
@FunctionalInterface
public interface StreamCatalog {

    /**
     * Finds the names of the log streams to read from. Called once at the start of every poll.
     *
     * @return the log stream names, in the order they should be read
     */
    List<String> resolveLogStreamNames();

    /**
     * Creates a catalog from the poller configuration. Either reads a single fixed log stream, or discovers log
     * streams by a name prefix.
     *
     * @param  properties the poller configuration
     * @param  cloudWatch the CloudWatch Logs client
     * @param  horizon    the start time horizon, used to ignore discovered log streams with no recent events
     * @return            the catalog
     */
    static StreamCatalog fromProperties(PollerPropertyValues properties, CloudWatchLogsClient cloudWatch, StartTimeHorizon horizon) {
        String logStreamName = properties.get(LOG_STREAM_NAME);
        if (properties.getBoolean(USE_LOG_STREAM_NAME_PREFIX)) {
            return new PrefixStreamCatalog(cloudWatch, properties.get(LOG_GROUP_NAME), logStreamName, horizon);
        } else {
            return fixed(logStreamName);
        }
    }

    /**
     * Creates a catalog that always reads a single log stream, without calling CloudWatch.
     *
     * @param  logStreamName the log stream name
     * @return               the catalog
     */
    static StreamCatalog fixed(String logStreamName) {
        List<String> names = List.of(logStreamName);
        return () -> names;
    }
}
