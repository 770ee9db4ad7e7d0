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
package logpoller.properties;

import logpoller.core.properties.PollerProperty;
import logpoller.core.properties.PollerPropertyImpl;
import logpoller.core.properties.PollerPropertyIndex;
import logpoller.core.properties.PollerPropertyValueUtils;
import logpoller.emit.parser.MessageFormat;

import java.util.List;
import java.util.Objects;

/**
 * Properties to configure the CloudWatch Logs poller. All properties without a default value are unset unless they
 * are set in the properties file.
 */
public interface LogsPollerProperty {
    PollerProperty TAG = Index.propertyBuilder("logpoller.tag")
            .description("The tag attached to every record passed to the downstream pipeline.")
            .validationPredicate(PollerPropertyValueUtils::isNonNullNonEmptyString).build();
    PollerProperty LOG_GROUP_NAME = Index.propertyBuilder("logpoller.log.group.name")
            .description("The name of the CloudWatch log group to read from.")
            .validationPredicate(PollerPropertyValueUtils::isNonNullNonEmptyString).build();
    PollerProperty LOG_STREAM_NAME = Index.propertyBuilder("logpoller.log.stream.name")
            .description("The name of the log stream to read from. If prefix discovery is enabled, this is used as a " +
                    "prefix to find all log streams to read from.")
            .validationPredicate(PollerPropertyValueUtils::isNonNullNonEmptyString).build();
    PollerProperty USE_LOG_STREAM_NAME_PREFIX = Index.propertyBuilder("logpoller.log.stream.name.prefix.enabled")
            .description("Whether to treat the log stream name as a prefix, and read from every log stream in the " +
                    "group whose name starts with it.")
            .defaultValue("false")
            .validationPredicate(PollerPropertyValueUtils::isTrueOrFalse).build();
    PollerProperty STATE_FILE = Index.propertyBuilder("logpoller.state.file")
            .description("The base path of the files that hold the position reached in each log stream. The file for " +
                    "a log stream is found by appending an underscore and the URL-encoded name of the stream.")
            .validationPredicate(PollerPropertyValueUtils::isNonNullNonEmptyString).build();
    PollerProperty FETCH_INTERVAL_IN_SECONDS = Index.propertyBuilder("logpoller.fetch.interval.seconds")
            .description("The number of seconds between the start of each poll of the log streams.")
            .defaultValue("60")
            .validationPredicate(PollerPropertyValueUtils::isPositiveInteger).build();
    PollerProperty START_DAYS_AGO = Index.propertyBuilder("logpoller.start.days.ago")
            .description("If set, log streams with no recorded position are read from this many days before the " +
                    "poller started, and discovered log streams with no events since then are ignored.")
            .validationPredicate(PollerPropertyValueUtils::isNonNegativeIntegerOrNull).build();
    PollerProperty FETCH_LIMIT = Index.propertyBuilder("logpoller.fetch.limit")
            .description("The maximum number of events to read from a log stream in each poll. If unset, CloudWatch " +
                    "returns as many as fit in a 1MB response, up to 10,000 events.")
            .validationPredicate(value -> PollerPropertyValueUtils.isIntegerInRangeOrNull(value, 1, 10000)).build();
    PollerProperty FORMAT = Index.propertyBuilder("logpoller.format")
            .description("The format used to parse log messages. One of \"json\", \"ltsv\", \"none\", or a regular " +
                    "expression with named groups between slashes, e.g. /^(?<level>\\w+) (?<message>.*)$/.\n" +
                    "If unset, every message is expected to be a JSON object and the record time is taken from the " +
                    "CloudWatch event.")
            .validationPredicate(MessageFormat::isValidFormatOrNull).build();
    PollerProperty FORMAT_TIME_KEY = Index.propertyBuilder("logpoller.format.time.key")
            .description("The field holding the time of a parsed record. Only used when a format is set.")
            .defaultValue("time")
            .validationPredicate(Objects::nonNull).build();
    PollerProperty FORMAT_TIME_FORMAT = Index.propertyBuilder("logpoller.format.time.format")
            .description("The pattern used to read the time field of a parsed record, as accepted by " +
                    "java.time.format.DateTimeFormatter. Times without a zone are read as UTC. If unset, the time " +
                    "field holds seconds since the epoch.")
            .validationPredicate(MessageFormat::isValidTimeFormatOrNull).build();
    PollerProperty FORMAT_MESSAGE_KEY = Index.propertyBuilder("logpoller.format.message.key")
            .description("The field holding the whole log message, when the format is \"none\".")
            .defaultValue("message")
            .validationPredicate(Objects::nonNull).build();
    PollerProperty AWS_REGION = Index.propertyBuilder("logpoller.aws.region")
            .description("The AWS region of the log group. If unset, the default AWS region provider chain is used.")
            .build();
    PollerProperty AWS_ACCESS_KEY_ID = Index.propertyBuilder("logpoller.aws.access.key.id")
            .description("An AWS access key ID to authenticate with, set together with the secret access key. If " +
                    "unset, the default AWS credentials provider chain is used.")
            .build();
    PollerProperty AWS_SECRET_ACCESS_KEY = Index.propertyBuilder("logpoller.aws.secret.access.key")
            .description("The AWS secret access key to authenticate with, set together with the access key ID.")
            .build();
    PollerProperty AWS_ENDPOINT_URL = Index.propertyBuilder("logpoller.aws.endpoint.url")
            .description("A URL to send CloudWatch Logs requests to instead of the AWS endpoint for the region, e.g. " +
                    "for LocalStack.")
            .validationPredicate(PollerPropertyValueUtils::isAbsoluteUriOrNull).build();
    PollerProperty HTTP_PROXY = Index.propertyBuilder("logpoller.http.proxy")
            .description("The URL of an HTTP proxy to connect to CloudWatch through, e.g. http://proxy.example:3128.")
            .validationPredicate(PollerPropertyValueUtils::isAbsoluteUriOrNull).build();

    static List<PollerProperty> getAll() {
        return Index.INSTANCE.getAll();
    }

    static PollerPropertyIndex getIndex() {
        return Index.INSTANCE;
    }

    /**
     * Holds an index of all poller properties.
     */
    class Index {
        private Index() {
        }

        static final PollerPropertyIndex INSTANCE = new PollerPropertyIndex();

        static PollerPropertyImpl.Builder propertyBuilder(String propertyName) {
            return PollerPropertyImpl.named(propertyName)
                    .addToIndex(INSTANCE::add);
        }
    }
}
