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
package logpoller.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.http.apache.ProxyConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClientBuilder;

import logpoller.core.properties.PollerPropertyValues;

import java.net.URI;

import static logpoller.properties.LogsPollerProperty.AWS_ACCESS_KEY_ID;
import static logpoller.properties.LogsPollerProperty.AWS_ENDPOINT_URL;
import static logpoller.properties.LogsPollerProperty.AWS_REGION;
import static logpoller.properties.LogsPollerProperty.AWS_SECRET_ACCESS_KEY;
import static logpoller.properties.LogsPollerProperty.HTTP_PROXY;

/**
 * Builds a CloudWatch Logs client from the poller configuration. Anything not configured is left to the AWS SDK
 * defaults, i.e. the default region and credentials provider chains.
 */
public class CloudWatchLogsClientFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(CloudWatchLogsClientFactory.class);

    private CloudWatchLogsClientFactory() {
    }

    /**
     * Builds a client from the poller configuration.
     *
     * @param  properties the poller configuration
     * @return            the client
     */
    public static CloudWatchLogsClient create(PollerPropertyValues properties) {
        return configure(CloudWatchLogsClient.builder(), properties).build();
    }

    /**
     * Applies the poller configuration to a client builder.
     *
     * @param  builder    the builder
     * @param  properties the poller configuration
     * @return            the builder
     */
    public static CloudWatchLogsClientBuilder configure(CloudWatchLogsClientBuilder builder, PollerPropertyValues properties) {
        String region = properties.get(AWS_REGION);
        String endpoint = properties.get(AWS_ENDPOINT_URL);
        if (region != null) {
            builder.region(Region.of(region));
        } else if (endpoint != null) {
            builder.region(Region.US_EAST_1);
        }
        if (endpoint != null) {
            LOGGER.info("Sending CloudWatch Logs requests to {}", endpoint);
            builder.endpointOverride(URI.create(endpoint));
        }
        String accessKeyId = properties.get(AWS_ACCESS_KEY_ID);
        String secretAccessKey = properties.get(AWS_SECRET_ACCESS_KEY);
        if (accessKeyId != null && secretAccessKey != null) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(accessKeyId, secretAccessKey)));
        }
        ApacheHttpClient.Builder httpClient = ApacheHttpClient.builder();
        String proxy = properties.get(HTTP_PROXY);
        if (proxy != null) {
            LOGGER.info("Connecting to CloudWatch Logs through proxy {}", proxy);
            httpClient.proxyConfiguration(ProxyConfiguration.builder()
                    .endpoint(URI.create(proxy))
                    .build());
        }
        return builder.httpClientBuilder(httpClient);
    }
}
