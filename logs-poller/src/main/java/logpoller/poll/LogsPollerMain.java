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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;

import logpoller.client.CloudWatchLogsClientFactory;
import logpoller.core.properties.PollerPropertiesInvalidException;
import logpoller.emit.JsonLinesRecordRouter;
import logpoller.properties.LogsPollerProperties;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static logpoller.core.util.ThreadSleep.threadSleep;
import static logpoller.properties.LogsPollerProperty.FETCH_INTERVAL_IN_SECONDS;
import static logpoller.properties.LogsPollerProperty.LOG_GROUP_NAME;

/**
 * Polls CloudWatch log streams until the process is stopped, writing each record to standard output as a line of
 * JSON. Takes the path to a properties file.
 */
public class LogsPollerMain {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogsPollerMain.class);
    private static final Duration MAX_WAIT_FOR_SHUTDOWN = Duration.ofMinutes(1);

    private LogsPollerMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        if (args.length != 1) {
            System.err.println("Usage: <properties-file>");
            System.exit(1);
            return;
        }
        LogsPollerProperties properties;
        try {
            properties = LogsPollerProperties.loadAndValidate(Path.of(args[0]));
        } catch (PollerPropertiesInvalidException | UncheckedIOException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }
        try (CloudWatchLogsClient cloudWatch = CloudWatchLogsClientFactory.create(properties)) {
            PollScheduler scheduler = PollScheduler.fromProperties(properties, cloudWatch,
                    new JsonLinesRecordRouter(System.out), Instant::now, threadSleep());
            Runtime.getRuntime().addShutdownHook(new Thread(() -> stopAndWait(scheduler), "logs-poller-shutdown"));
            LOGGER.info("Polling log group {} every {} seconds",
                    properties.get(LOG_GROUP_NAME), properties.get(FETCH_INTERVAL_IN_SECONDS));
            scheduler.run();
        }
    }

    private static void stopAndWait(PollScheduler scheduler) {
        scheduler.stop();
        try {
            if (!scheduler.awaitStopped(MAX_WAIT_FOR_SHUTDOWN)) {
                LOGGER.warn("Poll loop did not stop within {}", MAX_WAIT_FOR_SHUTDOWN);
            }
        } catch (InterruptedException e) {
            LOGGER.warn("Interrupted waiting for poll loop to stop");
            Thread.currentThread().interrupt();
        }
    }
}
