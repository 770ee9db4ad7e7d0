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
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;

import logpoller.core.properties.PollerPropertyValues;
import logpoller.core.util.LoggedDuration;
import logpoller.core.util.ThreadSleep;
import logpoller.cursor.CursorStore;
import logpoller.cursor.FileCursorStore;
import logpoller.emit.RecordEmitter;
import logpoller.emit.RecordRouter;
import logpoller.fetch.EventFetcher;
import logpoller.fetch.StartTimeHorizon;
import logpoller.streams.StreamCatalog;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import static logpoller.properties.LogsPollerProperty.FETCH_INTERVAL_IN_SECONDS;

/**
 * Polls CloudWatch log streams on a fixed schedule. Each poll finds the log streams to read, then polls each one in
 * turn. A failure polling one log stream is logged and does not stop the others. The log streams are polled again at
 * the next scheduled time, from the last saved cursor.
 * <p>
 * The loop runs on a single thread. A stop may be requested from another thread, and is seen between log streams.
 * The poll of a log stream that has already started always finishes.
 */
public class PollScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PollScheduler.class);

    private final StreamCatalog catalog;
    private final LogStreamPoller streamPoller;
    private final PollTicker ticker;
    private final Supplier<Instant> timeSupplier;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);

    public PollScheduler(StreamCatalog catalog, LogStreamPoller streamPoller, PollTicker ticker, Supplier<Instant> timeSupplier) {
        this.catalog = catalog;
        this.streamPoller = streamPoller;
        this.ticker = ticker;
        this.timeSupplier = timeSupplier;
    }

    /**
     * Creates a poller from its configuration. The start time horizon is computed once here, so every log stream
     * without a cursor starts from the same time for the life of the poller.
     *
     * @param  properties   the poller configuration
     * @param  cloudWatch   the CloudWatch Logs client
     * @param  router       the downstream pipeline
     * @param  timeSupplier the clock
     * @param  sleep        the method of waiting between polls
     * @return              the scheduler
     */
    public static PollScheduler fromProperties(
            PollerPropertyValues properties, CloudWatchLogsClient cloudWatch, RecordRouter router,
            Supplier<Instant> timeSupplier, ThreadSleep sleep) {
        return fromProperties(properties, cloudWatch, FileCursorStore.fromProperties(properties), router, timeSupplier, sleep);
    }

    /**
     * Creates a poller from its configuration, with a given cursor store.
     *
     * @param  properties   the poller configuration
     * @param  cloudWatch   the CloudWatch Logs client
     * @param  cursorStore  the cursor store
     * @param  router       the downstream pipeline
     * @param  timeSupplier the clock
     * @param  sleep        the method of waiting between polls
     * @return              the scheduler
     */
    public static PollScheduler fromProperties(
            PollerPropertyValues properties, CloudWatchLogsClient cloudWatch, CursorStore cursorStore,
            RecordRouter router, Supplier<Instant> timeSupplier, ThreadSleep sleep) {
        StartTimeHorizon horizon = StartTimeHorizon.fromProperties(properties, timeSupplier.get());
        LOGGER.info("Log streams with no saved cursor will be read from {}",
                horizon.getStartTime().map(Instant::toString).orElse("the start of the stream"));
        StreamCatalog catalog = StreamCatalog.fromProperties(properties, cloudWatch, horizon);
        LogStreamPoller streamPoller = new LogStreamPoller(cursorStore,
                EventFetcher.fromProperties(properties, cloudWatch),
                RecordEmitter.fromProperties(properties, router),
                horizon);
        Duration interval = properties.getDurationInSeconds(FETCH_INTERVAL_IN_SECONDS);
        return new PollScheduler(catalog, streamPoller, new PollTicker(interval, timeSupplier, sleep), timeSupplier);
    }

    /**
     * Polls at each scheduled time until a stop is requested.
     *
     * @throws InterruptedException if the thread is interrupted while waiting for the next poll
     */
    public void run() throws InterruptedException {
        LOGGER.info("Starting poll loop");
        try {
            while (ticker.waitForNextTick(stopRequested::get)) {
                runCycle();
            }
            LOGGER.info("Poll loop stopped");
        } catch (InterruptedException e) {
            LOGGER.warn("Interrupted while waiting for next poll, stopping poll loop");
            throw e;
        } finally {
            stopped.countDown();
        }
    }

    /**
     * Polls all log streams once.
     *
     * @return a summary of the poll
     */
    public PollCycleSummary runCycle() {
        Instant startTime = timeSupplier.get();
        List<String> logStreamNames;
        try {
            logStreamNames = catalog.resolveLogStreamNames();
        } catch (SdkException e) {
            LOGGER.warn("Failed to find log streams, skipping poll", e);
            return PollCycleSummary.discoveryFailed();
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure finding log streams, skipping poll", e);
            return PollCycleSummary.discoveryFailed();
        }
        List<String> polled = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        int eventsRead = 0;
        boolean stoppedEarly = false;
        for (String logStreamName : logStreamNames) {
            if (stopRequested.get()) {
                LOGGER.info("Stop requested, leaving {} log streams unpolled",
                        logStreamNames.size() - polled.size() - failed.size());
                stoppedEarly = true;
                break;
            }
            try {
                eventsRead += streamPoller.poll(logStreamName);
                polled.add(logStreamName);
            } catch (SdkException e) {
                LOGGER.warn("Failed reading log stream {}, will retry at next poll", logStreamName, e);
                failed.add(logStreamName);
            } catch (IOException e) {
                LOGGER.error("Failed loading or saving cursor for log stream {}", logStreamName, e);
                failed.add(logStreamName);
            } catch (RuntimeException e) {
                LOGGER.error("Unexpected failure polling log stream {}", logStreamName, e);
                failed.add(logStreamName);
            }
        }
        LOGGER.info("Polled {} log streams in {}, read {} events, {} failed",
                polled.size(), LoggedDuration.between(startTime, timeSupplier.get()), eventsRead, failed.size());
        return new PollCycleSummary(polled, failed, eventsRead, stoppedEarly, false);
    }

    /**
     * Requests the poll loop to stop. The loop stops after the log stream currently being polled, or immediately if
     * it is waiting for the next poll.
     */
    public void stop() {
        LOGGER.info("Requesting poll loop to stop");
        stopRequested.set(true);
    }

    /**
     * Waits for the poll loop to stop.
     *
     * @param  timeout              the maximum time to wait
     * @return                      true if the loop stopped, false if the timeout was reached
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
