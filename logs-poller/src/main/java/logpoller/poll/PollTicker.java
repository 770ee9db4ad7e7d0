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

import logpoller.core.util.LoggedDuration;
import logpoller.core.util.ThreadSleep;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Waits for scheduled poll times at a fixed interval. The first tick is immediate. Each later tick is scheduled one
 * interval after the previous scheduled time, not after the previous poll finished. If polls fall behind, the missed
 * ticks fire one after another with no wait, and none are skipped.
 * <p>
 * A stop request is checked while waiting, at least once a second.
 */
public class PollTicker {
    private static final Logger LOGGER = LoggerFactory.getLogger(PollTicker.class);
    private static final Duration MAX_WAIT_BETWEEN_STOP_CHECKS = Duration.ofSeconds(1);

    private final Duration interval;
    private final Supplier<Instant> timeSupplier;
    private final ThreadSleep sleep;
    private Instant nextTickTime;

    public PollTicker(Duration interval, Supplier<Instant> timeSupplier, ThreadSleep sleep) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive, found " + interval);
        }
        this.interval = interval;
        this.timeSupplier = timeSupplier;
        this.sleep = sleep;
    }

    /**
     * Waits until the next scheduled poll time.
     *
     * @param  stopRequested        checks whether the poller should stop
     * @return                      true if a poll should start, false if a stop was requested
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public boolean waitForNextTick(BooleanSupplier stopRequested) throws InterruptedException {
        Instant now = timeSupplier.get();
        if (nextTickTime == null) {
            nextTickTime = now;
        }
        while (now.isBefore(nextTickTime)) {
            if (stopRequested.getAsBoolean()) {
                return false;
            }
            Duration remaining = Duration.between(now, nextTickTime);
            LOGGER.trace("Waiting {} until next poll", LoggedDuration.of(remaining));
            sleep.sleepFor(remaining.compareTo(MAX_WAIT_BETWEEN_STOP_CHECKS) < 0 ? remaining : MAX_WAIT_BETWEEN_STOP_CHECKS);
            now = timeSupplier.get();
        }
        if (stopRequested.getAsBoolean()) {
            return false;
        }
        Duration behind = Duration.between(nextTickTime, now);
        if (behind.compareTo(interval) >= 0) {
            LOGGER.warn("Poll is {} behind schedule, starting immediately", LoggedDuration.of(behind));
        }
        nextTickTime = nextTickTime.plus(interval);
        return true;
    }

    /**
     * Retrieves the time the next poll is scheduled for.
     *
     * @return the scheduled time, or an empty optional if no poll has started yet
     */
    public Optional<Instant> getNextTickTime() {
        return Optional.ofNullable(nextTickTime);
    }
}
