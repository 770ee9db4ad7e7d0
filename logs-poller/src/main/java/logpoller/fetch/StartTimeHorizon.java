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

import logpoller.core.properties.PollerPropertyValues;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

import static logpoller.properties.LogsPollerProperty.START_DAYS_AGO;

/**
 * The earliest time to read log events from, for a log stream that has not been read from before. Computed once when
 * the poller starts, and never moved as the poller runs.
 */
public class StartTimeHorizon {

    private static final StartTimeHorizon NONE = new StartTimeHorizon(null);

    private final Instant startTime;

    private StartTimeHorizon(Instant startTime) {
        this.startTime = startTime;
    }

    /**
     * Creates a horizon that does not restrict how far back to read.
     *
     * @return the horizon
     */
    public static StartTimeHorizon none() {
        return NONE;
    }

    /**
     * Creates a horizon a number of days before the given time. Truncated to whole seconds.
     *
     * @param  now  the current time
     * @param  days the number of days
     * @return      the horizon
     */
    public static StartTimeHorizon daysBefore(Instant now, int days) {
        return at(now.minus(Duration.ofDays(days)).truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Creates a horizon at a given time.
     *
     * @param  startTime the time
     * @return           the horizon
     */
    public static StartTimeHorizon at(Instant startTime) {
        return new StartTimeHorizon(Objects.requireNonNull(startTime, "startTime must not be null"));
    }

    /**
     * Creates a horizon from the poller configuration, relative to the time the poller started.
     *
     * @param  properties the poller configuration
     * @param  now        the time the poller started
     * @return            the horizon
     */
    public static StartTimeHorizon fromProperties(PollerPropertyValues properties, Instant now) {
        Integer days = properties.getIntOrNull(START_DAYS_AGO);
        if (days == null) {
            return none();
        }
        return daysBefore(now, days);
    }

    public Optional<Instant> getStartTime() {
        return Optional.ofNullable(startTime);
    }

    /**
     * Checks whether a log stream may hold events after the horizon, based on the time of its last event. A log stream
     * with no last event time is treated as having no events after the horizon. If there is no horizon, any log
     * stream may hold events to read.
     *
     * @param  lastEventTimestamp the epoch milliseconds of the last event in the log stream, or null if unknown
     * @return                    true if the log stream should be read
     */
    public boolean mayHaveEventsAfter(Long lastEventTimestamp) {
        if (startTime == null) {
            return true;
        }
        return lastEventTimestamp != null && lastEventTimestamp >= startTime.toEpochMilli();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof StartTimeHorizon)) {
            return false;
        }
        StartTimeHorizon other = (StartTimeHorizon) obj;
        return Objects.equals(startTime, other.startTime);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(startTime);
    }

    @Override
    public String toString() {
        return "StartTimeHorizon{startTime=" + startTime + "}";
    }
}
