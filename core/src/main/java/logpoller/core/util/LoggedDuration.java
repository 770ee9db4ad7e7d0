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
package logpoller.core.util;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Wraps a duration for inclusion in log messages, e.g. "1 minute 2.5 seconds". The string is only built if the
 * logger calls <code>toString</code>, so a message at a disabled level costs nothing to format.
 */
public class LoggedDuration {
    private static final DecimalFormat FORMATTER = new DecimalFormat("0.###", DecimalFormatSymbols.getInstance(Locale.ROOT));
    private final Duration duration;

    private LoggedDuration(Duration duration) {
        this.duration = duration;
    }

    /**
     * Wraps the duration between two times.
     *
     * @param  start the start time
     * @param  end   the end time
     * @return       the wrapped duration
     */
    public static LoggedDuration between(Instant start, Instant end) {
        return of(Duration.between(start, end));
    }

    /**
     * Wraps a duration.
     *
     * @param  duration the duration
     * @return          the wrapped duration
     */
    public static LoggedDuration of(Duration duration) {
        return new LoggedDuration(duration);
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        if (duration.isNegative()) {
            output.append("-");
        }
        Duration abs = duration.abs();
        long seconds = abs.getSeconds();
        if (seconds >= 3600) {
            appendUnit(output, seconds / 3600, "hour");
            seconds %= 3600;
        }
        if (seconds >= 60) {
            appendUnit(output, seconds / 60, "minute");
            seconds %= 60;
        }
        double secondsWithFraction = seconds + abs.getNano() / 1_000_000_000.0;
        output.append(FORMATTER.format(secondsWithFraction)).append(" second");
        if (secondsWithFraction != 1) {
            output.append("s");
        }
        return output.toString();
    }

    private static void appendUnit(StringBuilder output, long amount, String unit) {
        output.append(amount).append(" ").append(unit);
        if (amount > 1) {
            output.append("s");
        }
        output.append(" ");
    }
}
