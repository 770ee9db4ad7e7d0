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

import java.time.Duration;

/**
 * Waits for a period of time. Replaced in tests to advance a fake clock instead of blocking.
 */
@FunctionalInterface
public interface ThreadSleep {

    /**
     * Wait for the specified period.
     *
     * @param  duration             the period to wait for
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleepFor(Duration duration) throws InterruptedException;

    /**
     * Creates an implementation backed by <code>Thread.sleep</code>.
     *
     * @return the implementation
     */
    static ThreadSleep threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
