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

import org.junit.jupiter.api.Test;

import logpoller.testutil.FakeClock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PollTickerTest {

    private final Instant startTime = Instant.parse("2024-05-01T12:00:00Z");
    private final FakeClock clock = new FakeClock(startTime);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final PollTicker ticker = new PollTicker(Duration.ofSeconds(60), clock, clock);

    @Test
    void shouldTickImmediatelyTheFirstTime() throws Exception {
        assertThat(ticker.waitForNextTick(stopRequested::get)).isTrue();
        assertThat(clock.getSleeps()).isEmpty();
        assertThat(ticker.getNextTickTime()).contains(startTime.plusSeconds(60));
    }

    @Test
    void shouldWaitOneIntervalFromPreviousScheduledTime() throws Exception {
        // Given
        ticker.waitForNextTick(stopRequested::get);
        clock.advance(Duration.ofSeconds(10));

        // When
        boolean ticked = ticker.waitForNextTick(stopRequested::get);

        // Then
        assertThat(ticked).isTrue();
        assertThat(clock.get()).isEqualTo(startTime.plusSeconds(60));
        assertThat(clock.getSleeps()).hasSize(50)
                .allSatisfy(sleep -> assertThat(sleep).isEqualTo(Duration.ofSeconds(1)));
    }

    @Test
    void shouldSleepForPartialSecondAtEndOfWait() throws Exception {
        // Given
        ticker.waitForNextTick(stopRequested::get);
        clock.advance(Duration.ofMillis(58_500));

        // When
        ticker.waitForNextTick(stopRequested::get);

        // Then
        assertThat(clock.getSleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofMillis(500));
    }

    @Test
    void shouldFireMissedTicksBackToBack() throws Exception {
        // Given
        ticker.waitForNextTick(stopRequested::get);
        clock.advance(Duration.ofSeconds(150));

        // When
        boolean secondTick = ticker.waitForNextTick(stopRequested::get);
        boolean thirdTick = ticker.waitForNextTick(stopRequested::get);

        // Then
        assertThat(secondTick).isTrue();
        assertThat(thirdTick).isTrue();
        assertThat(clock.getSleeps()).isEmpty();
        assertThat(ticker.getNextTickTime()).contains(startTime.plusSeconds(180));
    }

    @Test
    void shouldWaitAgainOnceCaughtUp() throws Exception {
        // Given
        ticker.waitForNextTick(stopRequested::get);
        clock.advance(Duration.ofSeconds(150));
        ticker.waitForNextTick(stopRequested::get);
        ticker.waitForNextTick(stopRequested::get);

        // When
        ticker.waitForNextTick(stopRequested::get);

        // Then
        assertThat(clock.get()).isEqualTo(startTime.plusSeconds(180));
        assertThat(clock.getSleeps()).hasSize(30);
    }

    @Test
    void shouldStopWhileWaiting() throws Exception {
        // Given
        ticker.waitForNextTick(stopRequested::get);
        clock.onSleep(() -> stopRequested.set(true));

        // When
        boolean ticked = ticker.waitForNextTick(stopRequested::get);

        // Then
        assertThat(ticked).isFalse();
        assertThat(clock.getSleeps()).hasSize(1);
    }

    @Test
    void shouldNotTickWhenStopWasRequestedBeforeFirstTick() throws Exception {
        stopRequested.set(true);

        assertThat(ticker.waitForNextTick(stopRequested::get)).isFalse();
    }

    @Test
    void shouldRefuseNonPositiveInterval() {
        assertThatThrownBy(() -> new PollTicker(Duration.ZERO, clock, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
