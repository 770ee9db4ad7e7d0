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
import software.amazon.awssdk.services.cloudwatchlogs.model.OutputLogEvent;

import logpoller.cursor.CursorStore;
import logpoller.emit.RecordEmitter;
import logpoller.fetch.EventFetcher;
import logpoller.fetch.LogEventsPage;
import logpoller.fetch.StartTimeHorizon;

import java.io.IOException;
import java.util.Optional;

/**
 * Polls a single log stream once. Loads the cursor, reads one page of events, passes every event downstream, then
 * saves the cursor for the next page. The cursor is only saved once all events in the page have been passed on.
 */
public class LogStreamPoller {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogStreamPoller.class);

    private final CursorStore cursorStore;
    private final EventFetcher fetcher;
    private final RecordEmitter emitter;
    private final StartTimeHorizon horizon;

    public LogStreamPoller(CursorStore cursorStore, EventFetcher fetcher, RecordEmitter emitter, StartTimeHorizon horizon) {
        this.cursorStore = cursorStore;
        this.fetcher = fetcher;
        this.emitter = emitter;
        this.horizon = horizon;
    }

    /**
     * Reads the next page of events from a log stream and passes them downstream.
     *
     * @param  logStreamName the log stream name
     * @return               the number of events read
     * @throws IOException   if the cursor could not be loaded or saved
     */
    public int poll(String logStreamName) throws IOException {
        Optional<String> cursor = cursorStore.load(logStreamName);
        LogEventsPage page = fetcher.fetch(logStreamName, cursor, horizon);
        int records = 0;
        for (OutputLogEvent event : page.events()) {
            records += emitter.emit(event, logStreamName);
        }
        cursorStore.save(logStreamName, page.nextForwardToken());
        LOGGER.debug("Read {} events from log stream {}, passed {} records downstream",
                page.events().size(), logStreamName, records);
        return page.events().size();
    }
}
