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
package logpoller.cursor;

import java.io.IOException;
import java.util.Optional;

/**
 * Holds the position reached in each log stream. A cursor is the continuation token CloudWatch returned with the
 * last page read from the stream. It is opaque, and must be passed back unmodified to read the next page.
 */
public interface CursorStore {

    /**
     * Reads the cursor for a log stream.
     *
     * @param  logStreamName the log stream name
     * @return               the cursor, or an empty optional if the log stream has not been read from yet
     * @throws IOException   if the cursor could not be read
     */
    Optional<String> load(String logStreamName) throws IOException;

    /**
     * Replaces the cursor for a log stream. A reader will see either the old or the new cursor, never part of one.
     *
     * @param  logStreamName the log stream name
     * @param  cursor        the new cursor
     * @throws IOException   if the cursor could not be written
     */
    void save(String logStreamName, String cursor) throws IOException;
}
