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
package logpoller.emit;

import java.util.Map;

/**
 * Receives records read from CloudWatch, for the downstream pipeline.
 */
@FunctionalInterface
public interface RecordRouter {

    /**
     * Passes a record downstream.
     *
     * @param tag              the tag of the record
     * @param eventTimeSeconds the time of the record in seconds since the epoch
     * @param fields           the fields of the record
     */
    void emit(String tag, long eventTimeSeconds, Map<String, Object> fields);
}
