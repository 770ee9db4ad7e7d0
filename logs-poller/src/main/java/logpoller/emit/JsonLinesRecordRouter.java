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

import com.google.gson.Gson;
import com.google.gson.JsonObject;

import logpoller.core.util.GsonConfig;

import java.io.PrintStream;
import java.util.Map;

/**
 * Writes each record as a line of JSON, holding the tag, the time and the fields of the record.
 */
public class JsonLinesRecordRouter implements RecordRouter {

    private final Gson gson = GsonConfig.standardBuilder().create();
    private final PrintStream out;

    public JsonLinesRecordRouter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void emit(String tag, long eventTimeSeconds, Map<String, Object> fields) {
        out.println(toJson(tag, eventTimeSeconds, fields));
        out.flush();
    }

    /**
     * Converts a record to a single line of JSON.
     *
     * @param  tag              the tag of the record
     * @param  eventTimeSeconds the time of the record in seconds since the epoch
     * @param  fields           the fields of the record
     * @return                  the JSON
     */
    public String toJson(String tag, long eventTimeSeconds, Map<String, Object> fields) {
        JsonObject json = new JsonObject();
        json.addProperty("tag", tag);
        json.addProperty("time", eventTimeSeconds);
        json.add("record", gson.toJsonTree(fields));
        return gson.toJson(json);
    }
}
