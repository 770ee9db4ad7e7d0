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

import com.google.gson.GsonBuilder;
import com.google.gson.ToNumberPolicy;

/**
 * A helper class for common GSON configuration for log records.
 */
public class GsonConfig {

    private GsonConfig() {
    }

    /**
     * Creates a GSON builder preconfigured for log records. Numbers in untyped JSON are read as longs where they are
     * integral, so that values in a record keep their original form when they are written out again.
     *
     * @return the new builder
     */
    public static GsonBuilder standardBuilder() {
        return new GsonBuilder().serializeSpecialFloatingPointValues()
                .disableHtmlEscaping()
                .serializeNulls()
                .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE);
    }
}
