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
package logpoller.core.properties;

import java.time.Duration;
import java.util.Optional;

/**
 * Provides access to values of poller configuration properties.
 */
@FunctionalInterface
public interface PollerPropertyValues {

    /**
     * Retrieves the value of a property. Please call the getter relevant to the type of the property, see other methods
     * on this class.
     *
     * @param  property the property
     * @return          the value of the property, or null if it is unset
     */
    String get(PollerProperty property);

    /**
     * Retrieves the value of a property which may be unset.
     *
     * @param  property the property
     * @return          the value of the property, if it is set
     */
    default Optional<String> getOptional(PollerProperty property) {
        return Optional.ofNullable(get(property));
    }

    /**
     * Retrieves the value of a boolean property.
     *
     * @param  property the property
     * @return          the value of the property
     */
    default boolean getBoolean(PollerProperty property) {
        return Boolean.parseBoolean(get(property));
    }

    /**
     * Retrieves the value of an integer property.
     *
     * @param  property the property
     * @return          the value of the property
     */
    default int getInt(PollerProperty property) {
        return Integer.parseInt(get(property));
    }

    /**
     * Retrieves the value of a nullable integer property.
     *
     * @param  property the property
     * @return          the value of the property, or null if it is unset
     */
    default Integer getIntOrNull(PollerProperty property) {
        String val = get(property);
        if (val != null) {
            return Integer.parseInt(val);
        } else {
            return null;
        }
    }

    /**
     * Retrieves the value of a property holding a number of seconds.
     *
     * @param  property the property
     * @return          the duration
     */
    default Duration getDurationInSeconds(PollerProperty property) {
        return Duration.ofSeconds(Long.parseLong(get(property)));
    }
}
