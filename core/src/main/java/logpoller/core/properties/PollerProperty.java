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

import java.util.function.Predicate;

/**
 * Defines a property used in poller configuration. Used to validate values and to describe a single property.
 */
public interface PollerProperty {

    /**
     * Retrieves the name of the property, used to set the value in a properties file.
     *
     * @return the property name
     */
    String getPropertyName();

    /**
     * Retrieves the default value of the property. May be null if the property has no default value, in which case
     * the property is unset unless it is set in the properties file.
     *
     * @return the default value
     */
    String getDefaultValue();

    /**
     * Retrieves a description of the property. Used when reporting on the configuration in a human-readable way.
     *
     * @return the description
     */
    String getDescription();

    /**
     * Retrieves a predicate to check whether a value of this property is valid. Called any time a value is validated.
     * The predicate receives null when the property is unset and has no default.
     *
     * @return the predicate
     */
    default Predicate<String> getValidationPredicate() {
        return s -> true;
    }

    /**
     * Checks whether an empty value of the property should be ignored. If someone sets a property to an empty string,
     * we assume they intended not to set the property at all, and we consider this equivalent.
     *
     * @return true if an empty string is equivalent to no value set for this property
     */
    default boolean isIgnoreEmptyValue() {
        return true;
    }
}
