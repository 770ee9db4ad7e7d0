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

import java.util.Properties;

/**
 * Holds values for poller configuration properties, backed by a {@link Properties} object. Values are validated
 * against the definitions held in a {@link PollerPropertyIndex}.
 */
public class PollerProperties implements PollerPropertyValues {
    private final PollerPropertyIndex index;
    private final Properties properties;

    public PollerProperties(PollerPropertyIndex index) {
        this(index, new Properties());
    }

    public PollerProperties(PollerPropertyIndex index, Properties properties) {
        this.index = index;
        this.properties = properties;
    }

    /**
     * Validates the values of all properties.
     *
     * @throws PollerPropertiesInvalidException if any value is invalid
     */
    public final void validate() throws PollerPropertiesInvalidException {
        PollerPropertiesValidationReporter reporter = new PollerPropertiesValidationReporter();
        validate(reporter);
        reporter.throwIfFailed();
    }

    /**
     * Validates the values of all properties, and reports any failures to the given reporter. Subclasses may override
     * this to add checks that span more than one property.
     *
     * @param reporter the reporter to receive failures
     */
    public void validate(PollerPropertiesValidationReporter reporter) {
        index.getAll().forEach(property -> {
            String value = get(property);
            if (!property.getValidationPredicate().test(value)) {
                reporter.invalidProperty(property, value);
            }
        });
    }

    @Override
    public String get(PollerProperty property) {
        String value = properties.getProperty(property.getPropertyName());
        if (property.isIgnoreEmptyValue() && "".equals(value)) {
            value = null;
        }
        if (value == null) {
            return property.getDefaultValue();
        }
        return value;
    }

    /**
     * Sets the value of a property.
     *
     * @param property the property
     * @param value    the value
     */
    public void set(PollerProperty property, String value) {
        if (value != null) {
            properties.setProperty(property.getPropertyName(), value);
        }
    }

    /**
     * Checks if a property has been set. Default values do not count as being set.
     *
     * @param  property the property
     * @return          true if the property is set to any value
     */
    public boolean isSet(PollerProperty property) {
        return properties.containsKey(property.getPropertyName()) &&
                !"".equals(properties.getProperty(property.getPropertyName()));
    }
}
