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

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A property definition built from a builder. Each property is added to an index when it is built, so that the
 * index can be used to validate all values.
 */
public class PollerPropertyImpl implements PollerProperty {

    private final String propertyName;
    private final String defaultValue;
    private final Predicate<String> validationPredicate;
    private final String description;
    private final boolean ignoreEmptyValue;

    private PollerPropertyImpl(Builder builder) {
        propertyName = Objects.requireNonNull(builder.propertyName, "propertyName must not be null");
        defaultValue = builder.defaultValue;
        validationPredicate = Objects.requireNonNull(builder.validationPredicate, "validationPredicate must not be null");
        description = Objects.requireNonNull(builder.description, "description must not be null");
        ignoreEmptyValue = builder.ignoreEmptyValue;
    }

    public static Builder named(String name) {
        return new Builder().propertyName(name);
    }

    @Override
    public String getPropertyName() {
        return propertyName;
    }

    @Override
    public String getDefaultValue() {
        return defaultValue;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public Predicate<String> getValidationPredicate() {
        return validationPredicate;
    }

    @Override
    public boolean isIgnoreEmptyValue() {
        return ignoreEmptyValue;
    }

    @Override
    public String toString() {
        return propertyName;
    }

    /**
     * Builds a property definition.
     */
    public static final class Builder {
        private String propertyName;
        private String defaultValue;
        private Predicate<String> validationPredicate = s -> true;
        private String description = "No description available";
        private boolean ignoreEmptyValue = true;
        private Consumer<PollerProperty> addToIndex = property -> {
        };

        private Builder() {
        }

        public Builder propertyName(String propertyName) {
            this.propertyName = propertyName;
            return this;
        }

        public Builder defaultValue(String defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder validationPredicate(Predicate<String> validationPredicate) {
            this.validationPredicate = validationPredicate;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder ignoreEmptyValue(boolean ignoreEmptyValue) {
            this.ignoreEmptyValue = ignoreEmptyValue;
            return this;
        }

        public Builder addToIndex(Consumer<PollerProperty> addToIndex) {
            this.addToIndex = addToIndex;
            return this;
        }

        public PollerProperty build() {
            PollerProperty property = new PollerPropertyImpl(this);
            addToIndex.accept(property);
            return property;
        }
    }
}
