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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An index of property definitions. Allows lookup by property name, or listing of all properties in the order in
 * which they were defined.
 */
public class PollerPropertyIndex {

    private final Map<String, PollerProperty> allMap = new HashMap<>();
    private final List<PollerProperty> all = new ArrayList<>();

    /**
     * Adds a property to the index.
     *
     * @param property the property
     */
    public void add(PollerProperty property) {
        if (allMap.putIfAbsent(property.getPropertyName(), property) != null) {
            throw new IllegalArgumentException("Property defined twice: " + property.getPropertyName());
        }
        all.add(property);
    }

    public List<PollerProperty> getAll() {
        return Collections.unmodifiableList(all);
    }

    /**
     * Retrieves a property by its name.
     *
     * @param  propertyName the property name
     * @return              the property, if it exists in the index
     */
    public Optional<PollerProperty> getByName(String propertyName) {
        return Optional.ofNullable(allMap.get(propertyName));
    }
}
