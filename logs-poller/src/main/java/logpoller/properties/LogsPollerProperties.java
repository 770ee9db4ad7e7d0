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
package logpoller.properties;

import logpoller.core.properties.PollerProperties;
import logpoller.core.properties.PollerPropertiesInvalidException;
import logpoller.core.properties.PollerPropertiesUtils;
import logpoller.core.properties.PollerPropertiesValidationReporter;

import java.nio.file.Path;
import java.util.Properties;

import static logpoller.properties.LogsPollerProperty.AWS_ACCESS_KEY_ID;
import static logpoller.properties.LogsPollerProperty.AWS_SECRET_ACCESS_KEY;

/**
 * Holds the configuration of a CloudWatch Logs poller.
 */
public class LogsPollerProperties extends PollerProperties {

    public LogsPollerProperties() {
        this(new Properties());
    }

    private LogsPollerProperties(Properties properties) {
        super(LogsPollerProperty.getIndex(), properties);
    }

    /**
     * Loads and validates properties from a file.
     *
     * @param  file                             the properties file
     * @return                                  the properties
     * @throws PollerPropertiesInvalidException if any property is missing or invalid
     */
    public static LogsPollerProperties loadAndValidate(Path file) throws PollerPropertiesInvalidException {
        return createAndValidate(PollerPropertiesUtils.loadProperties(file));
    }

    /**
     * Creates and validates properties from values that have already been loaded.
     *
     * @param  properties                       the property values
     * @return                                  the properties
     * @throws PollerPropertiesInvalidException if any property is missing or invalid
     */
    public static LogsPollerProperties createAndValidate(Properties properties) throws PollerPropertiesInvalidException {
        LogsPollerProperties pollerProperties = new LogsPollerProperties(properties);
        pollerProperties.validate();
        return pollerProperties;
    }

    @Override
    public void validate(PollerPropertiesValidationReporter reporter) {
        super.validate(reporter);
        boolean keyIdSet = get(AWS_ACCESS_KEY_ID) != null;
        boolean secretSet = get(AWS_SECRET_ACCESS_KEY) != null;
        if (keyIdSet && !secretSet) {
            reporter.invalidProperty(AWS_SECRET_ACCESS_KEY, null);
        } else if (secretSet && !keyIdSet) {
            reporter.invalidProperty(AWS_ACCESS_KEY_ID, null);
        }
    }
}
