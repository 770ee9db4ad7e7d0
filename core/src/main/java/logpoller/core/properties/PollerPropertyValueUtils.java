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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.function.IntPredicate;

/**
 * Validation predicates for property values.
 */
public class PollerPropertyValueUtils {

    private PollerPropertyValueUtils() {
    }

    public static boolean isPositiveInteger(String integer) {
        return parseAndCheckInteger(integer, num -> num > 0);
    }

    public static boolean isNonNegativeIntegerOrNull(String integer) {
        return integer == null || parseAndCheckInteger(integer, num -> num >= 0);
    }

    /**
     * Checks whether a value is unset, or is an integer in a range.
     *
     * @param  integer the value
     * @param  min     the minimum, inclusive
     * @param  max     the maximum, inclusive
     * @return         true if the value is valid
     */
    public static boolean isIntegerInRangeOrNull(String integer, int min, int max) {
        return integer == null || parseAndCheckInteger(integer, num -> num >= min && num <= max);
    }

    public static boolean isNonNullNonEmptyString(String string) {
        return null != string && !string.isEmpty();
    }

    public static boolean isTrueOrFalse(String string) {
        return "true".equalsIgnoreCase(string) || "false".equalsIgnoreCase(string);
    }

    /**
     * Checks whether a value is unset, or is an absolute URI with a host.
     *
     * @param  uri the value
     * @return     true if the value is valid
     */
    public static boolean isAbsoluteUriOrNull(String uri) {
        if (uri == null) {
            return true;
        }
        try {
            URI parsed = new URI(uri);
            return parsed.isAbsolute() && parsed.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean parseAndCheckInteger(String string, IntPredicate check) {
        if (string == null) {
            return false;
        }
        try {
            return check.test(Integer.parseInt(string));
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
