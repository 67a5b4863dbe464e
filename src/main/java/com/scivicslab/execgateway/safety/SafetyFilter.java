/*
 * Copyright 2025 devteam@scivics-lab.com
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.scivicslab.execgateway.safety;

import java.util.Map;
import java.util.Optional;

/**
 * Screens user supplied command text, playbook text or variable values
 * before they are executed.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public interface SafetyFilter {

    /**
     * Scans text for a reference to a protected variable.
     *
     * @param text the raw command arguments or playbook content
     * @return the offending variable name, or empty if the text may run
     */
    Optional<String> scan(String text);

    /**
     * Scans every string inside a variable value: map values, list elements
     * and nested combinations of both.
     *
     * @param value a variable value as read from JSON or an inventory
     * @return the first offending variable name, or empty if every string may run
     */
    default Optional<String> scanValue(Object value) {
        if (value instanceof CharSequence) {
            return scan(value.toString());
        }
        if (value instanceof Map) {
            return scanValue(((Map<?, ?>) value).values());
        }
        if (value instanceof Iterable) {
            for (Object element : (Iterable<?>) value) {
                Optional<String> offending = scanValue(element);
                if (offending.isPresent()) {
                    return offending;
                }
            }
        }
        return Optional.empty();
    }
}
