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

package com.scivicslab.execgateway;

/**
 * Thrown when two host descriptors resolve to the same host name.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class DuplicateHostException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String hostName;

    /**
     * Constructs the exception for the given host name.
     *
     * @param hostName the duplicated host name
     */
    public DuplicateHostException(String hostName) {
        super("Duplicate host in inventory: " + hostName);
        this.hostName = hostName;
    }

    /**
     * Gets the host name that appeared more than once.
     *
     * @return the host name
     */
    public String getHostName() {
        return hostName;
    }
}
